package com.example.catalog.query;

/**
 * Extension point for intents beyond the built-in ones.
 */
public non-sealed interface CustomQuery extends CatalogQuery {
}
