package com.example.catalog.config;

import com.example.catalog.tree.CatalogSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(
        String metadatastoreUri,
        @Valid @DefaultValue Cursor cursor,
        @Valid @DefaultValue ArrayOptions arrays,
        @Valid @DefaultValue Access access,
        @Valid @DefaultValue Remote remote
) {

    public CatalogSettings settings() {
        return new CatalogSettings(cursor.batchSize(), arrays.rowsPerBlock(), arrays.fetchConcurrency());
    }

    public record Cursor(
            @DefaultValue("100") @Min(1) int batchSize
    ) {}

    public record ArrayOptions(
            @DefaultValue("100") @Min(1) int rowsPerBlock,
            @DefaultValue("4") @Min(1) int fetchConcurrency
    ) {}

    /**
     * @param accessLists identity name to allowed run uids, {@code "*"} granting everything
     */
    public record Access(
            @DefaultValue("none") PolicyKind policy,
            Map<String, List<String>> accessLists
    ) {
        public Access {
            accessLists = accessLists == null ? Map.of() : accessLists;
        }
    }

    public enum PolicyKind {
        NONE,
        UNRESTRICTED,
        ALLOW_LIST
    }

    public record Remote(
            String baseUrl,
            @DefaultValue("10000") @Min(1) long timeoutMs
    ) {}
}
