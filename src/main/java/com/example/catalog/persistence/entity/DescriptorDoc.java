package com.example.catalog.persistence.entity;

import org.bson.Document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event descriptor: the schema of one batch of events in a stream.
 */
public record DescriptorDoc(
        String uid,
        String name,
        String runStart,
        Map<String, FieldSpec> dataKeys,
        Document raw
) {
    public DescriptorDoc {
        dataKeys = Collections.unmodifiableMap(new LinkedHashMap<>(dataKeys));
    }

    public static DescriptorDoc from(Document doc) {
        Map<String, FieldSpec> dataKeys = new LinkedHashMap<>();
        Document keys = doc.get("data_keys", Document.class);
        if (keys != null) {
            keys.forEach((field, spec) -> dataKeys.put(field, FieldSpec.from((Document) spec)));
        }
        return new DescriptorDoc(
                doc.getString("uid"),
                doc.getString("name"),
                doc.getString("run_start"),
                dataKeys,
                doc
        );
    }
}
