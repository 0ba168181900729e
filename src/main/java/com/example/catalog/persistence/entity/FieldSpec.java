package com.example.catalog.persistence.entity;

import org.bson.Document;

import java.util.List;
import java.util.Set;

/**
 * One entry of a descriptor's {@code data_keys}: element type and per-event shape ({@code []} for scalars).
 */
public record FieldSpec(String dtype, List<Integer> shape) {

    // json-schema style types; the numpy spelling, when recorded, is more precise
    private static final Set<String> GENERIC = Set.of("array", "number", "integer");

    public FieldSpec {
        shape = shape == null ? List.of() : List.copyOf(shape);
    }

    public static FieldSpec from(Document dataKey) {
        List<Integer> shape = dataKey.getList("shape", Integer.class, List.of());
        String dtype = dataKey.getString("dtype");
        if (dtype != null && GENERIC.contains(dtype)) {
            for (String detail : List.of("dtype_str", "dtype_numpy")) {
                if (dataKey.get(detail) instanceof String numpy && !numpy.isBlank()) {
                    dtype = numpy;
                    break;
                }
            }
        }
        return new FieldSpec(dtype, shape);
    }
}
