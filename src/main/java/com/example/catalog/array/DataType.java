package com.example.catalog.array;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Fixed-size element types. Elements are stored little-endian.
 */
public enum DataType {
    BOOL(1, "|b1"),
    INT8(1, "|i1"),
    UINT8(1, "|u1"),
    INT16(2, "<i2"),
    INT32(4, "<i4"),
    INT64(8, "<i8"),
    FLOAT32(4, "<f4"),
    FLOAT64(8, "<f8");

    private final int itemSize;
    private final String code;

    DataType(int itemSize, String code) {
        this.itemSize = itemSize;
        this.code = code;
    }

    public int itemSize() {
        return itemSize;
    }

    /**
     * numpy-style type string, e.g. {@code <f8}.
     */
    public String code() {
        return code;
    }

    /**
     * Accepts event descriptor kinds ({@code number}, {@code integer}, {@code boolean}), type names
     * ({@code float64}) and numpy-style codes ({@code <f8}, {@code |u1}).
     */
    public static DataType parse(String dtype) {
        if (dtype == null || dtype.isBlank()) {
            throw new IllegalArgumentException("dtype must not be blank");
        }
        String s = dtype.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "number":
                return FLOAT64;
            case "integer":
                return INT64;
            case "boolean":
            case "bool":
                return BOOL;
            default:
                break;
        }
        for (DataType t : values()) {
            if (t.name().toLowerCase(Locale.ROOT).equals(s) || t.code.equals(s)) {
                return t;
            }
        }
        // byte order marks other than little-endian/not-applicable are not supported
        if (s.length() > 1 && (s.charAt(0) == '=' || s.charAt(0) == '<' || s.charAt(0) == '|')) {
            String bare = s.substring(1);
            for (DataType t : values()) {
                if (t.code.substring(1).equals(bare)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("unsupported dtype " + dtype);
    }

    /**
     * Writes one element at the buffer position. Numbers are narrowed. A boolean slot stores 1 for true or any non-zero number.
     */
    public void write(ByteBuffer buf, Object value) {
        switch (this) {
            case BOOL -> buf.put((byte) (truthy(value) ? 1 : 0));
            case INT8, UINT8 -> buf.put(((Number) value).byteValue());
            case INT16 -> buf.putShort(((Number) value).shortValue());
            case INT32 -> buf.putInt(((Number) value).intValue());
            case INT64 -> buf.putLong(((Number) value).longValue());
            case FLOAT32 -> buf.putFloat(((Number) value).floatValue());
            case FLOAT64 -> buf.putDouble(((Number) value).doubleValue());
        }
    }

    private static boolean truthy(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return Boolean.TRUE.equals(value);
    }

    double getDouble(ByteBuffer buf, int byteOffset) {
        return switch (this) {
            case BOOL, INT8 -> buf.get(byteOffset);
            case UINT8 -> Byte.toUnsignedInt(buf.get(byteOffset));
            case INT16 -> buf.getShort(byteOffset);
            case INT32 -> buf.getInt(byteOffset);
            case INT64 -> buf.getLong(byteOffset);
            case FLOAT32 -> buf.getFloat(byteOffset);
            case FLOAT64 -> buf.getDouble(byteOffset);
        };
    }

    long getLong(ByteBuffer buf, int byteOffset) {
        return switch (this) {
            case BOOL, INT8 -> buf.get(byteOffset);
            case UINT8 -> Byte.toUnsignedInt(buf.get(byteOffset));
            case INT16 -> buf.getShort(byteOffset);
            case INT32 -> buf.getInt(byteOffset);
            case INT64 -> buf.getLong(byteOffset);
            case FLOAT32 -> (long) buf.getFloat(byteOffset);
            case FLOAT64 -> (long) buf.getDouble(byteOffset);
        };
    }
}
