package com.dtsxarchitect.core.model;

import java.util.Optional;

/**
 * Declared type codes used by variables and parameters.
 */
public enum SsisDataType {
    INT16(2),
    INT32(3),
    SINGLE(4),
    DOUBLE(5),
    CURRENCY(6),
    DATETIME(7),
    STRING(8),
    BOOLEAN(11),
    OBJECT(13),
    DECIMAL(14),
    INT8(16),
    UINT8(17),
    UINT16(18),
    UINT32(19),
    INT64(20),
    UINT64(21),
    GUID(72),
    BYTES(128),
    WSTRING(129),
    NUMERIC(131),
    DBTIMESTAMP(135);

    /** Type code assumed when a document omits or garbles the declared type. */
    public static final int DEFAULT_CODE = 8;

    private final int code;

    SsisDataType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks up a type by its numeric code.
     *
     * @param code declared type code
     * @return matching type, or empty for unknown codes
     */
    public static Optional<SsisDataType> fromCode(int code) {
        for (SsisDataType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Formats a type code for display, e.g. {@code String (8)} or {@code 99} when unknown.
     *
     * @param code declared type code
     * @return display label
     */
    public static String describe(int code) {
        return fromCode(code)
            .map(type -> type.label() + " (" + code + ")")
            .orElse(String.valueOf(code));
    }

    private String label() {
        String lower = name().toLowerCase();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
