package com.pgbranch.capture.catalog;

public enum IdentityMode {
    ALWAYS,
    BY_DEFAULT,
    NONE;

    /** Maps {@code pg_attribute.attidentity}. */
    public static IdentityMode fromCode(String code) {
        if (code == null || code.isEmpty()) return NONE;
        return switch (code.charAt(0)) {
            case 'a' -> ALWAYS;
            case 'd' -> BY_DEFAULT;
            default -> NONE;
        };
    }
}
