package com.componentwatch.monitor.model;

import java.util.Locale;

public enum IdentifierType {
    ATTRIBUTE,
    CLASS,
    ID;

    /**
     * Resolves the {@code identifier_type} value of a configuration file. The alias attribute
     * names themselves are accepted as {@link #ATTRIBUTE}.
     *
     * @return the matching type, or {@code null} when the value is unknown
     */
    public static IdentifierType fromConfigValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "attribute", "data-testid", "data-test-id" -> ATTRIBUTE;
            case "class" -> CLASS;
            case "id" -> ID;
            default -> null;
        };
    }
}
