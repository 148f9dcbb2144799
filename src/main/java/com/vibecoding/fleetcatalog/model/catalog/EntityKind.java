package com.vibecoding.fleetcatalog.model.catalog;

/**
 * 카탈로그 엔티티 종류
 */
public enum EntityKind {
    DOMAIN("Domain"),
    SYSTEM("System"),
    COMPONENT("Component"),
    RESOURCE("Resource"),
    API("API");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EntityKind fromValue(String value) {
        for (EntityKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}
