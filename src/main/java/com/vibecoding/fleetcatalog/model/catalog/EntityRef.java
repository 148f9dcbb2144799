package com.vibecoding.fleetcatalog.model.catalog;

import java.util.Locale;

/**
 * 엔티티 참조 문자열 ("kind:namespace/name")
 */
public final class EntityRef {

    private EntityRef() {
    }

    public static String of(EntityKind kind, String namespace, String name) {
        return of(kind.getValue(), namespace, name);
    }

    public static String of(String kind, String namespace, String name) {
        return kind.toLowerCase(Locale.ROOT) + ":" + namespace + "/" + name;
    }
}
