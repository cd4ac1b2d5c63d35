package com.entity.linking.core.model;

import java.util.Locale;

/**
 * Coarse entity categories a context classification can produce.
 */
public enum EntityCategory {
    PERSON("person"),
    COMPANY("company"),
    PLACE("place"),
    PRODUCT("product"),
    CONCEPT("concept"),
    OTHER("other");

    private final String label;

    EntityCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Lenient lookup by label. Unknown or missing labels map to {@link #OTHER}.
     */
    public static EntityCategory fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (EntityCategory category : values()) {
            if (category.label.equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }
}
