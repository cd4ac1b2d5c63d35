package com.entity.linking.core.model;

import java.util.Objects;

/**
 * A raw text span believed to name an entity, with optional surrounding text.
 * Identity is the (mention, context) pair; the same mention may recur in a batch.
 */
public record EntityMention(String mention, String context) {

    public EntityMention {
        Objects.requireNonNull(mention, "mention is required");
    }

    public static EntityMention of(String mention) {
        return new EntityMention(mention, null);
    }

    public static EntityMention of(String mention, String context) {
        return new EntityMention(mention, context);
    }

    /**
     * Returns true if a non-blank context accompanies the mention.
     */
    public boolean hasContext() {
        return context != null && !context.isBlank();
    }
}
