package com.entity.linking.batch;

import java.util.Objects;

/**
 * Canonical name of one mention; {@code canonicalName} is null when none was obtained.
 */
public record CanonicalNameRow(String mention, String canonicalName) {

    public CanonicalNameRow {
        Objects.requireNonNull(mention, "mention is required");
    }

    public static CanonicalNameRow unresolved(String mention) {
        return new CanonicalNameRow(mention, null);
    }
}
