package com.entity.linking.batch;

import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.EntityMention;

import java.util.Objects;

/**
 * Context classification of one (mention, context) pair; {@code contextSignal} is null
 * when no classification was obtained.
 */
public record ContextAnalysisRow(String mention, String context, ContextSignal contextSignal) {

    public ContextAnalysisRow {
        Objects.requireNonNull(mention, "mention is required");
    }

    public static ContextAnalysisRow unresolved(EntityMention entityMention) {
        return new ContextAnalysisRow(entityMention.mention(), entityMention.context(), null);
    }

    public EntityMention toMention() {
        return new EntityMention(mention, context);
    }
}
