package com.permit.resolution.cascade;

import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.rules.NameKey;

import java.util.Comparator;

/**
 * A validated mention with its comparison key.
 */
public record NormalizedMention(Mention mention, NameKey key) {

    /**
     * Processing order inside a partition: observation time, then source priority,
     * then permit and mention id so that creation order is total.
     */
    public static final Comparator<NormalizedMention> PROCESSING_ORDER =
            Comparator.<NormalizedMention, java.time.Instant>comparing(n -> n.mention().getObservedAt())
                    .thenComparing(n -> n.mention().getSource(), SourceTag.BY_PRIORITY)
                    .thenComparing(n -> n.mention().getPermitId())
                    .thenComparing(n -> n.mention().getMentionId());

    public String spelling() {
        return mention.getRawName().trim().replaceAll("\\s+", " ");
    }
}
