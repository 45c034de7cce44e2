package com.permit.resolution.core.model;

import java.util.Comparator;

/**
 * Upstream record sources that contribute contact mentions.
 * The rank column is the arbitration order used by the resolution cascade:
 * a lower rank is a higher priority.
 */
public enum SourceTag {
    BUILDING("Building", 0),
    TRADE_PERMIT("TradePermit", 1),
    PLANNING("Planning", 2),
    STREET_USE("StreetUse", 3);

    /**
     * Orders sources from highest to lowest priority.
     */
    public static final Comparator<SourceTag> BY_PRIORITY = Comparator.comparingInt(SourceTag::getRank);

    private final String label;
    private final int rank;

    SourceTag(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Returns true if this source strictly outranks the other.
     */
    public boolean outranks(SourceTag other) {
        return rank < other.rank;
    }

    /**
     * Returns true if this source has the same or a higher priority than the other.
     */
    public boolean atLeast(SourceTag other) {
        return rank <= other.rank;
    }

    /**
     * Parses a source label ("Building") or constant name ("BUILDING"), ignoring case.
     *
     * @throws IllegalArgumentException if the value names no known source
     */
    public static SourceTag fromLabel(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (SourceTag tag : values()) {
                if (tag.label.equalsIgnoreCase(trimmed) || tag.name().equalsIgnoreCase(trimmed)) {
                    return tag;
                }
            }
        }
        throw new IllegalArgumentException("Unknown source: " + value);
    }
}
