package com.permit.resolution.rules;

import java.util.List;
import java.util.Objects;

/**
 * Comparison key of a normalized name plus its blocking key.
 * Names that can match each other always share a block key.
 */
public record NameKey(String normalized, String blockKey) {

    public static final NameKey EMPTY = new NameKey("", "");

    public NameKey {
        Objects.requireNonNull(normalized, "normalized is required");
        Objects.requireNonNull(blockKey, "blockKey is required");
    }

    static NameKey of(String normalized) {
        if (normalized.isEmpty()) {
            return EMPTY;
        }
        List<String> tokens = List.of(normalized.split(" "));
        String first = tokens.get(0);
        String last = tokens.get(tokens.size() - 1);
        return new NameKey(normalized, first.charAt(0) + "|" + last);
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }

    public List<String> tokens() {
        return isEmpty() ? List.of() : List.of(normalized.split(" "));
    }
}
