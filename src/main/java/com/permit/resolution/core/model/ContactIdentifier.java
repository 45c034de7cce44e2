package com.permit.resolution.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed upstream identifier. Values are trimmed and upper-cased, so
 * {@code " c-10 123"} and {@code "C-10 123"} are the same license.
 */
public record ContactIdentifier(IdentifierKind kind, String value) implements Comparable<ContactIdentifier> {

    private static final Comparator<ContactIdentifier> ORDER =
            Comparator.comparing(ContactIdentifier::kind).thenComparing(ContactIdentifier::value);

    public ContactIdentifier {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(value, "value is required");
        value = value.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("identifier value must not be blank");
        }
    }

    /**
     * Empty for a null or blank upstream value.
     */
    public static Optional<ContactIdentifier> of(IdentifierKind kind, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ContactIdentifier(kind, value));
    }

    @Override
    public int compareTo(ContactIdentifier other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value;
    }
}
