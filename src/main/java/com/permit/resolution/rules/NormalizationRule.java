package com.permit.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to contact names before comparison. Patterns are
 * case-insensitive; lower priority numbers run first.
 *
 * @param name        unique rule name, used to remove a rule from an engine
 * @param pattern     compiled match
 * @param replacement replacement text, may reference groups
 * @param priority    run order
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Deletes every match.
     */
    public static NormalizationRule strip(String name, String regex, int priority) {
        return rewrite(name, regex, "", priority);
    }

    public static NormalizationRule rewrite(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement, priority);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    /**
     * Rules are identified by name; {@link Pattern} has no value equality.
     */
    @Override
    public boolean equals(Object o) {
        return o instanceof NormalizationRule other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizationRule{name='" + name + "', pattern=" + pattern.pattern() + ", priority=" + priority + '}';
    }
}
