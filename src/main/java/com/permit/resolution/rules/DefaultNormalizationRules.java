package com.permit.resolution.rules;

import java.util.List;

/**
 * Built-in rules for permit contact names, which mix people ("Doe, Jane") and
 * firms ("Acme Builders, Inc.") in the same column.
 */
public final class DefaultNormalizationRules {

    private static final String SUFFIX_SEPARATOR = "(,\\s*|\\s+)";

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getTradeNameRules());
        engine.addRules(getPersonRules());
        engine.addRules(getFirmRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Keeps the legal name of "X dba Y" style entries.
     */
    public static List<NormalizationRule> getTradeNameRules() {
        return List.of(
                NormalizationRule.strip("firm-dba", "\\s+(d\\s*/?\\s*b\\s*/?\\s*a\\.?|doing business as)\\s+.*$", 5)
        );
    }

    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.strip("person-title", "^(Mr|Mrs|Ms|Miss|Dr)\\.?\\s+", 10),
                NormalizationRule.strip("person-generation", SUFFIX_SEPARATOR + "(Jr\\.?|Sr\\.?|Junior|Senior|II|III|IV)$", 10),
                NormalizationRule.strip("person-credential", SUFFIX_SEPARATOR + "(P\\.?E\\.?|AIA|S\\.?E\\.?)$", 11)
        );
    }

    /**
     * Legal-form suffixes, ordered so that "Co., Inc." style chains strip fully.
     */
    public static List<NormalizationRule> getFirmRules() {
        return List.of(
                firmSuffix("firm-inc", "Inc\\.?|Incorporated", 12),
                firmSuffix("firm-llc", "LLC|L\\.L\\.C\\.?", 12),
                firmSuffix("firm-pllc", "PLLC|P\\.L\\.L\\.C\\.?", 12),
                firmSuffix("firm-llp", "LLP|L\\.L\\.P\\.?", 12),
                firmSuffix("firm-ltd", "Ltd\\.?|Limited", 12),
                firmSuffix("firm-corp", "Corp\\.?|Corporation", 13),
                firmSuffix("firm-lp", "LP|L\\.P\\.?", 13),
                firmSuffix("firm-pc", "PC|P\\.C\\.?", 13),
                firmSuffix("firm-co", "Co\\.?|Company", 14),
                NormalizationRule.strip("firm-the", "^The\\s+", 20)
        );
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // "Doe, Jane" -> "Jane Doe"; runs after suffix stripping removed ", Inc" style commas
                NormalizationRule.rewrite("common-last-first", "^\\s*([^,]+?)\\s*,\\s*([^,]+?)\\s*$", "$2 $1", 30),
                NormalizationRule.rewrite("common-ampersand", "\\s*&\\s*", " ", 50),
                NormalizationRule.rewrite("common-and", "\\s+and\\s+", " ", 50),
                NormalizationRule.rewrite("common-punctuation", "[^\\p{L}\\p{N}\\s]", " ", 100),
                NormalizationRule.rewrite("common-collapse-spaces", "\\s+", " ", 200)
        );
    }

    private static NormalizationRule firmSuffix(String name, String alternatives, int priority) {
        return NormalizationRule.strip(name, SUFFIX_SEPARATOR + "(" + alternatives + ")$", priority);
    }
}
