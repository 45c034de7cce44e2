package com.permit.resolution.core.model;

import java.util.Locale;

/**
 * Role a contact plays on a permit.
 */
public enum RoleTag {
    APPLICANT,
    ARCHITECT,
    ENGINEER,
    CONSULTANT,
    DESIGNER,
    CONTRACTOR,
    OWNER,
    AGENT,
    REVIEWER,
    OTHER;

    /**
     * Maps an upstream role string to a role tag. Matching is by keyword so that
     * values such as "Structural Engineer" or "Plan Checker" map sensibly.
     * A blank role defaults per source: trade permit contacts are contractors.
     */
    public static RoleTag fromUpstream(String raw, SourceTag source) {
        if (raw == null || raw.isBlank()) {
            return source == SourceTag.TRADE_PERMIT ? CONTRACTOR : OTHER;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (RoleTag tag : values()) {
            if (value.equals(tag.name().toLowerCase(Locale.ROOT))) {
                return tag;
            }
        }
        if (value.contains("review") || value.contains("plan check") || value.contains("checker")) {
            return REVIEWER;
        }
        if (value.contains("applicant")) {
            return APPLICANT;
        }
        if (value.contains("architect")) {
            return ARCHITECT;
        }
        if (value.contains("engineer")) {
            return ENGINEER;
        }
        if (value.contains("consult")) {
            return CONSULTANT;
        }
        if (value.contains("design")) {
            return DESIGNER;
        }
        if (value.contains("contractor") || value.contains("electrician") || value.contains("plumber")) {
            return CONTRACTOR;
        }
        if (value.contains("owner")) {
            return OWNER;
        }
        if (value.contains("agent") || value.contains("expediter") || value.contains("expeditor")) {
            return AGENT;
        }
        return OTHER;
    }
}
