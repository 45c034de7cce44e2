package com.permit.resolution.bulk;

import com.permit.resolution.core.model.IdentifierKind;
import com.permit.resolution.core.model.SourceTag;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Where each mention field lives in one source's export.
 *
 * @param source           the source the rows come from
 * @param nameColumns      alternatives for the name, tried in order; each alternative is a
 *                         list of columns joined with a space (e.g. first and last name)
 * @param firmColumn       firm or company column, may be null
 * @param roleColumn       upstream role column
 * @param permitColumn     permit or record id column
 * @param blockColumn      parcel block column, may be null
 * @param lotColumn        parcel lot column, may be null
 * @param observedAtColumn observation timestamp column
 * @param mentionIdColumn  upstream mention id column, may be null
 * @param identifierColumns upstream identifier columns by kind; kinds the source lacks are absent
 */
public record SourceColumnMapping(SourceTag source,
                                  List<List<String>> nameColumns,
                                  String firmColumn,
                                  String roleColumn,
                                  String permitColumn,
                                  String blockColumn,
                                  String lotColumn,
                                  String observedAtColumn,
                                  String mentionIdColumn,
                                  Map<IdentifierKind, String> identifierColumns) {

    public SourceColumnMapping {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(permitColumn, "permitColumn is required");
        Objects.requireNonNull(observedAtColumn, "observedAtColumn is required");
        if (nameColumns == null || nameColumns.isEmpty()) {
            throw new IllegalArgumentException("at least one name column is required");
        }
        nameColumns = nameColumns.stream().map(List::copyOf).toList();
        identifierColumns = identifierColumns == null ? Map.of() : Map.copyOf(identifierColumns);
    }

    /**
     * Standard layout of each source's export.
     */
    public static SourceColumnMapping forSource(SourceTag source) {
        return switch (source) {
            case BUILDING -> new SourceColumnMapping(source,
                    List.of(List.of("first_name", "last_name"), List.of("name")),
                    "firm_name", "role", "permit_number", "block", "lot", "observed_at", "mention_id",
                    Map.of(IdentifierKind.AGENT_ID, "pts_agent_id",
                            IdentifierKind.LICENSE_NUMBER, "license1",
                            IdentifierKind.BUSINESS_LICENSE, "sf_business_license_number"));
            case TRADE_PERMIT -> new SourceColumnMapping(source,
                    List.of(List.of("company_name"), List.of("firm_name")),
                    "firm_name", "contact_type", "permit_number", "block", "lot", "observed_at", "mention_id",
                    Map.of(IdentifierKind.LICENSE_NUMBER, "license_number",
                            IdentifierKind.BUSINESS_LICENSE, "sf_business_license_number"));
            case PLANNING -> new SourceColumnMapping(source,
                    List.of(List.of("name")),
                    "firm_name", "role", "record_id", "block", "lot", "observed_at", "mention_id", Map.of());
            case STREET_USE -> new SourceColumnMapping(source,
                    List.of(List.of("name")),
                    "firm_name", "role", "permit_number", null, null, "observed_at", "mention_id", Map.of());
        };
    }
}
