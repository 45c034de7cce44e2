package com.permit.resolution.bulk;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.ParcelId;
import com.permit.resolution.core.model.RoleTag;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns one row, seen as a column lookup, into a mention. Shared by the CSV and JSON importers.
 */
class MentionRowMapper {

    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final SourceColumnMapping mapping;

    MentionRowMapper(SourceColumnMapping mapping) {
        this.mapping = mapping;
    }

    /**
     * @param field column name to trimmed value; empty when absent or blank
     * @throws IllegalArgumentException if the row has no usable observation timestamp
     */
    Mention toMention(Function<String, Optional<String>> field) {
        String observedAt = column(field, mapping.observedAtColumn())
                .orElseThrow(() -> new IllegalArgumentException(mapping.observedAtColumn() + " is required"));

        Mention.Builder builder = Mention.builder()
                .source(mapping.source())
                .rawName(name(field))
                .role(RoleTag.fromUpstream(column(field, mapping.roleColumn()).orElse(null), mapping.source()))
                .permitId(column(field, mapping.permitColumn()).orElse(null))
                .observedAt(parseTimestamp(observedAt));
        column(field, mapping.firmColumn()).ifPresent(builder::firmName);
        column(field, mapping.mentionIdColumn()).ifPresent(builder::mentionId);
        mapping.identifierColumns().forEach((kind, column) -> column(field, column)
                .flatMap(value -> ContactIdentifier.of(kind, value))
                .ifPresent(builder::identifier));

        Optional<String> block = column(field, mapping.blockColumn());
        Optional<String> lot = column(field, mapping.lotColumn());
        if (block.isPresent() && lot.isPresent()) {
            builder.parcelId(new ParcelId(block.get(), lot.get()));
        }
        return builder.build();
    }

    /**
     * First name alternative with at least one non-blank column, or empty. An empty
     * name is still imported; the cascade counts it as skipped.
     */
    String name(Function<String, Optional<String>> field) {
        for (List<String> alternative : mapping.nameColumns()) {
            List<String> parts = new ArrayList<>();
            for (String column : alternative) {
                column(field, column).ifPresent(parts::add);
            }
            if (!parts.isEmpty()) {
                return String.join(" ", parts);
            }
        }
        return "";
    }

    /**
     * Accepts ISO instants with an offset, local date-times and plain dates; local values are UTC.
     */
    static Instant parseTimestamp(String value) {
        try {
            TemporalAccessor parsed = TIMESTAMP.parseBest(value, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            if (parsed instanceof LocalDateTime local) {
                return local.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp '" + value + "'", e);
        }
    }

    private static Optional<String> column(Function<String, Optional<String>> field, String column) {
        if (column == null) {
            return Optional.empty();
        }
        return field.apply(column).map(String::trim).filter(v -> !v.isEmpty());
    }
}
