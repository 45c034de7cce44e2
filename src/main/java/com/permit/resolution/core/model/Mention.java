package com.permit.resolution.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * One raw observation of a contact name on one permit from one source.
 * Mentions are immutable and append-only; the name and permit id are kept exactly
 * as ingested, so a mention may be malformed and is only validated by the cascade.
 */
public final class Mention {
    private final String mentionId;
    private final SourceTag source;
    private final String rawName;
    private final String firmName;
    private final RoleTag role;
    private final String permitId;
    private final ParcelId parcelId;
    private final Instant observedAt;
    private final SortedSet<ContactIdentifier> identifiers;

    private Mention(Builder builder) {
        this.source = builder.source;
        this.rawName = builder.rawName;
        this.firmName = builder.firmName;
        this.role = builder.role != null ? builder.role : RoleTag.fromUpstream(null, builder.source);
        this.permitId = builder.permitId;
        this.parcelId = builder.parcelId;
        this.observedAt = builder.observedAt;
        this.identifiers = Collections.unmodifiableSortedSet(new TreeSet<>(builder.identifiers));
        this.mentionId = builder.mentionId != null && !builder.mentionId.isBlank()
                ? builder.mentionId
                : deriveId(source, permitId, rawName, role, observedAt);
    }

    private static String deriveId(SourceTag source, String permitId, String rawName, RoleTag role, Instant observedAt) {
        String seed = source.name() + '|' + permitId + '|' + rawName + '|' + role.name() + '|' + observedAt;
        return "m-" + UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    public String getMentionId() {
        return mentionId;
    }

    public SourceTag getSource() {
        return source;
    }

    public String getRawName() {
        return rawName;
    }

    public Optional<String> getFirmName() {
        return Optional.ofNullable(firmName).filter(f -> !f.isBlank());
    }

    public RoleTag getRole() {
        return role;
    }

    public String getPermitId() {
        return permitId;
    }

    public Optional<ParcelId> getParcelId() {
        return Optional.ofNullable(parcelId);
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    /**
     * Upstream identifiers carried by the row, in matching priority order.
     */
    public SortedSet<ContactIdentifier> getIdentifiers() {
        return identifiers;
    }

    public boolean hasPermitId() {
        return permitId != null && !permitId.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return mentionId.equals(((Mention) o).mentionId);
    }

    @Override
    public int hashCode() {
        return mentionId.hashCode();
    }

    @Override
    public String toString() {
        return "Mention{" +
                "id='" + mentionId + '\'' +
                ", source=" + source +
                ", name='" + rawName + '\'' +
                ", role=" + role +
                ", permit='" + permitId + '\'' +
                ", observedAt=" + observedAt +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String mentionId;
        private SourceTag source;
        private String rawName;
        private String firmName;
        private RoleTag role;
        private String permitId;
        private ParcelId parcelId;
        private Instant observedAt;
        private final SortedSet<ContactIdentifier> identifiers = new TreeSet<>();

        public Builder mentionId(String mentionId) {
            this.mentionId = mentionId;
            return this;
        }

        public Builder source(SourceTag source) {
            this.source = source;
            return this;
        }

        public Builder rawName(String rawName) {
            this.rawName = rawName;
            return this;
        }

        public Builder firmName(String firmName) {
            this.firmName = firmName;
            return this;
        }

        public Builder role(RoleTag role) {
            this.role = role;
            return this;
        }

        public Builder permitId(String permitId) {
            this.permitId = permitId;
            return this;
        }

        public Builder parcelId(ParcelId parcelId) {
            this.parcelId = parcelId;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder agentId(String agentId) {
            ContactIdentifier.of(IdentifierKind.AGENT_ID, agentId).ifPresent(identifiers::add);
            return this;
        }

        public Builder licenseNumber(String licenseNumber) {
            ContactIdentifier.of(IdentifierKind.LICENSE_NUMBER, licenseNumber).ifPresent(identifiers::add);
            return this;
        }

        public Builder businessLicense(String businessLicense) {
            ContactIdentifier.of(IdentifierKind.BUSINESS_LICENSE, businessLicense).ifPresent(identifiers::add);
            return this;
        }

        public Builder identifier(ContactIdentifier identifier) {
            identifiers.add(Objects.requireNonNull(identifier, "identifier"));
            return this;
        }

        public Mention build() {
            Objects.requireNonNull(source, "source is required");
            Objects.requireNonNull(observedAt, "observedAt is required");
            return new Mention(this);
        }
    }
}
