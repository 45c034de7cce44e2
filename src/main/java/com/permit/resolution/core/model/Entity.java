package com.permit.resolution.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical real-world person or firm resolved from one or more mentions.
 *
 * <p>Instances are immutable. The cascade derives an updated copy with {@link #toBuilder()}
 * and publishes it at commit time, so readers always hold a consistent record.</p>
 */
public final class Entity {
    private final String entityId;
    private final String canonicalName;
    private final String canonicalFirm;
    private final String normalizedKey;
    private final String blockKey;
    private final Set<SourceTag> sourceTags;
    private final SortedSet<String> permitIds;
    private final SortedMap<String, Integer> spellings;
    private final SortedSet<ContactIdentifier> identifiers;
    private final Instant lastActivityAt;
    private final SourceTag canonicalSource;
    private final Instant canonicalObservedAt;
    private final int qualityScore;
    private final QualityEvidence qualityEvidence;

    private Entity(Builder builder) {
        this.entityId = builder.entityId;
        this.canonicalName = builder.canonicalName;
        this.canonicalFirm = builder.canonicalFirm;
        this.normalizedKey = builder.normalizedKey;
        this.blockKey = builder.blockKey;
        EnumSet<SourceTag> tags = EnumSet.noneOf(SourceTag.class);
        tags.addAll(builder.sourceTags);
        this.sourceTags = Collections.unmodifiableSet(tags);
        this.permitIds = Collections.unmodifiableSortedSet(new TreeSet<>(builder.permitIds));
        this.spellings = Collections.unmodifiableSortedMap(new TreeMap<>(builder.spellings));
        this.identifiers = Collections.unmodifiableSortedSet(new TreeSet<>(builder.identifiers));
        this.lastActivityAt = builder.lastActivityAt;
        this.canonicalSource = builder.canonicalSource;
        this.canonicalObservedAt = builder.canonicalObservedAt;
        this.qualityScore = builder.qualityScore;
        this.qualityEvidence = builder.qualityEvidence;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public Optional<String> getCanonicalFirm() {
        return Optional.ofNullable(canonicalFirm);
    }

    /**
     * Normalized comparison key of the canonical name.
     */
    public String getNormalizedKey() {
        return normalizedKey;
    }

    public String getBlockKey() {
        return blockKey;
    }

    public Set<SourceTag> getSourceTags() {
        return sourceTags;
    }

    /**
     * Highest-priority source attached to this entity.
     */
    public SourceTag getBestSource() {
        return sourceTags.stream().min(SourceTag.BY_PRIORITY).orElse(canonicalSource);
    }

    public SortedSet<String> getPermitIds() {
        return permitIds;
    }

    public int getPermitCount() {
        return permitIds.size();
    }

    /**
     * Raw spellings seen for this entity with their mention counts.
     */
    public SortedMap<String, Integer> getSpellings() {
        return spellings;
    }

    public int getMentionCount() {
        return spellings.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Non-canonical spellings.
     */
    public SortedSet<String> getAliases() {
        SortedSet<String> aliases = new TreeSet<>(spellings.keySet());
        aliases.remove(canonicalName);
        return Collections.unmodifiableSortedSet(aliases);
    }

    /**
     * Upstream identifiers collected from this entity's mentions.
     */
    public SortedSet<ContactIdentifier> getIdentifiers() {
        return identifiers;
    }

    /**
     * True when both sides carry an identifier of the same kind and no value of
     * that kind is shared: two different license numbers are two different contacts.
     */
    public boolean conflictsWith(Collection<ContactIdentifier> others) {
        for (IdentifierKind kind : IdentifierKind.values()) {
            Set<String> mine = valuesOf(identifiers, kind);
            Set<String> theirs = valuesOf(others, kind);
            if (!mine.isEmpty() && !theirs.isEmpty() && Collections.disjoint(mine, theirs)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> valuesOf(Collection<ContactIdentifier> identifiers, IdentifierKind kind) {
        Set<String> values = new TreeSet<>();
        for (ContactIdentifier identifier : identifiers) {
            if (identifier.kind() == kind) {
                values.add(identifier.value());
            }
        }
        return values;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public SourceTag getCanonicalSource() {
        return canonicalSource;
    }

    public Instant getCanonicalObservedAt() {
        return canonicalObservedAt;
    }

    public int getQualityScore() {
        return qualityScore;
    }

    public Optional<QualityEvidence> getQualityEvidence() {
        return Optional.ofNullable(qualityEvidence);
    }

    public Builder toBuilder() {
        return new Builder()
                .entityId(entityId)
                .canonicalName(canonicalName)
                .canonicalFirm(canonicalFirm)
                .normalizedKey(normalizedKey)
                .blockKey(blockKey)
                .sourceTags(sourceTags)
                .permitIds(permitIds)
                .spellings(spellings)
                .identifiers(identifiers)
                .lastActivityAt(lastActivityAt)
                .canonicalSource(canonicalSource)
                .canonicalObservedAt(canonicalObservedAt)
                .qualityScore(qualityScore)
                .qualityEvidence(qualityEvidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity that = (Entity) o;
        return qualityScore == that.qualityScore
                && entityId.equals(that.entityId)
                && canonicalName.equals(that.canonicalName)
                && Objects.equals(canonicalFirm, that.canonicalFirm)
                && normalizedKey.equals(that.normalizedKey)
                && sourceTags.equals(that.sourceTags)
                && permitIds.equals(that.permitIds)
                && spellings.equals(that.spellings)
                && identifiers.equals(that.identifiers)
                && lastActivityAt.equals(that.lastActivityAt)
                && canonicalSource == that.canonicalSource
                && canonicalObservedAt.equals(that.canonicalObservedAt)
                && Objects.equals(qualityEvidence, that.qualityEvidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, canonicalName, normalizedKey, sourceTags, permitIds, lastActivityAt, qualityScore);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + entityId + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", canonicalFirm=" + (canonicalFirm != null ? "'" + canonicalFirm + "'" : "none") +
                ", sources=" + sourceTags +
                ", permits=" + permitIds.size() +
                ", lastActivityAt=" + lastActivityAt +
                ", qualityScore=" + qualityScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityId;
        private String canonicalName;
        private String canonicalFirm;
        private String normalizedKey;
        private String blockKey;
        private Set<SourceTag> sourceTags = EnumSet.noneOf(SourceTag.class);
        private SortedSet<String> permitIds = new TreeSet<>();
        private SortedMap<String, Integer> spellings = new TreeMap<>();
        private SortedSet<ContactIdentifier> identifiers = new TreeSet<>();
        private Instant lastActivityAt;
        private SourceTag canonicalSource;
        private Instant canonicalObservedAt;
        private int qualityScore;
        private QualityEvidence qualityEvidence;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder canonicalFirm(String canonicalFirm) {
            this.canonicalFirm = canonicalFirm;
            return this;
        }

        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder blockKey(String blockKey) {
            this.blockKey = blockKey;
            return this;
        }

        public Builder sourceTags(Set<SourceTag> sourceTags) {
            this.sourceTags = EnumSet.noneOf(SourceTag.class);
            this.sourceTags.addAll(sourceTags);
            return this;
        }

        public Builder addSourceTag(SourceTag sourceTag) {
            this.sourceTags.add(sourceTag);
            return this;
        }

        public Builder permitIds(Set<String> permitIds) {
            this.permitIds = new TreeSet<>(permitIds);
            return this;
        }

        public Builder addPermitId(String permitId) {
            this.permitIds.add(permitId);
            return this;
        }

        public Builder spellings(SortedMap<String, Integer> spellings) {
            this.spellings = new TreeMap<>(spellings);
            return this;
        }

        public Builder addSpelling(String spelling) {
            this.spellings.merge(spelling, 1, Integer::sum);
            return this;
        }

        public Builder identifiers(Collection<ContactIdentifier> identifiers) {
            this.identifiers = new TreeSet<>(identifiers);
            return this;
        }

        public Builder addIdentifiers(Collection<ContactIdentifier> identifiers) {
            this.identifiers.addAll(identifiers);
            return this;
        }

        public Builder lastActivityAt(Instant lastActivityAt) {
            this.lastActivityAt = lastActivityAt;
            return this;
        }

        public Builder canonicalSource(SourceTag canonicalSource) {
            this.canonicalSource = canonicalSource;
            return this;
        }

        public Builder canonicalObservedAt(Instant canonicalObservedAt) {
            this.canonicalObservedAt = canonicalObservedAt;
            return this;
        }

        public Builder qualityScore(int qualityScore) {
            if (qualityScore < 0 || qualityScore > 100) {
                throw new IllegalArgumentException("qualityScore must be between 0 and 100");
            }
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder qualityEvidence(QualityEvidence qualityEvidence) {
            this.qualityEvidence = qualityEvidence;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(entityId, "entityId is required");
            Objects.requireNonNull(canonicalName, "canonicalName is required");
            Objects.requireNonNull(normalizedKey, "normalizedKey is required");
            Objects.requireNonNull(blockKey, "blockKey is required");
            Objects.requireNonNull(lastActivityAt, "lastActivityAt is required");
            Objects.requireNonNull(canonicalSource, "canonicalSource is required");
            Objects.requireNonNull(canonicalObservedAt, "canonicalObservedAt is required");
            if (sourceTags.isEmpty()) {
                throw new IllegalStateException("an entity needs at least one source");
            }
            return new Entity(this);
        }
    }
}
