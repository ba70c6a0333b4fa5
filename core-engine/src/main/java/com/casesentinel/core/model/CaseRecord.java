package com.casesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only view of a call-center case as seen by the engine.
 *
 * <p>
 * Every case belongs to exactly one business unit and carries exactly one
 * severity at query time. Severity may change between engine runs; the engine
 * always reads the current value.
 * </p>
 *
 * @since 1.0.0
 */
public final class CaseRecord {

    private final String id;
    private final String businessUnit;
    private final String category;
    private final Severity severity;
    private final String summary;
    private final Instant createdAt;

    private CaseRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.businessUnit = Objects.requireNonNull(builder.businessUnit, "businessUnit must not be null");
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.summary = builder.summary != null ? builder.summary : "";
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CaseRecord}. Everything except
     * {@code summary} is required; a missing summary reads as empty text.
     */
    public static class Builder {
        private String id;
        private String businessUnit;
        private String category;
        private Severity severity;
        private String summary;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder businessUnit(String businessUnit) {
            this.businessUnit = businessUnit;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CaseRecord build() {
            return new CaseRecord(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public String getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CaseRecord that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "CaseRecord{" +
                "id='" + id + '\'' +
                ", businessUnit='" + businessUnit + '\'' +
                ", category='" + category + '\'' +
                ", severity=" + severity.wireName() +
                ", createdAt=" + createdAt +
                '}';
    }
}
