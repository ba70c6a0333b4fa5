package com.casesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert record written by the engine and read by the feed layer.
 *
 * <p>
 * An alert starts life as an unsaved draft produced by the formatter: it has
 * no {@code id} and no timestamps. The writer turns drafts into persisted
 * records through {@link #toBuilder()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code severity}, {@code title},
 * {@code description} and {@code businessUnit} are required; omitting any of
 * them throws {@link NullPointerException} at build time. {@code status}
 * defaults to {@link AlertStatus#ACTIVE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert {

    private final String id;
    private final AlertType type;
    private final Severity severity;
    private final String title;
    private final String description;
    private final String businessUnit;
    private final String category;
    private final Integer baselineValue;
    private final Integer currentValue;
    private final Double percentageChange;
    private final AlertStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Alert(Builder builder) {
        this.id = builder.id;
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.description = Objects.requireNonNull(builder.description, "description must not be null");
        this.businessUnit = Objects.requireNonNull(builder.businessUnit, "businessUnit must not be null");
        this.category = builder.category;
        this.baselineValue = builder.baselineValue;
        this.currentValue = builder.currentValue;
        this.percentageChange = builder.percentageChange;
        this.status = builder.status != null ? builder.status : AlertStatus.ACTIVE;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this alert
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .severity(severity)
                .title(title)
                .description(description)
                .businessUnit(businessUnit)
                .category(category)
                .baselineValue(baselineValue)
                .currentValue(currentValue)
                .percentageChange(percentageChange)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private AlertType type;
        private Severity severity;
        private String title;
        private String description;
        private String businessUnit;
        private String category;
        private Integer baselineValue;
        private Integer currentValue;
        private Double percentageChange;
        private AlertStatus status;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
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

        public Builder baselineValue(Integer baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder currentValue(Integer currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder percentageChange(Double percentageChange) {
            this.percentageChange = percentageChange;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return identifier, or {@code null} for an unsaved draft
     */
    public String getId() {
        return id;
    }

    public AlertType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public String getCategory() {
        return category;
    }

    public Integer getBaselineValue() {
        return baselineValue;
    }

    public Integer getCurrentValue() {
        return currentValue;
    }

    public Double getPercentageChange() {
        return percentageChange;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id)
                && type == alert.type
                && severity == alert.severity
                && title.equals(alert.title)
                && businessUnit.equals(alert.businessUnit)
                && Objects.equals(createdAt, alert.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, severity, title, businessUnit, createdAt);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", type=" + type.wireName() +
                ", severity=" + severity.wireName() +
                ", title='" + title + '\'' +
                ", status=" + status.wireName() +
                ", createdAt=" + createdAt +
                '}';
    }
}
