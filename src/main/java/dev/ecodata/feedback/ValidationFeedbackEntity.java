package dev.ecodata.feedback;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Persistent form of a {@link ValidationFeedback}.
 *
 * <p>Rows are only ever inserted. The generated {@code id} preserves append order for records
 * sharing a timestamp. Maps to the {@code validation_feedback} table managed by Flyway migrations.
 */
@Entity
@Table(name = "validation_feedback")
public class ValidationFeedbackEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "row_id", nullable = false, updatable = false)
    private String rowId;

    @Column(nullable = false, updatable = false)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, updatable = false)
    private ValidationStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validated_sentence_ids", nullable = false, updatable = false)
    private List<Integer> validatedSentenceIds = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validated_sentence_texts", nullable = false, updatable = false)
    private List<String> validatedSentenceTexts = new ArrayList<>();

    @Column(name = "extracted_value", updatable = false)
    private String extractedValue;

    @Column(name = "manual_value", updatable = false)
    private String manualValue;

    @Column(updatable = false)
    private String rationale;

    @Column(updatable = false)
    private String notes;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected ValidationFeedbackEntity() {
        // JPA requires no-arg constructor
    }

    static ValidationFeedbackEntity from(ValidationFeedback feedback) {
        ValidationFeedbackEntity entity = new ValidationFeedbackEntity();
        entity.jobId = feedback.jobId();
        entity.rowId = feedback.rowId();
        entity.category = feedback.category();
        entity.status = feedback.status();
        entity.validatedSentenceIds = new ArrayList<>(feedback.validatedSentenceIds());
        entity.validatedSentenceTexts = new ArrayList<>(feedback.validatedSentenceTexts());
        entity.extractedValue = feedback.extractedValue();
        entity.manualValue = feedback.manualValue();
        entity.rationale = feedback.rationale();
        entity.notes = feedback.notes();
        entity.recordedAt = feedback.timestamp();
        return entity;
    }

    ValidationFeedback toFeedback() {
        return new ValidationFeedback(
                jobId,
                rowId,
                category,
                status,
                validatedSentenceIds,
                validatedSentenceTexts,
                extractedValue,
                manualValue,
                rationale,
                notes,
                recordedAt);
    }

    public Long getId() {
        return id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getCategory() {
        return category;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
