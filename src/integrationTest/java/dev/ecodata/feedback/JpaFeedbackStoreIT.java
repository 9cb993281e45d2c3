package dev.ecodata.feedback;

import dev.ecodata.BaseIntegrationTest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the feedback log against the Flyway schema. Compensates for ddl-auto=none by
 * round-tripping every column of {@link ValidationFeedbackEntity}.
 */
class JpaFeedbackStoreIT extends BaseIntegrationTest {

    private static final UUID JOB = UUID.fromString("3b8f0c1e-2a4d-4e6f-8a1b-9c0d2e3f4a5b");
    private static final Instant AT = Instant.parse("2026-01-10T10:00:00Z");

    @Autowired
    private FeedbackStore feedbackStore;

    @Autowired
    private ValidationFeedbackRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanLog() {
        repository.deleteAllInBatch();
    }

    @Test
    void feedbackRoundtripsAgainstFlywaySchema() {
        ValidationFeedback feedback = new ValidationFeedback(
                JOB, "D5", "revenue", ValidationStatus.OVERRIDE,
                List.of(1, 3), List.of("The company earned $5M.", "Audited: $5.2M."),
                "$5M", "$5.2M", "Sentence [1] states revenue.", "Prefer audited figures.", AT);

        feedbackStore.append(feedback);

        assertThat(feedbackStore.findByJob(JOB)).containsExactly(feedback);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT validation_status FROM validation_feedback WHERE row_id = 'D5'", String.class))
                .isEqualTo("OVERRIDE");
    }

    @Test
    void readsKeepAppendOrderForEqualTimestamps() {
        feedbackStore.appendAll(List.of(
                feedback("A", "revenue", AT.plusSeconds(60)),
                feedback("B", "revenue", AT),
                feedback("C", "revenue", AT)));
        feedbackStore.append(feedback("D", "founder", AT));

        assertThat(feedbackStore.findByCategory("revenue"))
                .extracting(ValidationFeedback::rowId)
                .containsExactly("B", "C", "A");
        assertThat(feedbackStore.findByJob(JOB))
                .extracting(ValidationFeedback::rowId)
                .containsExactly("B", "C", "D", "A");
    }

    @Test
    void statusColumnRejectsUnknownValues() {
        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO validation_feedback (job_id, row_id, category, validation_status, "
                        + "validated_sentence_ids, validated_sentence_texts, recorded_at) "
                        + "VALUES (?, 'X', 'revenue', 'MAYBE', '[]'::jsonb, '[]'::jsonb, now())",
                JOB))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(repository.count()).isZero();
    }

    @Test
    void aggregatorReadsFromDatabase() {
        feedbackStore.append(feedback("A", "revenue", AT));

        RefinementContext context =
                new FeedbackAggregator(feedbackStore).buildContext("revenue", 5).orElseThrow();

        assertThat(context.examples()).extracting(ConfirmedExample::value).containsExactly("$5M");
    }

    private static ValidationFeedback feedback(String rowId, String category, Instant at) {
        return new ValidationFeedback(
                JOB, rowId, category, ValidationStatus.CONFIRMED,
                List.of(1), List.of("The company earned $5M."),
                "$5M", null, null, null, at);
    }
}
