package dev.ecodata.feedback;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed {@link FeedbackStore}, the default ({@code ecodata.feedback.store=jpa}).
 *
 * <p>A batch is written in one transaction, so a failed write leaves nothing behind.
 */
@Component
@ConditionalOnProperty(name = "ecodata.feedback.store", havingValue = "jpa", matchIfMissing = true)
public class JpaFeedbackStore implements FeedbackStore {

  private static final Logger log = LoggerFactory.getLogger(JpaFeedbackStore.class);

  private final ValidationFeedbackRepository repository;

  public JpaFeedbackStore(ValidationFeedbackRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional
  public void appendAll(List<ValidationFeedback> feedback) {
    try {
      repository.saveAll(feedback.stream().map(ValidationFeedbackEntity::from).toList());
      repository.flush();
    } catch (DataAccessException e) {
      log.warn("Failed to store {} feedback record(s): {}", feedback.size(), e.getMessage());
      throw new FeedbackWriteException("Failed to store feedback: " + e.getMessage(), e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<ValidationFeedback> findByJob(UUID jobId) {
    return repository.findAllByJobIdOrderByRecordedAtAscIdAsc(jobId).stream()
        .map(ValidationFeedbackEntity::toFeedback)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public List<ValidationFeedback> findByCategory(String category) {
    return repository.findAllByCategoryOrderByRecordedAtAscIdAsc(category).stream()
        .map(ValidationFeedbackEntity::toFeedback)
        .toList();
  }
}
