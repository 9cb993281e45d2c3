package dev.ecodata.feedback;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ValidationFeedbackEntity} rows, read in append order. */
public interface ValidationFeedbackRepository
    extends JpaRepository<ValidationFeedbackEntity, Long> {

  List<ValidationFeedbackEntity> findAllByJobIdOrderByRecordedAtAscIdAsc(UUID jobId);

  List<ValidationFeedbackEntity> findAllByCategoryOrderByRecordedAtAscIdAsc(String category);
}
