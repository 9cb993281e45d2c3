package dev.ecodata.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.ecodata.fixture.ValidationFeedbackBuilder;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class JpaFeedbackStoreTest {

  @Mock private ValidationFeedbackRepository repository;

  @InjectMocks private JpaFeedbackStore store;

  @Test
  @SuppressWarnings("unchecked")
  void appendAllSavesEveryRecordAndFlushes() {
    ValidationFeedback feedback =
        new ValidationFeedbackBuilder()
            .status(ValidationStatus.OVERRIDE)
            .manualValue("$6M")
            .build();

    store.appendAll(List.of(feedback, new ValidationFeedbackBuilder().category("founder").build()));

    ArgumentCaptor<List<ValidationFeedbackEntity>> captor = ArgumentCaptor.forClass(List.class);
    verify(repository).saveAll(captor.capture());
    verify(repository).flush();
    assertThat(captor.getValue()).hasSize(2);
    assertThat(captor.getValue().get(0).toFeedback()).isEqualTo(feedback);
  }

  @Test
  void storageFailureIsReportedAsFeedbackWriteException() {
    when(repository.saveAll(anyList()))
        .thenThrow(new DataIntegrityViolationException("constraint"));

    assertThatThrownBy(() -> store.append(new ValidationFeedbackBuilder().build()))
        .isInstanceOf(FeedbackWriteException.class)
        .hasMessageContaining("constraint")
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void findByJobMapsEntitiesBack() {
    ValidationFeedback feedback = new ValidationFeedbackBuilder().build();
    UUID jobId = feedback.jobId();
    when(repository.findAllByJobIdOrderByRecordedAtAscIdAsc(jobId))
        .thenReturn(List.of(ValidationFeedbackEntity.from(feedback)));

    assertThat(store.findByJob(jobId)).containsExactly(feedback);
  }

  @Test
  void findByCategoryMapsEntitiesBack() {
    ValidationFeedback feedback = new ValidationFeedbackBuilder().category("founder").build();
    when(repository.findAllByCategoryOrderByRecordedAtAscIdAsc("founder"))
        .thenReturn(List.of(ValidationFeedbackEntity.from(feedback)));

    assertThat(store.findByCategory("founder")).containsExactly(feedback);
  }
}
