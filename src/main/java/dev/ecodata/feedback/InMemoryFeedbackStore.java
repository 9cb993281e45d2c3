package dev.ecodata.feedback;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link FeedbackStore}, selected with {@code ecodata.feedback.store=memory}.
 *
 * <p>Batches are appended under a single lock, so concurrent review sessions never interleave a
 * partial batch. Contents are lost on restart.
 */
@Component
@ConditionalOnProperty(name = "ecodata.feedback.store", havingValue = "memory")
public class InMemoryFeedbackStore implements FeedbackStore {

  private final List<ValidationFeedback> records = new ArrayList<>();

  @Override
  public void appendAll(List<ValidationFeedback> feedback) {
    List<ValidationFeedback> batch = List.copyOf(feedback);
    synchronized (records) {
      records.addAll(batch);
    }
  }

  @Override
  public List<ValidationFeedback> findByJob(UUID jobId) {
    return select(f -> f.jobId().equals(jobId));
  }

  @Override
  public List<ValidationFeedback> findByCategory(String category) {
    return select(f -> f.category().equals(category));
  }

  private List<ValidationFeedback> select(Predicate<ValidationFeedback> filter) {
    List<ValidationFeedback> selected;
    synchronized (records) {
      selected = new ArrayList<>(records.stream().filter(filter).toList());
    }
    // stable: equal timestamps keep append order
    selected.sort(Comparator.comparing(ValidationFeedback::timestamp));
    return List.copyOf(selected);
  }
}
