package dev.ecodata.feedback;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ecodata.fixture.ValidationFeedbackBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryFeedbackStoreTest {

  private static final UUID JOB = UUID.fromString("00000000-0000-0000-0000-000000000001");

  private final InMemoryFeedbackStore store = new InMemoryFeedbackStore();

  @Test
  void readsAreOrderedByTimestampKeepingAppendOrderForTies() {
    ValidationFeedback late =
        new ValidationFeedbackBuilder().rowId("late").timestamp("2026-02-01T00:00:00Z").build();
    ValidationFeedback first = new ValidationFeedbackBuilder().rowId("first").build();
    ValidationFeedback second = new ValidationFeedbackBuilder().rowId("second").build();
    store.append(late);
    store.append(first);
    store.append(second);

    assertThat(store.findByJob(JOB)).containsExactly(first, second, late);
  }

  @Test
  void findsByJobAndByCategory() {
    ValidationFeedback revenue = new ValidationFeedbackBuilder().build();
    ValidationFeedback founder =
        new ValidationFeedbackBuilder().category("founder").extractedValue("Jane").build();
    ValidationFeedback otherJob =
        new ValidationFeedbackBuilder()
            .jobId(UUID.fromString("00000000-0000-0000-0000-000000000009"))
            .build();
    store.appendAll(List.of(revenue, founder, otherJob));

    assertThat(store.findByJob(JOB)).containsExactly(revenue, founder);
    assertThat(store.findByCategory("revenue")).containsExactly(revenue, otherJob);
    assertThat(store.findByCategory("sector")).isEmpty();
  }

  @Test
  void concurrentBatchesAreNeitherLostNorInterleaved() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<CompletableFuture<Void>> futures = new ArrayList<>();
      for (int writer = 0; writer < 8; writer++) {
        String rowId = "row-" + writer;
        futures.add(
            CompletableFuture.runAsync(
                () -> {
                  for (int batch = 0; batch < 25; batch++) {
                    store.appendAll(
                        List.of(
                            new ValidationFeedbackBuilder().rowId(rowId).category("a").build(),
                            new ValidationFeedbackBuilder().rowId(rowId).category("b").build()));
                  }
                },
                executor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    List<ValidationFeedback> all = store.findByJob(JOB);
    assertThat(all).hasSize(8 * 25 * 2);
    for (int i = 0; i < all.size(); i += 2) {
      assertThat(all.get(i).category()).isEqualTo("a");
      assertThat(all.get(i + 1).category()).isEqualTo("b");
      assertThat(all.get(i + 1).rowId()).isEqualTo(all.get(i).rowId());
    }
  }
}
