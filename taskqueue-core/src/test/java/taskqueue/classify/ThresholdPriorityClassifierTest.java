package taskqueue.classify;

import org.junit.jupiter.api.Test;
import taskqueue.Priority;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdPriorityClassifierTest {

  private final ThresholdPriorityClassifier classifier = ThresholdPriorityClassifier.builder()
      .highValueIds(Set.of("vip-1"))
      .highThreshold(new BigDecimal("5000"))
      .mediumThreshold(new BigDecimal("100"))
      .build();

  @Test
  void highValueIdIsHighRegardlessOfAmount() {
    assertEquals(Priority.HIGH, classifier.classify(Map.of("customerId", "vip-1", "amount", 1)));
    assertEquals(Priority.HIGH, classifier.classify(Map.of("customerId", "vip-1")));
  }

  @Test
  void amountThresholds() {
    assertEquals(Priority.HIGH, classifier.classify(Map.of("amount", 5000.01)));
    assertEquals(Priority.MEDIUM, classifier.classify(Map.of("amount", 5000)));
    assertEquals(Priority.MEDIUM, classifier.classify(Map.of("amount", 101L)));
    assertEquals(Priority.LOW, classifier.classify(Map.of("amount", 100)));
    assertEquals(Priority.LOW, classifier.classify(Map.of("amount", new BigDecimal("3"))));
  }

  @Test
  void numericStringsAreAccepted() {
    assertEquals(Priority.HIGH, classifier.classify(Map.of("amount", " 7500 ")));
    assertEquals(Priority.MEDIUM, classifier.classify(Map.of("amount", "250.50")));
  }

  @Test
  void missingOrInvalidAmountIsLow() {
    assertEquals(Priority.LOW, classifier.classify(Map.of()));
    assertEquals(Priority.LOW, classifier.classify(Map.of("amount", "lots")));
    assertEquals(Priority.LOW, classifier.classify(Map.of("customerId", "regular")));
  }

  @Test
  void customAttributeNames() {
    ThresholdPriorityClassifier custom = ThresholdPriorityClassifier.builder()
        .idAttribute("account")
        .amountAttribute("total")
        .highValueIds(Set.of("acct-9"))
        .build();

    assertEquals(Priority.HIGH, custom.classify(Map.of("account", "acct-9")));
    assertEquals(Priority.HIGH, custom.classify(Map.of("total", 20_000)));
    assertEquals(Priority.MEDIUM, custom.classify(Map.of("total", 2_000)));
    assertEquals(Priority.LOW, custom.classify(Map.of("amount", 20_000)));
  }

  @Test
  void mediumAboveHighRejected() {
    assertThrows(IllegalArgumentException.class, () -> ThresholdPriorityClassifier.builder()
        .highThreshold(BigDecimal.ONE)
        .mediumThreshold(BigDecimal.TEN)
        .build());
  }
}
