package taskqueue.dead;

import org.junit.jupiter.api.Test;
import taskqueue.Priority;
import taskqueue.Task;
import taskqueue.TaskInvariantViolationException;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterSinkTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final TaskTracker tracker = new TaskTracker();
  private final DeadLetterSink sink = new DeadLetterSink(tracker, Clock.fixed(NOW, ZoneOffset.UTC));

  private Task running(String type) {
    Task task = Task.of(type, null, Priority.MEDIUM);
    tracker.register(task.id(), TaskState.RUNNING);
    return task;
  }

  @Test
  void addRecordsReasonAndTimestamp() {
    Task task = running("email");
    task.recordFailure("smtp down");

    DeadLetterRecord record = sink.add(task, DeadLetterRecord.MAX_RETRIES_EXCEEDED);

    assertEquals(task.id(), record.taskId());
    assertEquals("email", record.taskType());
    assertEquals("max retries exceeded", record.reason());
    assertEquals("smtp down", record.lastError());
    assertEquals(NOW, record.deadLetteredAt());
    assertEquals(Optional.of(TaskState.DEAD_LETTERED), tracker.stateOf(task.id()));
  }

  @Test
  void recordKeepsFailureStateFromDeadLetterTime() {
    Task task = running("email");
    task.recordFailure("smtp down");
    task.recordFailure("smtp still down");

    DeadLetterRecord record = sink.add(task, DeadLetterRecord.MAX_RETRIES_EXCEEDED);
    record.task().recordFailure("changed later");

    assertEquals(2, record.retryCount());
    assertEquals("smtp still down", record.lastError());
    assertEquals(2, sink.find(task.id()).orElseThrow().retryCount());
    assertEquals("smtp still down", sink.find(task.id()).orElseThrow().lastError());
  }

  @Test
  void addRequiresRunningTask() {
    Task task = Task.of("email", null, Priority.LOW);
    tracker.register(task.id(), TaskState.QUEUED);

    assertThrows(TaskInvariantViolationException.class, () -> sink.add(task, "x"));
    assertEquals(0, sink.count());
  }

  @Test
  void addingTwiceIsViolation() {
    Task task = running("email");
    sink.add(task, "x");

    assertThrows(TaskInvariantViolationException.class, () -> sink.add(task, "x"));
    assertEquals(1, sink.count());
  }

  @Test
  void listIsOldestFirstSnapshot() {
    Task a = running("a");
    Task b = running("b");
    sink.add(a, "x");
    sink.add(b, "y");

    List<DeadLetterRecord> snapshot = sink.list();
    sink.add(running("c"), "z");

    assertEquals(2, snapshot.size());
    assertEquals(a.id(), snapshot.get(0).taskId());
    assertEquals(b.id(), snapshot.get(1).taskId());
    assertEquals(3, sink.list().size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(0));
  }

  @Test
  void listFiltersByTypeAndLimit() {
    sink.add(running("email"), "x");
    sink.add(running("sms"), "x");
    sink.add(running("email"), "x");
    sink.add(running("email"), "x");

    assertEquals(3, sink.list("email", 10).size());
    assertEquals(2, sink.list("email", 2).size());
    assertEquals(1, sink.list("sms", 10).size());
    assertEquals(4, sink.list(null, 10).size());
    assertTrue(sink.list("push", 10).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> sink.list(null, -1));
  }

  @Test
  void removeForgetsTask() {
    Task task = running("email");
    sink.add(task, "x");

    assertTrue(sink.remove(task.id()).isPresent());
    assertTrue(sink.remove(task.id()).isEmpty());
    assertTrue(sink.find(task.id()).isEmpty());
    assertTrue(tracker.stateOf(task.id()).isEmpty());
  }

  @Test
  void drainRemovesEverything() {
    Task a = running("a");
    Task b = running("b");
    sink.add(a, "x");
    sink.add(b, "y");

    List<DeadLetterRecord> drained = sink.drain();

    assertEquals(2, drained.size());
    assertEquals(0, sink.count());
    assertEquals(0, tracker.count(TaskState.DEAD_LETTERED));
  }
}
