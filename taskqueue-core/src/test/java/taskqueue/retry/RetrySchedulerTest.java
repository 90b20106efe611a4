package taskqueue.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import taskqueue.Priority;
import taskqueue.QueueCounters;
import taskqueue.QueueShutdownException;
import taskqueue.Task;
import taskqueue.dead.DeadLetterRecord;
import taskqueue.dead.DeadLetterSink;
import taskqueue.queue.PriorityLanes;
import taskqueue.tracker.TaskState;
import taskqueue.tracker.TaskTracker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrySchedulerTest {

    private final TaskTracker tracker = new TaskTracker();
    private final PriorityLanes lanes = new PriorityLanes(tracker);
    private final DeadLetterSink sink = new DeadLetterSink(tracker);
    private final QueueCounters counters = new QueueCounters();
    private RetryScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private RetryScheduler newScheduler(RetryPolicy policy) {
        return newScheduler(lanes, policy);
    }

    private RetryScheduler newScheduler(PriorityLanes target, RetryPolicy policy) {
        scheduler = RetryScheduler.builder()
                .lanes(target)
                .tracker(tracker)
                .deadLetters(sink)
                .retryPolicy(policy)
                .counters(counters)
                .build();
        return scheduler;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 5s");
    }

    private Task running(Priority priority, int maxRetries) {
        Task task = Task.builder("t").priority(priority).maxRetries(maxRetries).build();
        tracker.register(task.id(), TaskState.RUNNING);
        return task;
    }

    // ── Failure decision ────────────────────────────────────────────

    @Test
    void failureWithinBudgetIsScheduled() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(60_000));
        Task task = running(Priority.MEDIUM, 3);

        assertTrue(retry.onFailure(task, "boom", false));

        assertEquals(1, task.retryCount());
        assertEquals("boom", task.lastError());
        assertEquals(1, retry.size());
        assertEquals(0, lanes.size());
        assertEquals(Optional.of(TaskState.RETRY_SCHEDULED), tracker.stateOf(task.id()));
        assertEquals(1, counters.failed());
        assertEquals(1, counters.retried());
        assertEquals(0, counters.deadLettered());
    }

    @Test
    void retryDelayComesFromPolicyForNewCount() {
        List<Integer> requested = new ArrayList<>();
        RetryScheduler retry = newScheduler(retryCount -> {
            requested.add(retryCount);
            return 60_000;
        });
        Task task = running(Priority.LOW, 5);
        task.recordFailure("earlier");
        task.recordFailure("earlier");

        retry.onFailure(task, "third", false);

        assertEquals(List.of(3), requested);
    }

    @Test
    void entryWaitsForItsDelay() throws Exception {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(300));
        retry.start();
        Task task = running(Priority.HIGH, 3);

        retry.onFailure(task, "boom", false);

        assertNull(lanes.poll(100, TimeUnit.MILLISECONDS));
        assertSame(task, lanes.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void exceedingMaxRetriesDeadLetters() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(60_000));
        Task task = running(Priority.HIGH, 0);

        assertFalse(retry.onFailure(task, "boom", false));

        assertEquals(0, retry.size());
        assertEquals(Optional.of(TaskState.DEAD_LETTERED), tracker.stateOf(task.id()));
        DeadLetterRecord record = sink.find(task.id()).orElseThrow();
        assertEquals(DeadLetterRecord.MAX_RETRIES_EXCEEDED, record.reason());
        assertEquals("boom", record.lastError());
        assertEquals(1, counters.failed());
        assertEquals(0, counters.retried());
        assertEquals(1, counters.deadLettered());
    }

    @Test
    void permanentFailureSkipsBudget() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(60_000));
        Task task = running(Priority.HIGH, 10);

        assertFalse(retry.onFailure(task, "invalid payload", true));

        assertEquals("invalid payload", sink.find(task.id()).orElseThrow().reason());
        assertEquals(1, task.retryCount());
        assertEquals(0, retry.size());
    }

    // ── Release ─────────────────────────────────────────────────────

    @Test
    void dueEntryReturnsToOriginalLane() throws Exception {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(50));
        retry.start();
        Task task = running(Priority.LOW, 3);

        retry.onFailure(task, "boom", false);
        Task polled = lanes.poll(2, TimeUnit.SECONDS);

        assertSame(task, polled);
        assertEquals(Priority.LOW, polled.priority());
        assertEquals(0, retry.size());
        assertEquals(Optional.of(TaskState.RUNNING), tracker.stateOf(task.id()));
    }

    @Test
    void earlierEntryWakesReleaseThread() throws Exception {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(50));
        retry.start();
        Task later = Task.of("t", "later", Priority.HIGH);
        retry.schedule(later, Instant.now().plusSeconds(60));
        Thread.sleep(50);

        Task sooner = running(Priority.HIGH, 3);
        retry.onFailure(sooner, "boom", false);

        assertSame(sooner, lanes.poll(2, TimeUnit.SECONDS));
        assertEquals(1, retry.size());
    }

    @Test
    void entriesReleaseInDeadlineOrder() throws Exception {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(0));
        Instant now = Instant.now();
        Task second = Task.of("t", "second", Priority.MEDIUM);
        Task first = Task.of("t", "first", Priority.MEDIUM);
        retry.schedule(second, now.plusMillis(150));
        retry.schedule(first, now.plusMillis(50));
        retry.start();

        assertSame(first, lanes.poll(2, TimeUnit.SECONDS));
        assertSame(second, lanes.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void closedLanesKeepEntryPending() throws Exception {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(0));
        Task task = Task.of("t", null, Priority.HIGH);
        retry.schedule(task, Instant.now());
        lanes.close();
        retry.start();
        Thread.sleep(200);

        assertEquals(1, retry.size());
        assertEquals(Optional.of(TaskState.RETRY_SCHEDULED), tracker.stateOf(task.id()));
    }

    @Test
    void fullLaneDoesNotHoldBackOtherDueEntries() throws Exception {
        PriorityLanes bounded = new PriorityLanes(Map.of(Priority.LOW, 1), tracker);
        RetryScheduler retry = newScheduler(bounded, new FixedDelayRetryPolicy(0));
        bounded.enqueue(Task.of("t", "filler", Priority.LOW));
        Task low = Task.of("t", "low", Priority.LOW);
        Task high = Task.of("t", "high", Priority.HIGH);
        Instant now = Instant.now();
        retry.schedule(low, now);
        retry.schedule(high, now.plusMillis(50));
        retry.start();

        await(() -> bounded.size(Priority.HIGH) == 1);

        assertEquals(1, retry.size());
        assertEquals(1, bounded.size(Priority.LOW));
        assertEquals(Optional.of(TaskState.RETRY_SCHEDULED), tracker.stateOf(low.id()));
        assertSame(high, bounded.dequeueNext());
        assertEquals("filler", bounded.dequeueNext().payload());
        assertSame(low, bounded.poll(2, TimeUnit.SECONDS));
        assertEquals(0, retry.size());
    }

    @Test
    void dueEntryWaitingForSpaceCanBeRemoved() throws Exception {
        PriorityLanes bounded = new PriorityLanes(Map.of(Priority.LOW, 1), tracker);
        RetryScheduler retry = newScheduler(bounded, new FixedDelayRetryPolicy(0));
        bounded.enqueue(Task.of("t", "filler", Priority.LOW));
        Task low = Task.of("t", "low", Priority.LOW);
        retry.schedule(low, Instant.now());
        retry.start();
        Thread.sleep(100);

        assertEquals(Optional.of(low), retry.remove(low.id()));
        assertTrue(tracker.stateOf(low.id()).isEmpty());
        assertEquals("filler", bounded.dequeueNext().payload());
        assertNull(bounded.poll(100, TimeUnit.MILLISECONDS));
    }

    // ── Delayed tasks, removal, close ───────────────────────────────

    @Test
    void scheduleDoesNotTouchRetryCounters() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(0));
        Task task = Task.of("t", null, Priority.LOW);

        retry.schedule(task, Instant.now().plusSeconds(30));

        assertEquals(0, task.retryCount());
        assertEquals(0, counters.retried());
        assertEquals(Optional.of(TaskState.RETRY_SCHEDULED), tracker.stateOf(task.id()));
    }

    @Test
    void removeCancelsWaitingTask() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(60_000));
        Task task = running(Priority.LOW, 3);
        retry.onFailure(task, "boom", false);

        assertEquals(Optional.of(task), retry.remove(task.id()));
        assertTrue(retry.remove(task.id()).isEmpty());
        assertTrue(tracker.stateOf(task.id()).isEmpty());
        assertEquals(0, retry.size());
    }

    @Test
    void drainToEmptiesHeap() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(60_000));
        retry.onFailure(running(Priority.LOW, 3), "a", false);
        retry.onFailure(running(Priority.HIGH, 3), "b", false);

        List<Task> drained = new ArrayList<>();
        assertEquals(2, retry.drainTo(drained));

        assertEquals(2, drained.size());
        assertEquals(0, tracker.count(TaskState.RETRY_SCHEDULED));
    }

    @Test
    void scheduleAfterCloseThrows() {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(0));
        retry.close();

        assertThrows(QueueShutdownException.class, () ->
                retry.schedule(Task.of("t", null, Priority.LOW), Instant.now()));
        assertThrows(IllegalStateException.class, retry::start);
    }

    @Test
    void failureAfterCloseStaysPending() throws Exception {
        RetryScheduler retry = newScheduler(new FixedDelayRetryPolicy(0));
        retry.start();
        retry.close();
        Task task = running(Priority.MEDIUM, 3);

        assertTrue(retry.onFailure(task, "boom", false));
        assertNull(lanes.poll(100, TimeUnit.MILLISECONDS));
        assertEquals(1, retry.size());
    }

    @Test
    void builderRequiresCollaborators() {
        assertThrows(NullPointerException.class, () ->
                RetryScheduler.builder().tracker(tracker).deadLetters(sink).build());
        assertThrows(NullPointerException.class, () ->
                RetryScheduler.builder().lanes(lanes).deadLetters(sink).build());
        assertThrows(NullPointerException.class, () ->
                RetryScheduler.builder().lanes(lanes).tracker(tracker).build());
    }
}
