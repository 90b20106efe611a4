package taskqueue.tracker;

import taskqueue.TaskInvariantViolationException;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based record of which structure owns each live task.
 *
 * <p>Every hand-off between the lanes, the workers, the retry scheduler and the
 * dead-letter sink is a compare-and-set {@link #transition} from the expected state.
 * A mismatch means the same task was handed off twice, which is reported as a
 * {@link TaskInvariantViolationException}.
 *
 * <p>This class is thread-safe.
 */
public final class TaskTracker {
    private final Map<String, TaskState> states = new ConcurrentHashMap<>();

    /**
     * Starts tracking a new task.
     *
     * @param taskId  the task id
     * @param initial the first location
     * @throws TaskInvariantViolationException if the id is already tracked
     */
    public void register(String taskId, TaskState initial) {
        TaskState existing = states.putIfAbsent(taskId, initial);
        if (existing != null) {
            throw new TaskInvariantViolationException(
                "Task " + taskId + " registered as " + initial + " but already " + existing);
        }
    }

    /**
     * Moves a task from {@code expected} to {@code next}.
     *
     * @throws TaskInvariantViolationException if the task is not currently in {@code expected}
     */
    public void transition(String taskId, TaskState expected, TaskState next) {
        if (!states.replace(taskId, expected, next)) {
            throw new TaskInvariantViolationException("Task " + taskId + " expected in " + expected
                + " for move to " + next + " but was " + states.get(taskId));
        }
    }

    /**
     * Stops tracking a task that completed or was cancelled.
     *
     * @throws TaskInvariantViolationException if the task is not currently in {@code expected}
     */
    public void complete(String taskId, TaskState expected) {
        if (!states.remove(taskId, expected)) {
            throw new TaskInvariantViolationException("Task " + taskId + " expected in " + expected
                + " on completion but was " + states.get(taskId));
        }
    }

    /**
     * Removes a dead-lettered task whose record was drained or resubmitted.
     *
     * @param taskId the task id
     * @return {@code true} if the task was tracked as dead-lettered
     */
    public boolean forgetDeadLettered(String taskId) {
        return states.remove(taskId, TaskState.DEAD_LETTERED);
    }

    public Optional<TaskState> stateOf(String taskId) {
        return Optional.ofNullable(states.get(taskId));
    }

    /**
     * Returns a point-in-time count of tracked tasks per state.
     *
     * @return counts for every state, zero-filled
     */
    public Map<TaskState, Integer> counts() {
        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            counts.put(state, 0);
        }
        for (TaskState state : states.values()) {
            counts.merge(state, 1, Integer::sum);
        }
        return counts;
    }

    public int count(TaskState state) {
        int n = 0;
        for (TaskState s : states.values()) {
            if (s == state) n++;
        }
        return n;
    }
}
