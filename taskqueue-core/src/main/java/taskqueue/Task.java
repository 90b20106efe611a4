package taskqueue;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * One unit of work: an immutable description plus mutable retry bookkeeping.
 *
 * <p>Each task is assigned a ULID-based {@code id} by default. The {@code taskType}
 * selects the {@link TaskHandler} that processes it; the {@code payload} is opaque to
 * the queue and handed to the handler unchanged.
 *
 * <p>{@link #retryCount()} starts at zero and is advanced only by the queue's failure
 * decision through {@link #recordFailure(String)}. A task is owned by exactly one
 * queue structure at a time, so that method is never called concurrently for the
 * same task.
 *
 * @see TaskQueue#enqueue(String, Object, Priority, int)
 */
public final class Task {
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String id;
    private final String taskType;
    private final Object payload;
    private final Priority priority;
    private final Instant createdAt;
    private final int maxRetries;

    private volatile int retryCount;
    private volatile String lastError;

    private Task(Builder builder) {
        this.id = builder.id == null ? newTaskId() : builder.id;
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType");
        if (this.taskType.isEmpty()) {
            throw new IllegalArgumentException("taskType cannot be empty");
        }
        this.priority = Objects.requireNonNull(builder.priority, "priority");
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
        }
        this.maxRetries = builder.maxRetries;
        this.payload = builder.payload;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    }

    /**
     * Creates a builder for a task of the given type.
     *
     * @param taskType the handler key
     * @return a new builder
     */
    public static Builder builder(String taskType) {
        return new Builder(taskType);
    }

    /**
     * Creates a task with a fresh id and the default retry budget.
     *
     * @param taskType the handler key
     * @param payload  the handler input
     * @param priority the lane
     * @return a new task
     */
    public static Task of(String taskType, Object payload, Priority priority) {
        return builder(taskType).payload(payload).priority(priority).build();
    }

    public String id() {
        return id;
    }

    public String taskType() {
        return taskType;
    }

    public Object payload() {
        return payload;
    }

    public Priority priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int retryCount() {
        return retryCount;
    }

    /**
     * Returns the reason of the most recent failed attempt.
     *
     * @return the last failure reason, or {@code null} if the task never failed
     */
    public String lastError() {
        return lastError;
    }

    /**
     * Records one failed attempt. Called by the queue's failure decision only.
     *
     * @param reason the failure reason
     * @return the retry count after the increment
     */
    public int recordFailure(String reason) {
        this.lastError = reason;
        return ++retryCount;
    }

    /**
     * Creates a brand-new task with the same type, payload, priority and retry budget,
     * a fresh id and a reset retry count.
     *
     * @return a new task
     */
    public Task copyForResubmission() {
        return builder(taskType)
            .payload(payload)
            .priority(priority)
            .maxRetries(maxRetries)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", type=" + taskType + ", priority=" + priority
            + ", retry=" + retryCount + "/" + maxRetries + "}";
    }

    private static String newTaskId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /** Builder for {@link Task}. */
    public static final class Builder {
        private final String taskType;
        private String id;
        private Object payload;
        private Priority priority = Priority.MEDIUM;
        private Instant createdAt;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder(String taskType) {
            this.taskType = taskType;
        }

        /**
         * Overrides the generated ULID.
         *
         * @param id the task id
         * @return this builder
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets the priority lane.
         *
         * <p>Optional. Defaults to {@link Priority#MEDIUM}.
         *
         * @param priority the priority
         * @return this builder
         */
        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Sets how many retries follow the first failed attempt.
         *
         * <p>Optional. Defaults to {@value Task#DEFAULT_MAX_RETRIES}. Must be &ge; 0.
         *
         * @param maxRetries the retry budget
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Builds the task.
         *
         * @return a new task
         * @throws NullPointerException     if {@code taskType} or {@code priority} is null
         * @throws IllegalArgumentException if {@code taskType} is empty or {@code maxRetries < 0}
         */
        public Task build() {
            return new Task(this);
        }
    }
}
