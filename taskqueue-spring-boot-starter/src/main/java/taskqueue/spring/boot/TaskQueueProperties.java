package taskqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the task queue.
 *
 * @see TaskQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "taskqueue")
public class TaskQueueProperties {

    /**
     * Whether to create the task queue at all.
     */
    private boolean enabled = true;

    /**
     * Number of worker threads.
     */
    private int workerCount = 4;

    /**
     * Maximum time a single handler invocation may run.
     */
    private Duration handlerTimeout = Duration.ofSeconds(30);

    /**
     * How long an idle worker waits on the lanes before checking for shutdown.
     */
    private Duration idleWait = Duration.ofMillis(100);

    /**
     * How long shutdown waits for in-flight tasks.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private final Queue queue = new Queue();
    private final Retry retry = new Retry();
    private final Classifier classifier = new Classifier();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public Duration getIdleWait() {
        return idleWait;
    }

    public void setIdleWait(Duration idleWait) {
        this.idleWait = idleWait;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Queue getQueue() {
        return queue;
    }

    public Retry getRetry() {
        return retry;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /** Lane capacities. {@code 0} means unbounded. */
    public static class Queue {
        private int highCapacity;
        private int mediumCapacity;
        private int lowCapacity;

        public int getHighCapacity() {
            return highCapacity;
        }

        public void setHighCapacity(int highCapacity) {
            this.highCapacity = highCapacity;
        }

        public int getMediumCapacity() {
            return mediumCapacity;
        }

        public void setMediumCapacity(int mediumCapacity) {
            this.mediumCapacity = mediumCapacity;
        }

        public int getLowCapacity() {
            return lowCapacity;
        }

        public void setLowCapacity(int lowCapacity) {
            this.lowCapacity = lowCapacity;
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private boolean jitter;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Threshold classifier for attribute-based enqueue. Disabled unless
     * {@code taskqueue.classifier.enabled=true} and no classifier bean is defined.
     */
    public static class Classifier {
        private boolean enabled;
        private Set<String> highValueIds = new LinkedHashSet<>();
        private BigDecimal highThreshold = new BigDecimal("10000");
        private BigDecimal mediumThreshold = new BigDecimal("1000");
        private String idAttribute = "customerId";
        private String amountAttribute = "amount";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Set<String> getHighValueIds() {
            return highValueIds;
        }

        public void setHighValueIds(Set<String> highValueIds) {
            this.highValueIds = highValueIds;
        }

        public BigDecimal getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(BigDecimal highThreshold) {
            this.highThreshold = highThreshold;
        }

        public BigDecimal getMediumThreshold() {
            return mediumThreshold;
        }

        public void setMediumThreshold(BigDecimal mediumThreshold) {
            this.mediumThreshold = mediumThreshold;
        }

        public String getIdAttribute() {
            return idAttribute;
        }

        public void setIdAttribute(String idAttribute) {
            this.idAttribute = idAttribute;
        }

        public String getAmountAttribute() {
            return amountAttribute;
        }

        public void setAmountAttribute(String amountAttribute) {
            this.amountAttribute = amountAttribute;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "taskqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
