package taskqueue.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskQueuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(TaskQueueProperties.class);
            assertTrue(props.isEnabled());
            assertEquals(4, props.getWorkerCount());
            assertEquals(Duration.ofSeconds(30), props.getHandlerTimeout());
            assertEquals(Duration.ofMillis(100), props.getIdleWait());
            assertEquals(Duration.ofSeconds(5), props.getShutdownTimeout());
            assertEquals(0, props.getQueue().getHighCapacity());
            assertEquals(0, props.getQueue().getMediumCapacity());
            assertEquals(0, props.getQueue().getLowCapacity());
            assertEquals(3, props.getRetry().getMaxRetries());
            assertEquals(Duration.ofSeconds(1), props.getRetry().getBaseDelay());
            assertEquals(Duration.ofMinutes(5), props.getRetry().getMaxDelay());
            assertFalse(props.getRetry().isJitter());
            assertFalse(props.getClassifier().isEnabled());
            assertTrue(props.getClassifier().getHighValueIds().isEmpty());
            assertEquals(0, new BigDecimal("10000").compareTo(props.getClassifier().getHighThreshold()));
            assertEquals(0, new BigDecimal("1000").compareTo(props.getClassifier().getMediumThreshold()));
            assertEquals("customerId", props.getClassifier().getIdAttribute());
            assertEquals("amount", props.getClassifier().getAmountAttribute());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("taskqueue", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "taskqueue.enabled=false",
                "taskqueue.worker-count=8",
                "taskqueue.handler-timeout=PT10S",
                "taskqueue.idle-wait=50ms",
                "taskqueue.shutdown-timeout=PT20S",
                "taskqueue.queue.high-capacity=100",
                "taskqueue.queue.medium-capacity=200",
                "taskqueue.queue.low-capacity=300",
                "taskqueue.retry.max-retries=5",
                "taskqueue.retry.base-delay=500ms",
                "taskqueue.retry.max-delay=PT2M",
                "taskqueue.retry.jitter=true",
                "taskqueue.classifier.enabled=true",
                "taskqueue.classifier.high-value-ids=vip-1,vip-2",
                "taskqueue.classifier.high-threshold=5000",
                "taskqueue.classifier.medium-threshold=250.50",
                "taskqueue.classifier.id-attribute=accountId",
                "taskqueue.classifier.amount-attribute=total",
                "taskqueue.metrics.enabled=false",
                "taskqueue.metrics.name-prefix=billing.taskqueue"
        ).run(ctx -> {
            var props = ctx.getBean(TaskQueueProperties.class);
            assertFalse(props.isEnabled());
            assertEquals(8, props.getWorkerCount());
            assertEquals(Duration.ofSeconds(10), props.getHandlerTimeout());
            assertEquals(Duration.ofMillis(50), props.getIdleWait());
            assertEquals(Duration.ofSeconds(20), props.getShutdownTimeout());
            assertEquals(100, props.getQueue().getHighCapacity());
            assertEquals(200, props.getQueue().getMediumCapacity());
            assertEquals(300, props.getQueue().getLowCapacity());
            assertEquals(5, props.getRetry().getMaxRetries());
            assertEquals(Duration.ofMillis(500), props.getRetry().getBaseDelay());
            assertEquals(Duration.ofMinutes(2), props.getRetry().getMaxDelay());
            assertTrue(props.getRetry().isJitter());
            assertTrue(props.getClassifier().isEnabled());
            assertEquals(Set.of("vip-1", "vip-2"), props.getClassifier().getHighValueIds());
            assertEquals(0, new BigDecimal("5000").compareTo(props.getClassifier().getHighThreshold()));
            assertEquals(0, new BigDecimal("250.50").compareTo(props.getClassifier().getMediumThreshold()));
            assertEquals("accountId", props.getClassifier().getIdAttribute());
            assertEquals("total", props.getClassifier().getAmountAttribute());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("billing.taskqueue", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(TaskQueueProperties.class)
    static class PropsConfig {
    }
}
