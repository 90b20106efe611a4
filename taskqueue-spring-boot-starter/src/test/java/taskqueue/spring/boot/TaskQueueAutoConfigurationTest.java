package taskqueue.spring.boot;

import taskqueue.Priority;
import taskqueue.Task;
import taskqueue.TaskHandler;
import taskqueue.TaskQueue;
import taskqueue.TaskResult;
import taskqueue.classify.PriorityClassifier;
import taskqueue.classify.ThresholdPriorityClassifier;
import taskqueue.registry.DefaultHandlerRegistry;
import taskqueue.retry.FixedDelayRetryPolicy;
import taskqueue.retry.RetryPolicy;
import taskqueue.worker.TaskInterceptor;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(TaskQueueAutoConfiguration.class))
      .withPropertyValues("taskqueue.idle-wait=20ms", "taskqueue.shutdown-timeout=PT1S");

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(condition.getAsBoolean(), "condition not met within 5s");
  }

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("handlerRegistry"));
      assertTrue(ctx.containsBean("taskHandlerBeanRegistrar"));
      assertTrue(ctx.containsBean("taskQueue"));
      assertFalse(ctx.containsBean("priorityClassifier"));

      assertInstanceOf(DefaultHandlerRegistry.class, ctx.getBean(DefaultHandlerRegistry.class));
      assertTrue(ctx.getBean(TaskQueue.class).healthCheck().running());
    });
  }

  @Test
  void processesTasksThroughAnnotatedHandler() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      var queue = ctx.getBean(TaskQueue.class);
      var handler = ctx.getBean(EchoHandler.class);
      queue.enqueue("echo", "hello", Priority.HIGH);
      await(() -> queue.stats().processed() == 1);
      assertEquals(List.of("hello"), handler.seen);
    });
  }

  @Test
  void appliesWorkerAndCapacityProperties() {
    runner
        .withPropertyValues("taskqueue.worker-count=2", "taskqueue.queue.low-capacity=1")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          var queue = ctx.getBean(TaskQueue.class);
          assertEquals(2, queue.healthCheck().workerCount());
        });
  }

  @Test
  void appliesDefaultMaxRetries() {
    runner
        .withPropertyValues("taskqueue.retry.max-retries=1", "taskqueue.retry.base-delay=10ms")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          var queue = ctx.getBean(TaskQueue.class);
          queue.enqueue("always_fails", null, Priority.MEDIUM);
          await(() -> queue.stats().deadLettered() == 1);
          assertEquals(2, queue.stats().failed());
          assertEquals(1, queue.stats().retried());
        });
  }

  @Test
  void usesRetryPolicyBean() {
    runner.withUserConfiguration(HandlerConfig.class, RetryPolicyConfig.class).run(ctx -> {
      var queue = ctx.getBean(TaskQueue.class);
      queue.enqueue("always_fails", null, Priority.LOW, 2);
      await(() -> queue.stats().deadLettered() == 1);
      assertEquals(2, queue.stats().retried());
    });
  }

  @Test
  void appliesInterceptorBeans() {
    runner.withUserConfiguration(HandlerConfig.class, InterceptorConfig.class).run(ctx -> {
      var queue = ctx.getBean(TaskQueue.class);
      List<String> seen = ctx.getBean(InterceptedTypes.class).types;
      queue.enqueue("echo", "x", Priority.HIGH);
      await(() -> queue.stats().processed() == 1);
      assertEquals(List.of("echo"), seen);
    });
  }

  @Test
  void classifierFromProperties() {
    runner
        .withPropertyValues("taskqueue.classifier.enabled=true",
            "taskqueue.classifier.high-value-ids=vip")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          var classifier = ctx.getBean(PriorityClassifier.class);
          assertInstanceOf(ThresholdPriorityClassifier.class, classifier);
          assertEquals(Priority.HIGH, classifier.classify(Map.of("customerId", "vip")));

          var queue = ctx.getBean(TaskQueue.class);
          queue.enqueue("echo", "classified", Map.of("amount", 5000));
          await(() -> queue.stats().processed() == 1);
        });
  }

  @Test
  void attributeEnqueueWithoutClassifierFails() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      var queue = ctx.getBean(TaskQueue.class);
      assertThrows(IllegalStateException.class,
          () -> queue.enqueue("echo", "x", Map.of("amount", 1)));
    });
  }

  @Test
  void disabledByProperty() {
    runner
        .withPropertyValues("taskqueue.enabled=false")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          assertFalse(ctx.containsBean("taskQueue"));
          assertFalse(ctx.containsBean("handlerRegistry"));
        });
  }

  @Test
  void backsOffWhenCustomRegistryPresent() {
    runner.withUserConfiguration(CustomRegistryConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertNotNull(registry.handlerFor("custom"));
    });
  }

  @Test
  void shutsDownQueueOnContextClose() {
    TaskQueue[] holder = new TaskQueue[1];
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      holder[0] = ctx.getBean(TaskQueue.class);
      assertFalse(holder[0].isShutdown());
    });
    assertTrue(holder[0].isShutdown());
  }

  @Test
  void invalidWorkerCountFailsStartup() {
    runner
        .withPropertyValues("taskqueue.worker-count=0")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }

  // ── Test support ─────────────────────────────────────────────

  @TaskHandlerBean("echo")
  static class EchoHandler implements TaskHandler {
    final List<Object> seen = new CopyOnWriteArrayList<>();

    @Override
    public TaskResult handle(Object payload) {
      seen.add(payload);
      return TaskResult.success();
    }
  }

  @TaskHandlerBean("always_fails")
  static class FailingHandler implements TaskHandler {
    @Override
    public TaskResult handle(Object payload) {
      return TaskResult.retry("downstream unavailable");
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    EchoHandler echoHandler() {
      return new EchoHandler();
    }

    @Bean
    FailingHandler failingHandler() {
      return new FailingHandler();
    }
  }

  @Configuration
  static class RetryPolicyConfig {
    @Bean
    RetryPolicy fastRetry() {
      return new FixedDelayRetryPolicy(10);
    }
  }

  static class InterceptedTypes {
    final List<String> types = new CopyOnWriteArrayList<>();
  }

  @Configuration
  static class InterceptorConfig {
    @Bean
    InterceptedTypes interceptedTypes() {
      return new InterceptedTypes();
    }

    @Bean
    TaskInterceptor recordingInterceptor(InterceptedTypes interceptedTypes) {
      return TaskInterceptor.before((Task task) -> interceptedTypes.types.add(task.taskType()));
    }
  }

  @Configuration
  static class CustomRegistryConfig {
    @Bean
    DefaultHandlerRegistry handlerRegistry() {
      return new DefaultHandlerRegistry()
          .register("custom", payload -> TaskResult.success());
    }
  }
}
