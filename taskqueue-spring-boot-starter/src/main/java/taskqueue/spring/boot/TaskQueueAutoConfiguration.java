package taskqueue.spring.boot;

import taskqueue.Priority;
import taskqueue.TaskQueue;
import taskqueue.classify.PriorityClassifier;
import taskqueue.classify.ThresholdPriorityClassifier;
import taskqueue.registry.DefaultHandlerRegistry;
import taskqueue.retry.ExponentialBackoffRetryPolicy;
import taskqueue.retry.RetryPolicy;
import taskqueue.spi.MetricsExporter;
import taskqueue.worker.TaskInterceptor;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the task queue.
 *
 * <p>Wires a started {@link TaskQueue} from {@link TaskQueueProperties}, a
 * {@link DefaultHandlerRegistry} filled from {@link TaskHandlerBean} beans, and any
 * {@link MetricsExporter}, {@link TaskInterceptor}, {@link RetryPolicy} or
 * {@link PriorityClassifier} beans in the context. Handlers are looked up per execution,
 * so handler beans registered after the queue starts are still picked up.
 *
 * @see TaskQueueProperties
 * @see TaskQueueMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(TaskQueue.class)
@ConditionalOnProperty(prefix = "taskqueue", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TaskQueueProperties.class)
public class TaskQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskHandlerBeanRegistrar taskHandlerBeanRegistrar(
      ListableBeanFactory beanFactory, DefaultHandlerRegistry handlerRegistry) {
    return new TaskHandlerBeanRegistrar(beanFactory, handlerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "taskqueue.classifier", name = "enabled", havingValue = "true")
  public PriorityClassifier priorityClassifier(TaskQueueProperties props) {
    var c = props.getClassifier();
    return ThresholdPriorityClassifier.builder()
        .highValueIds(c.getHighValueIds())
        .highThreshold(c.getHighThreshold())
        .mediumThreshold(c.getMediumThreshold())
        .idAttribute(c.getIdAttribute())
        .amountAttribute(c.getAmountAttribute())
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public TaskQueue taskQueue(TaskQueueProperties props,
      DefaultHandlerRegistry handlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<TaskInterceptor> interceptorProvider,
      ObjectProvider<RetryPolicy> retryPolicyProvider,
      ObjectProvider<PriorityClassifier> classifierProvider) {

    List<TaskInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(() -> new ExponentialBackoffRetryPolicy(
        props.getRetry().getBaseDelay().toMillis(),
        props.getRetry().getMaxDelay().toMillis(),
        props.getRetry().isJitter()));

    var builder = TaskQueue.builder()
        .handlerRegistry(handlerRegistry)
        .workerCount(props.getWorkerCount())
        .capacity(Priority.HIGH, props.getQueue().getHighCapacity())
        .capacity(Priority.MEDIUM, props.getQueue().getMediumCapacity())
        .capacity(Priority.LOW, props.getQueue().getLowCapacity())
        .retryPolicy(retryPolicy)
        .defaultMaxRetries(props.getRetry().getMaxRetries())
        .handlerTimeout(props.getHandlerTimeout())
        .idleWait(props.getIdleWait())
        .drainTimeout(props.getShutdownTimeout())
        .interceptors(interceptors);

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    PriorityClassifier classifier = classifierProvider.getIfAvailable();
    if (classifier != null) {
      builder.classifier(classifier);
    }
    return builder.build();
  }
}
