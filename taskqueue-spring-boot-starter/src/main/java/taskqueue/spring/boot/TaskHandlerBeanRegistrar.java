package taskqueue.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import taskqueue.TaskHandler;
import taskqueue.registry.DefaultHandlerRegistry;

import java.util.Map;

/**
 * Scans for beans annotated with {@link TaskHandlerBean} and registers them
 * in the {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see TaskHandlerBean
 */
public class TaskHandlerBeanRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;

    public TaskHandlerBeanRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(TaskHandlerBean.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof TaskHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @TaskHandlerBean must implement TaskHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            TaskHandlerBean annotation = AnnotationUtils.findAnnotation(bean.getClass(), TaskHandlerBean.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @TaskHandlerBean annotation on " + bean.getClass().getName());
            }

            String taskType = annotation.value();
            if (taskType.isEmpty()) {
                throw new BeanCreationException(beanName, "@TaskHandlerBean task type must not be empty");
            }
            try {
                registry.register(taskType, handler);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }
}
