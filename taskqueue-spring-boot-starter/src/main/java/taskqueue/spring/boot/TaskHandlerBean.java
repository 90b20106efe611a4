package taskqueue.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one task type.
 *
 * <p>The annotated bean must implement {@link taskqueue.TaskHandler}.
 *
 * <pre>{@code
 * @Component
 * @TaskHandlerBean("send_invoice")
 * public class InvoiceHandler implements TaskHandler {
 *   public TaskResult handle(Object payload) { ... }
 * }
 * }</pre>
 *
 * @see TaskHandlerBeanRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TaskHandlerBean {

    /**
     * Task type handled by the bean. Must be non-empty and unique across the registry.
     */
    String value();
}
