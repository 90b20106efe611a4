package taskqueue.classify;

import taskqueue.Priority;

import java.util.Map;

/**
 * Producer-side policy that picks a lane from task attributes.
 *
 * <p>The queue itself never reorders tasks by content. A classifier only runs when the
 * producer calls {@link taskqueue.TaskQueue#enqueue(String, Object, Map)}.
 */
@FunctionalInterface
public interface PriorityClassifier {

    /**
     * Chooses a priority for a task.
     *
     * @param attributes producer-provided attributes, never null
     * @return the priority, never null
     */
    Priority classify(Map<String, ?> attributes);
}
