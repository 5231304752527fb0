package org.iceforge.tilecut.task;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Where task snapshots live. Implementations must apply {@link #update} atomically per task.
 */
public interface TaskStateStore {

    Optional<TaskState> get(String taskId);

    /**
     * @throws IllegalStateException if a task with the same id already exists
     */
    TaskState create(TaskState initial);

    /**
     * Replaces the task's snapshot with {@code fn(current)}.
     *
     * @return the new snapshot, or empty if the task does not exist
     */
    Optional<TaskState> update(String taskId, UnaryOperator<TaskState> fn);

    /** All tasks, newest first. */
    List<TaskState> list();
}
