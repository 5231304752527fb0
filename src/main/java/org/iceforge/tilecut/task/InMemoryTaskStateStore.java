package org.iceforge.tilecut.task;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Component
public class InMemoryTaskStateStore implements TaskStateStore {

    private final ConcurrentHashMap<String, TaskState> tasks = new ConcurrentHashMap<>();

    @Override
    public Optional<TaskState> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public TaskState create(TaskState initial) {
        Objects.requireNonNull(initial, "initial");
        TaskState prior = tasks.putIfAbsent(initial.taskId(), initial);
        if (prior != null) {
            throw new IllegalStateException("Task already exists: " + initial.taskId());
        }
        return initial;
    }

    @Override
    public Optional<TaskState> update(String taskId, UnaryOperator<TaskState> fn) {
        Objects.requireNonNull(fn, "fn");
        return Optional.ofNullable(tasks.computeIfPresent(taskId, (id, current) -> Objects.requireNonNull(fn.apply(current))));
    }

    @Override
    public List<TaskState> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(TaskState::createdAt).reversed().thenComparing(TaskState::taskId))
                .collect(Collectors.toList());
    }
}
