package org.iceforge.tilecut.api;

import jakarta.validation.Valid;
import org.iceforge.tilecut.task.TaskModels;
import org.iceforge.tilecut.task.TaskService;
import org.iceforge.tilecut.task.TaskState;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Task lifecycle: submit a catalog, poll status, cancel, download the result archive.
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = Objects.requireNonNull(taskService);
    }

    @PostMapping
    public ResponseEntity<TaskModels.TaskStatusResponse> submit(@Valid @RequestBody TaskModels.SubmitTaskRequest req) {
        TaskState created = taskService.submit(req);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskModels.TaskStatusResponse.from(created));
    }

    @GetMapping
    public List<TaskModels.TaskStatusResponse> list() {
        return taskService.list().stream()
                .map(TaskModels.TaskStatusResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskModels.TaskStatusResponse> status(@PathVariable String taskId) {
        return taskService.status(taskId)
                .map(s -> ResponseEntity.ok(TaskModels.TaskStatusResponse.from(s)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<TaskModels.TaskStatusResponse> cancel(@PathVariable String taskId) {
        return taskService.cancel(taskId)
                .map(s -> ResponseEntity.accepted().body(TaskModels.TaskStatusResponse.from(s)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{taskId}/download")
    public ResponseEntity<Resource> download(@PathVariable String taskId) {
        TaskState s = taskService.status(taskId).orElse(null);
        if (s == null) return ResponseEntity.notFound().build();
        if (s.status() != TaskModels.Status.COMPLETED) return ResponseEntity.status(HttpStatus.CONFLICT).build();

        Path zip = taskService.archive(taskId).orElse(null);
        if (zip == null) return ResponseEntity.status(HttpStatus.GONE).build();

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"cutouts_" + taskId + ".zip\"")
                .body(new FileSystemResource(zip));
    }
}
