package com.good4it.lendingservice.controller;

import com.good4it.lendingservice.dto.AvailableBorrowerResponse;
import com.good4it.lendingservice.dto.CreateTaskRequest;
import com.good4it.lendingservice.dto.NotesRequest;
import com.good4it.lendingservice.dto.ReasonRequest;
import com.good4it.lendingservice.dto.TaskResponse;
import com.good4it.lendingservice.dto.TaskRoleFilter;
import com.good4it.lendingservice.service.TaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @PostMapping
    public ResponseEntity<TaskResponse> createTask(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody @Valid CreateTaskRequest request
    ) {
        return new ResponseEntity<>(TaskResponse.from(taskService.createTask(userId, request)), HttpStatus.CREATED);
    }

    @GetMapping("/available-borrowers")
    public ResponseEntity<List<AvailableBorrowerResponse>> availableBorrowers(@RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(taskService.availableBorrowers(userId).stream()
                .map(AvailableBorrowerResponse::from)
                .toList());
    }

    @PostMapping("/{taskId}/accept")
    public ResponseEntity<TaskResponse> accept(@RequestHeader("X-User-ID") UUID userId, @PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.accept(taskId, userId)));
    }

    @PostMapping("/{taskId}/decline")
    public ResponseEntity<TaskResponse> decline(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID taskId,
            @RequestBody @Valid ReasonRequest request
    ) {
        return ResponseEntity.ok(TaskResponse.from(taskService.decline(taskId, userId, request.reason())));
    }

    @PostMapping("/{taskId}/start")
    public ResponseEntity<TaskResponse> start(@RequestHeader("X-User-ID") UUID userId, @PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.start(taskId, userId)));
    }

    @PostMapping("/{taskId}/complete")
    public ResponseEntity<TaskResponse> complete(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID taskId,
            @RequestBody(required = false) @Valid NotesRequest request
    ) {
        return ResponseEntity.ok(TaskResponse.from(taskService.complete(taskId, userId, notes(request))));
    }

    @PostMapping("/{taskId}/confirm")
    public ResponseEntity<TaskResponse> confirm(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID taskId,
            @RequestBody(required = false) @Valid NotesRequest request
    ) {
        return ResponseEntity.ok(TaskResponse.from(taskService.confirm(taskId, userId, notes(request))));
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<TaskResponse> cancel(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID taskId,
            @RequestBody(required = false) @Valid NotesRequest request
    ) {
        return ResponseEntity.ok(TaskResponse.from(taskService.cancel(taskId, userId, notes(request))));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@RequestHeader("X-User-ID") UUID userId, @PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.getTask(taskId, userId)));
    }

    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestParam(defaultValue = "ASSIGNED_TO_ME") TaskRoleFilter role
    ) {
        return ResponseEntity.ok(taskService.listTasks(userId, role).stream()
                .map(TaskResponse::from)
                .toList());
    }

    private static String notes(NotesRequest request) {
        return request == null ? null : request.notes();
    }
}
