package com.good4it.lendingservice.service;

import com.good4it.lendingservice.dto.CreateTaskRequest;
import com.good4it.lendingservice.dto.TaskRoleFilter;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.Task;

import java.util.List;
import java.util.UUID;

public interface TaskService {

    Task createTask(UUID assignedBy, CreateTaskRequest request);

    Task accept(UUID taskId, UUID actorId);

    Task decline(UUID taskId, UUID actorId, String reason);

    Task start(UUID taskId, UUID actorId);

    Task complete(UUID taskId, UUID actorId, String notes);

    Task confirm(UUID taskId, UUID actorId, String notes);

    Task cancel(UUID taskId, UUID actorId, String reason);

    Task getTask(UUID taskId, UUID actorId);

    List<Task> listTasks(UUID userId, TaskRoleFilter filter);

    List<MoneyTransaction> availableBorrowers(UUID lenderId);
}
