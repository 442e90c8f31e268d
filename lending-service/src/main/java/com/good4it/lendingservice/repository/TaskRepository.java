package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.Task;
import com.good4it.lendingservice.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TaskRepository extends JpaRepository<Task, UUID> {

    boolean existsByReferenceTransactionIdAndStatusIn(UUID referenceTransactionId, Collection<TaskStatus> statuses);

    List<Task> findByReferenceTransactionIdAndStatusIn(UUID referenceTransactionId, Collection<TaskStatus> statuses);

    List<Task> findByReferenceTransactionIdAndStatusAndEmiTaskTrue(UUID referenceTransactionId, TaskStatus status);

    List<Task> findByAssignedToOrderByCreatedAtDesc(UUID assignedTo);

    List<Task> findByAssignedByOrderByCreatedAtDesc(UUID assignedBy);
}
