package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.client.SocialGraphGateway;
import com.good4it.lendingservice.core.auth.PartyRole;
import com.good4it.lendingservice.core.exception.*;
import com.good4it.lendingservice.core.util.MoneyUtil;
import com.good4it.lendingservice.dto.CreateTaskRequest;
import com.good4it.lendingservice.dto.EmiForgivenessRequest;
import com.good4it.lendingservice.dto.TaskRoleFilter;
import com.good4it.lendingservice.model.*;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.repository.TaskRepository;
import com.good4it.lendingservice.service.EntityLockService;
import com.good4it.lendingservice.service.TaskService;
import com.good4it.lendingservice.service.emi.EmiForgivenessReconciler;
import com.good4it.lendingservice.service.emi.ReconciliationResult;
import com.good4it.lendingservice.service.notification.LendingNotifier;
import com.good4it.lendingservice.service.period.PeriodCalculator;
import com.good4it.lendingservice.service.notification.NotificationEvent;
import com.good4it.lendingservice.service.notification.NotificationRef;
import com.good4it.lendingservice.service.reputation.ReputationAdapter;
import com.good4it.lendingservice.service.reputation.ScoreChangeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Service
@Slf4j
@RequiredArgsConstructor
public class TaskServiceImp implements TaskService {

    // Tasks can only be offered against money the borrower is holding
    private static final Set<TransactionStatus> TASKABLE =
            EnumSet.of(TransactionStatus.MONEY_SENT, TransactionStatus.MONEY_RECEIVED);

    private final TaskRepository taskRepository;
    private final MoneyTransactionRepository transactionRepository;
    private final SocialGraphGateway socialGraph;
    private final EmiForgivenessReconciler reconciler;
    private final PeriodCalculator periodCalculator;
    private final EntityLockService lockService;
    private final TransactionTemplate tx;
    private final LendingNotifier notifier;
    private final ReputationAdapter reputation;
    private final Clock clock;

    @Override
    public Task createTask(UUID assignedBy, CreateTaskRequest request) {
        validateShape(request);

        Task created = lockService.withLock(EntityLockService.transactionKey(request.referenceTransactionId()), () -> tx.execute(status -> {
            MoneyTransaction transaction = transactionRepository.findById(request.referenceTransactionId())
                    .orElseThrow(() -> new TransactionNotFoundException(request.referenceTransactionId()));

            transaction.requireRole(assignedBy, PartyRole.LENDER);
            if (!transaction.getRequestorId().equals(request.assignedTo())) {
                throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_TASK,
                        "Tasks can only be assigned to the borrower of " + transaction.describe());
            }
            if (!socialGraph.areFriends(assignedBy, request.assignedTo())) {
                throw new NotFriendsException(assignedBy, request.assignedTo());
            }
            if (!TASKABLE.contains(transaction.getStatus())) {
                throw InvalidStateTransitionException.from(transaction.describe(), transaction.getStatus(), "assign a task for");
            }
            if (taskRepository.existsByReferenceTransactionIdAndStatusIn(transaction.getId(), TaskStatus.OPEN)) {
                throw new InvalidStateTransitionException("OPEN_TASK_EXISTS",
                        "An open task already exists for " + transaction.describe());
            }

            Task.TaskBuilder task = Task.builder()
                    .title(request.title().trim())
                    .description(request.description())
                    .category(request.category() == null ? TaskCategory.OTHER : request.category())
                    .priority(request.priority() == null ? TaskPriority.MEDIUM : request.priority())
                    .location(request.location())
                    .dueDate(request.dueDate())
                    .assignedBy(assignedBy)
                    .assignedTo(request.assignedTo())
                    .referenceTransactionId(transaction.getId())
                    .status(TaskStatus.PENDING)
                    .emiTask(request.emiTask());

            if (request.emiTask()) {
                task.emiForgiveness(forgivenessWindow(transaction, request.emiForgiveness()));
                task.monetaryValue(MoneyUtil.format(transaction.getEmiDetails().getInstallmentAmount()
                        .multiply(BigDecimal.valueOf(request.emiForgiveness().forgivenEmis()))));
            } else {
                task.monetaryValue(MoneyUtil.format(request.monetaryValue()));
            }

            return taskRepository.save(task.build());
        }));

        log.info("Task {} assigned by {} to {} against transaction {}",
                created.getId(), assignedBy, created.getAssignedTo(), created.getReferenceTransactionId());

        notifier.notify(NotificationEvent.TASK_ASSIGNED, created.getAssignedTo(), assignedBy,
                created.getMonetaryValue(), ref(created), ": \"" + created.getTitle() + "\"");

        return created;
    }

    @Override
    public Task accept(UUID taskId, UUID actorId) {
        Task task = transition(taskId, t -> {
            t.requireRole(actorId, PartyRole.ASSIGNED_TO);
            requireStatus(t, EnumSet.of(TaskStatus.PENDING), "accept");
            t.setStatus(TaskStatus.ACCEPTED);
            t.setAcceptedAt(Instant.now(clock));
            return t;
        });

        notifyAssigner(task, NotificationEvent.TASK_ACCEPTED, actorId);
        return task;
    }

    @Override
    public Task decline(UUID taskId, UUID actorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.MISSING_REASON,
                    "A reason is required to decline a task");
        }

        Task task = transition(taskId, t -> {
            t.requireRole(actorId, PartyRole.ASSIGNED_TO);
            requireStatus(t, EnumSet.of(TaskStatus.PENDING), "decline");
            t.setStatus(TaskStatus.DECLINED);
            t.setDeclineReason(reason.trim());
            t.setDeclinedAt(Instant.now(clock));
            return t;
        });

        notifyAssigner(task, NotificationEvent.TASK_DECLINED, actorId);
        return task;
    }

    @Override
    public Task start(UUID taskId, UUID actorId) {
        Task task = transition(taskId, t -> {
            t.requireRole(actorId, PartyRole.ASSIGNED_TO);
            requireStatus(t, EnumSet.of(TaskStatus.PENDING, TaskStatus.ACCEPTED), "start");
            Instant now = Instant.now(clock);
            if (t.getAcceptedAt() == null) {
                t.setAcceptedAt(now);
            }
            t.setStatus(TaskStatus.IN_PROGRESS);
            t.setStartedAt(now);
            return t;
        });

        notifyAssigner(task, NotificationEvent.TASK_STARTED, actorId);
        return task;
    }

    @Override
    public Task complete(UUID taskId, UUID actorId, String notes) {
        Task task = transition(taskId, t -> {
            t.requireRole(actorId, PartyRole.ASSIGNED_TO);
            requireStatus(t, EnumSet.of(TaskStatus.ACCEPTED, TaskStatus.IN_PROGRESS), "complete");
            t.setStatus(TaskStatus.COMPLETED);
            t.setCompletedAt(Instant.now(clock));
            t.setCompletionNotes(notes);
            return t;
        });

        notifyAssigner(task, NotificationEvent.TASK_COMPLETED, actorId);
        return task;
    }

    @Override
    public Task confirm(UUID taskId, UUID actorId, String notes) {
        Task peek = load(taskId);

        // Both locks: the task and the transaction it credits
        Task confirmed = lockService.withLock(EntityLockService.transactionKey(peek.getReferenceTransactionId()),
                () -> transition(taskId, t -> {
                    t.requireRole(actorId, PartyRole.ASSIGNED_BY);
                    requireStatus(t, EnumSet.of(TaskStatus.COMPLETED), "confirm");

                    MoneyTransaction transaction = transactionRepository.findById(t.getReferenceTransactionId())
                            .orElseThrow(() -> new TransactionNotFoundException(t.getReferenceTransactionId()));
                    if (transaction.getStatus() != TransactionStatus.MONEY_RECEIVED) {
                        throw InvalidStateTransitionException.from(transaction.describe(), transaction.getStatus(),
                                "credit a task to");
                    }

                    Instant now = Instant.now(clock);
                    ReconciliationResult result = reconciler.applyTaskConfirmation(transaction, t, now);
                    transactionRepository.save(transaction);

                    t.setStatus(TaskStatus.CONFIRMED);
                    t.setConfirmedAt(now);
                    t.setConfirmationNotes(notes);
                    t.setAmountRepaid(result.credited());
                    return t;
                }));

        log.info("Task {} confirmed by {}: {} credited to transaction {}",
                taskId, actorId, confirmed.getAmountRepaid(), confirmed.getReferenceTransactionId());

        notifier.notify(NotificationEvent.TASK_CONFIRMED, confirmed.getAssignedTo(), actorId,
                confirmed.getAmountRepaid(), ref(confirmed));

        if (confirmed.isEmiTask()) {
            reputation.record(actorId, ScoreChangeType.FORGIVENESS_GIVEN, confirmed.getAmountRepaid(),
                    confirmed.getReferenceTransactionId(), "Forgave EMIs in exchange for task: " + confirmed.getTitle());
            reputation.record(confirmed.getAssignedTo(), ScoreChangeType.FORGIVENESS_RECEIVED, confirmed.getAmountRepaid(),
                    confirmed.getReferenceTransactionId(), "EMIs forgiven for task: " + confirmed.getTitle());
        } else {
            reputation.record(confirmed.getAssignedTo(), ScoreChangeType.REPAYMENT_COMPLETED, confirmed.getAmountRepaid(),
                    confirmed.getReferenceTransactionId(), "Repaid through task: " + confirmed.getTitle());
        }

        return confirmed;
    }

    @Override
    public Task cancel(UUID taskId, UUID actorId, String reason) {
        Task task = transition(taskId, t -> {
            t.requireRole(actorId, PartyRole.ASSIGNED_BY);
            requireStatus(t, TaskStatus.CANCELLABLE, "cancel");
            t.setStatus(TaskStatus.CANCELLED);
            t.setCancelledAt(Instant.now(clock));
            t.setCancellationReason(reason == null || reason.isBlank() ? null : reason.trim());
            return t;
        });

        log.info("Task {} cancelled by {}", taskId, actorId);
        notifier.notify(NotificationEvent.TASK_CANCELLED, task.getAssignedTo(), actorId, task.getMonetaryValue(),
                ref(task), task.getCancellationReason() == null ? null : ": " + task.getCancellationReason());
        return task;
    }

    @Override
    public Task getTask(UUID taskId, UUID actorId) {
        Task task = load(taskId);
        task.requireParty(actorId);
        return task;
    }

    @Override
    public List<Task> listTasks(UUID userId, TaskRoleFilter filter) {
        if (filter == TaskRoleFilter.ASSIGNED_BY_ME) {
            return taskRepository.findByAssignedByOrderByCreatedAtDesc(userId);
        }
        return taskRepository.findByAssignedToOrderByCreatedAtDesc(userId);
    }

    @Override
    public List<MoneyTransaction> availableBorrowers(UUID lenderId) {
        return transactionRepository.findWithoutOpenTask(lenderId, TASKABLE, TaskStatus.OPEN);
    }

    private EmiForgivenessWindow forgivenessWindow(MoneyTransaction transaction, EmiForgivenessRequest emi) {
        if (!transaction.isEmi()) {
            throw new NotEmiTransactionException(transaction.getId());
        }

        int max = EmiForgivenessReconciler.maxForgivableEmis(transaction.getAmount());
        if (emi.forgivenEmis() > max) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_EMI_DETAILS,
                    "At most " + max + " EMIs can be forgiven for a loan of " + MoneyUtil.display(transaction.getAmount()));
        }

        YearMonth start = emi.startMonth() != null
                ? YearMonth.parse(emi.startMonth())
                : YearMonth.parse(periodCalculator.monthKey(transaction.getCreatedAt()));

        return EmiForgivenessWindow.builder()
                .forgivenEmis(emi.forgivenEmis())
                .startMonth(start.toString())
                .endMonth(EmiForgivenessReconciler.endMonth(start, emi.forgivenEmis()).toString())
                .build();
    }

    private static void validateShape(CreateTaskRequest request) {
        if (request.title() == null || request.title().isBlank() || request.title().length() > 100) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_TASK,
                    "Task title is required and limited to 100 characters");
        }
        if (request.dueDate() == null) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_TASK,
                    "Task due date is required");
        }
        if (request.emiTask()) {
            EmiForgivenessRequest emi = request.emiForgiveness();
            if (emi == null || emi.forgivenEmis() == null || emi.forgivenEmis() < 1
                    || emi.forgivenEmis() > EmiForgivenessReconciler.MAX_FORGIVABLE_EMIS) {
                throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_EMI_DETAILS,
                        "EMI tasks must forgive between 1 and 24 EMIs");
            }
            return;
        }
        BigDecimal value = MoneyUtil.format(request.monetaryValue());
        if (!MoneyUtil.isPositive(value) || value.compareTo(MoneyUtil.MAX_TASK_VALUE) > 0) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_AMOUNT,
                    "Task value must be above 0 and at most 10,000");
        }
    }

    private Task transition(UUID taskId, UnaryOperator<Task> change) {
        return lockService.withLock(EntityLockService.taskKey(taskId), () -> tx.execute(status -> {
            Task task = load(taskId);
            return taskRepository.save(change.apply(task));
        }));
    }

    private void notifyAssigner(Task task, NotificationEvent event, UUID actorId) {
        log.info("Task {} is now {}", task.getId(), task.getStatus());
        notifier.notify(event, task.getAssignedBy(), actorId, task.getMonetaryValue(), ref(task),
                ": \"" + task.getTitle() + "\"");
    }

    private static NotificationRef ref(Task task) {
        return NotificationRef.task(task.getId(), task.getReferenceTransactionId());
    }

    private Task load(UUID taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private static void requireStatus(Task task, Set<TaskStatus> allowed, String operation) {
        if (!allowed.contains(task.getStatus())) {
            throw InvalidStateTransitionException.from(task.describe(), task.getStatus(), operation);
        }
    }
}
