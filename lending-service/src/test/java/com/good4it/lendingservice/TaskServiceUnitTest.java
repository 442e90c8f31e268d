package com.good4it.lendingservice;

import com.good4it.lendingservice.client.SocialGraphGateway;
import com.good4it.lendingservice.core.exception.*;
import com.good4it.lendingservice.dto.CreateTaskRequest;
import com.good4it.lendingservice.dto.EmiForgivenessRequest;
import com.good4it.lendingservice.model.*;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.repository.TaskRepository;
import com.good4it.lendingservice.service.EntityLockService;
import com.good4it.lendingservice.service.emi.EmiForgivenessReconciler;
import com.good4it.lendingservice.service.implementation.TaskServiceImp;
import com.good4it.lendingservice.service.notification.LendingNotifier;
import com.good4it.lendingservice.service.notification.NotificationEvent;
import com.good4it.lendingservice.service.period.PeriodCalculator;
import com.good4it.lendingservice.service.reputation.ReputationAdapter;
import com.good4it.lendingservice.service.reputation.ScoreChangeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskServiceUnitTest {

    private static final Instant NOW = Instant.parse("2024-03-20T15:00:00Z");

    @Mock
    private TaskRepository taskRepository;
    @Mock
    private MoneyTransactionRepository transactionRepository;
    @Mock
    private SocialGraphGateway socialGraph;
    @Mock
    private EntityLockService lockService;
    @Mock
    private TransactionTemplate transactionTemplate;
    @Mock
    private LendingNotifier notifier;
    @Mock
    private ReputationAdapter reputation;

    private TaskServiceImp service;

    private UUID borrower;
    private UUID lender;

    @BeforeEach
    void setUp() {
        PeriodCalculator periodCalculator = new PeriodCalculator(ZoneOffset.UTC);
        service = new TaskServiceImp(taskRepository, transactionRepository, socialGraph,
                new EmiForgivenessReconciler(periodCalculator), periodCalculator, lockService, transactionTemplate,
                notifier, reputation, Clock.fixed(NOW, ZoneOffset.UTC));

        borrower = UUID.randomUUID();
        lender = UUID.randomUUID();

        lenient().when(lockService.withLock(anyString(), any()))
                .thenAnswer(i -> ((Supplier<?>) i.getArgument(1)).get());
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(i -> ((TransactionCallback<?>) i.getArgument(0)).doInTransaction(null));
        lenient().when(taskRepository.save(any())).thenAnswer(i -> {
            Task task = i.getArgument(0);
            if (task.getId() == null) {
                task.setId(UUID.randomUUID());
            }
            return task;
        });
        lenient().when(transactionRepository.save(any())).thenAnswer(i -> i.getArgument(0));
        lenient().when(socialGraph.areFriends(lender, borrower)).thenReturn(true);
    }

    @Test
    @DisplayName("Lender assigns a valued task to the borrower")
    void testCreateTask_Success() {
        MoneyTransaction transaction = storedTransaction("1000", null);

        Task task = service.createTask(lender, plainTask(transaction.getId(), borrower, "150"));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.getMonetaryValue()).isEqualByComparingTo("150");
        assertThat(task.getCategory()).isEqualTo(TaskCategory.OTHER);
        assertThat(task.getPriority()).isEqualTo(TaskPriority.MEDIUM);
        assertThat(task.isEmiTask()).isFalse();
        verify(notifier).notify(eq(NotificationEvent.TASK_ASSIGNED), eq(borrower), eq(lender), any(), any(), anyString());
    }

    @Test
    @DisplayName("Only the lender of the transaction may assign tasks")
    void testCreateTask_ByBorrower() {
        MoneyTransaction transaction = storedTransaction("1000", null);

        assertThatThrownBy(() -> service.createTask(borrower, plainTask(transaction.getId(), lender, "150")))
                .isInstanceOf(NotAuthorizedPartyException.class);
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("Tasks can only go to the borrower of the transaction")
    void testCreateTask_WrongAssignee() {
        MoneyTransaction transaction = storedTransaction("1000", null);

        assertThatThrownBy(() -> service.createTask(lender, plainTask(transaction.getId(), UUID.randomUUID(), "150")))
                .isInstanceOf(InvalidLendingRequestException.class)
                .extracting("code").isEqualTo(InvalidLendingRequestException.INVALID_TASK);
    }

    @Test
    @DisplayName("Only one open task per transaction")
    void testCreateTask_OpenTaskExists() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        when(taskRepository.existsByReferenceTransactionIdAndStatusIn(transaction.getId(), TaskStatus.OPEN))
                .thenReturn(true);

        assertThatThrownBy(() -> service.createTask(lender, plainTask(transaction.getId(), borrower, "150")))
                .isInstanceOf(InvalidStateTransitionException.class)
                .extracting("code").isEqualTo("OPEN_TASK_EXISTS");
    }

    @Test
    @DisplayName("Settled transactions do not take tasks")
    void testCreateTask_SettledTransaction() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        transaction.setStatus(TransactionStatus.REPAID);

        assertThatThrownBy(() -> service.createTask(lender, plainTask(transaction.getId(), borrower, "150")))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Task value above 10,000 is refused")
    void testCreateTask_ValueTooHigh() {
        assertThatThrownBy(() -> service.createTask(lender, plainTask(UUID.randomUUID(), borrower, "10000.01")))
                .extracting("code").isEqualTo(InvalidLendingRequestException.INVALID_AMOUNT);
        verifyNoInteractions(transactionRepository);
    }

    @Test
    @DisplayName("Task value that rounds to zero is refused")
    void testCreateTask_ValueRoundsToZero() {
        assertThatThrownBy(() -> service.createTask(lender, plainTask(UUID.randomUUID(), borrower, "0.00001")))
                .extracting("code").isEqualTo(InvalidLendingRequestException.INVALID_AMOUNT);
        verifyNoInteractions(transactionRepository, taskRepository);
    }

    @Test
    @DisplayName("EMI task window defaults to the month the loan was opened")
    void testCreateEmiTask_DefaultStartMonth() {
        MoneyTransaction transaction = storedTransaction("1200", monthlyPlan());
        transaction.setCreatedAt(Instant.parse("2024-02-15T08:00:00Z"));

        Task task = service.createTask(lender, emiTask(transaction.getId(), new EmiForgivenessRequest(2, null)));

        assertThat(task.isEmiTask()).isTrue();
        assertThat(task.getEmiForgiveness().getStartMonth()).isEqualTo("2024-02");
        assertThat(task.getEmiForgiveness().getEndMonth()).isEqualTo("2024-03");
        assertThat(task.getMonetaryValue()).isEqualByComparingTo("200");
    }

    @Test
    @DisplayName("EMI task cannot forgive more installments than the loan size allows")
    void testCreateEmiTask_TooManyEmis() {
        MoneyTransaction transaction = storedTransaction("300", monthlyPlan());

        assertThatThrownBy(() -> service.createTask(lender,
                emiTask(transaction.getId(), new EmiForgivenessRequest(4, "2024-03"))))
                .extracting("code").isEqualTo(InvalidLendingRequestException.INVALID_EMI_DETAILS);
    }

    @Test
    @DisplayName("EMI task needs an EMI transaction")
    void testCreateEmiTask_NotEmi() {
        MoneyTransaction transaction = storedTransaction("1200", null);

        assertThatThrownBy(() -> service.createTask(lender,
                emiTask(transaction.getId(), new EmiForgivenessRequest(1, "2024-03"))))
                .isInstanceOf(NotEmiTransactionException.class);
    }

    @Test
    @DisplayName("Accept, start, complete and confirm credits the task value to the loan")
    void testFullLifecycle() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        Task task = storedTask(transaction, TaskStatus.PENDING, false);
        task.setMonetaryValue(new BigDecimal("150"));

        service.accept(task.getId(), borrower);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.ACCEPTED);
        assertThat(task.getAcceptedAt()).isEqualTo(NOW);

        service.start(task.getId(), borrower);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);

        service.complete(task.getId(), borrower, "Done, boxes are in the garage");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getCompletionNotes()).isEqualTo("Done, boxes are in the garage");

        Task confirmed = service.confirm(task.getId(), lender, "Thanks!");

        assertThat(confirmed.getStatus()).isEqualTo(TaskStatus.CONFIRMED);
        assertThat(confirmed.getAmountRepaid()).isEqualByComparingTo("150");
        assertThat(transaction.getRepaymentAmount()).isEqualByComparingTo("150");
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.MONEY_RECEIVED);
        verify(reputation).record(eq(borrower), eq(ScoreChangeType.REPAYMENT_COMPLETED), any(),
                eq(transaction.getId()), anyString());
        verify(notifier).notify(eq(NotificationEvent.TASK_CONFIRMED), eq(borrower), eq(lender), any(), any());
    }

    @Test
    @DisplayName("Confirming an EMI task that covers the rest of the loan settles it")
    void testConfirmEmiTask_Settles() {
        MoneyTransaction transaction = storedTransaction("600", monthlyPlan());
        transaction.setRepaymentAmount(new BigDecimal("400"));
        Task task = storedTask(transaction, TaskStatus.COMPLETED, true);
        task.setEmiForgiveness(EmiForgivenessWindow.builder()
                .forgivenEmis(2).startMonth("2024-05").endMonth("2024-06").build());

        service.confirm(task.getId(), lender, null);

        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.REPAID);
        assertThat(transaction.getTotalForgivenEmis()).isEqualTo(2);
        assertThat(transaction.getRepaymentReceivedAt()).isEqualTo(NOW);
        verify(reputation).record(eq(lender), eq(ScoreChangeType.FORGIVENESS_GIVEN), any(),
                eq(transaction.getId()), anyString());
        verify(reputation).record(eq(borrower), eq(ScoreChangeType.FORGIVENESS_RECEIVED), any(),
                eq(transaction.getId()), anyString());
    }

    @Test
    @DisplayName("Task cannot be credited while a repayment awaits confirmation")
    void testConfirm_TransactionBusy() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        transaction.setStatus(TransactionStatus.REPAYMENT_SENT);
        Task task = storedTask(transaction, TaskStatus.COMPLETED, false);

        assertThatThrownBy(() -> service.confirm(task.getId(), lender, null))
                .isInstanceOf(InvalidStateTransitionException.class);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        verifyNoInteractions(reputation);
    }

    @Test
    @DisplayName("Borrower cannot confirm their own task")
    void testConfirm_ByAssignee() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        Task task = storedTask(transaction, TaskStatus.COMPLETED, false);

        assertThatThrownBy(() -> service.confirm(task.getId(), borrower, null))
                .isInstanceOf(NotAuthorizedPartyException.class);
    }

    @Test
    @DisplayName("Starting a pending task accepts it implicitly")
    void testStartFromPending() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        Task task = storedTask(transaction, TaskStatus.PENDING, false);

        service.start(task.getId(), borrower);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(task.getAcceptedAt()).isEqualTo(NOW);
        assertThat(task.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Pending task cannot be completed")
    void testCompleteFromPending() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        Task task = storedTask(transaction, TaskStatus.PENDING, false);

        assertThatThrownBy(() -> service.complete(task.getId(), borrower, null))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Declining needs a reason and is up to the assignee")
    void testDecline() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        Task task = storedTask(transaction, TaskStatus.PENDING, false);

        assertThatThrownBy(() -> service.decline(task.getId(), borrower, ""))
                .extracting("code").isEqualTo(InvalidLendingRequestException.MISSING_REASON);
        assertThatThrownBy(() -> service.decline(task.getId(), lender, "no"))
                .isInstanceOf(NotAuthorizedPartyException.class);

        service.decline(task.getId(), borrower, "Out of town");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.DECLINED);
        assertThat(task.getDeclineReason()).isEqualTo("Out of town");
    }

    @Test
    @DisplayName("Assigner can cancel an unfinished task but not a confirmed one")
    void testCancel() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        Task inProgress = storedTask(transaction, TaskStatus.IN_PROGRESS, false);
        Task confirmed = storedTask(transaction, TaskStatus.CONFIRMED, false);

        service.cancel(inProgress.getId(), lender, "Not needed anymore");

        assertThat(inProgress.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(inProgress.getCancellationReason()).isEqualTo("Not needed anymore");
        assertThatThrownBy(() -> service.cancel(confirmed.getId(), lender, null))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Available borrowers are the lender's held loans that have no open task")
    void testAvailableBorrowers() {
        MoneyTransaction transaction = storedTransaction("1000", null);
        when(transactionRepository.findWithoutOpenTask(lender,
                EnumSet.of(TransactionStatus.MONEY_SENT, TransactionStatus.MONEY_RECEIVED), TaskStatus.OPEN))
                .thenReturn(List.of(transaction));

        assertThat(service.availableBorrowers(lender)).containsExactly(transaction);
    }

    private MoneyTransaction storedTransaction(String amount, EmiDetails plan) {
        MoneyTransaction transaction = MoneyTransaction.builder()
                .id(UUID.randomUUID())
                .requestId(UUID.randomUUID())
                .requestorId(borrower)
                .lenderId(lender)
                .amount(new BigDecimal(amount))
                .status(TransactionStatus.MONEY_RECEIVED)
                .paymentType(plan == null ? PaymentType.FULL_PAYMENT : PaymentType.EMI)
                .emiDetails(plan)
                .createdAt(Instant.parse("2024-03-01T00:00:00Z"))
                .build();
        lenient().when(transactionRepository.findById(transaction.getId())).thenReturn(Optional.of(transaction));
        return transaction;
    }

    private Task storedTask(MoneyTransaction transaction, TaskStatus status, boolean emiTask) {
        Task task = Task.builder()
                .id(UUID.randomUUID())
                .title("Help me move")
                .dueDate(NOW.plusSeconds(86400))
                .assignedBy(lender)
                .assignedTo(borrower)
                .referenceTransactionId(transaction.getId())
                .status(status)
                .emiTask(emiTask)
                .build();
        lenient().when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        return task;
    }

    private static EmiDetails monthlyPlan() {
        return EmiDetails.builder()
                .numberOfInstallments(12)
                .installmentAmount(new BigDecimal("100"))
                .frequency(EmiFrequency.MONTHLY)
                .build();
    }

    private static CreateTaskRequest plainTask(UUID transactionId, UUID assignee, String value) {
        return new CreateTaskRequest("Help me move", "Saturday morning", null, null, "Downtown",
                NOW.plusSeconds(86400), assignee, transactionId, new BigDecimal(value), false, null);
    }

    private CreateTaskRequest emiTask(UUID transactionId, EmiForgivenessRequest forgiveness) {
        return new CreateTaskRequest("Walk the dog", null, TaskCategory.OTHER, TaskPriority.LOW, null,
                NOW.plusSeconds(86400), borrower, transactionId, null, true, forgiveness);
    }
}
