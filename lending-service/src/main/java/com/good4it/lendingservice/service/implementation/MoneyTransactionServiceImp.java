package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.core.auth.PartyRole;
import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;
import com.good4it.lendingservice.core.exception.InvalidStateTransitionException;
import com.good4it.lendingservice.core.exception.NotEmiTransactionException;
import com.good4it.lendingservice.core.exception.TransactionNotFoundException;
import com.good4it.lendingservice.core.util.MoneyUtil;
import com.good4it.lendingservice.dto.EmiHistoryResponse;
import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.model.*;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.repository.RepaymentReminderRepository;
import com.good4it.lendingservice.repository.TaskRepository;
import com.good4it.lendingservice.service.EntityLockService;
import com.good4it.lendingservice.service.MoneyTransactionService;
import com.good4it.lendingservice.service.ProofService;
import com.good4it.lendingservice.service.emi.PaymentDue;
import com.good4it.lendingservice.service.emi.PaymentDueEvaluator;
import com.good4it.lendingservice.service.notification.LendingNotifier;
import com.good4it.lendingservice.service.notification.NotificationEvent;
import com.good4it.lendingservice.service.notification.NotificationRef;
import com.good4it.lendingservice.service.reputation.ReputationAdapter;
import com.good4it.lendingservice.service.reputation.ScoreChangeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Service
@Slf4j
@RequiredArgsConstructor
public class MoneyTransactionServiceImp implements MoneyTransactionService {

    public static final Duration EARLY_REPAYMENT_WINDOW = Duration.ofHours(24);
    public static final Duration LATE_REPAYMENT_THRESHOLD = Duration.ofDays(7);
    public static final String DEFAULT_REMINDER_MESSAGE = "Please repay the money you borrowed.";

    private static final Set<TransactionStatus> REMINDABLE =
            EnumSet.of(TransactionStatus.MONEY_RECEIVED, TransactionStatus.REPAYMENT_SENT);

    private final MoneyTransactionRepository transactionRepository;
    private final RepaymentReminderRepository reminderRepository;
    private final TaskRepository taskRepository;
    private final ProofService proofService;
    private final PaymentDueEvaluator paymentDueEvaluator;
    private final EntityLockService lockService;
    private final TransactionTemplate tx;
    private final LendingNotifier notifier;
    private final ReputationAdapter reputation;
    private final Clock clock;

    @Override
    public MoneyTransaction confirmReceipt(UUID transactionId, UUID actorId, ProofUpload proof) {
        if (proof != null) {
            proofService.validate(proof);
        }

        MoneyTransaction transaction = transition(transactionId, t -> {
            t.requireRole(actorId, PartyRole.REQUESTOR);
            requireStatus(t, TransactionStatus.MONEY_SENT, "confirm receipt of");

            t.setStatus(TransactionStatus.MONEY_RECEIVED);
            t.setMoneyReceivedAt(Instant.now(clock));
            if (proof != null) {
                t.setMoneyReceivedProofId(proofService.attach(t.getId(), actorId, ProofType.MONEY_RECEIVED, proof).getId());
            }
            return t;
        });

        log.info("Transaction {}: borrower {} confirmed receipt of {}", transactionId, actorId, transaction.getAmount());

        notifier.notify(NotificationEvent.MONEY_RECEIPT_CONFIRMED, transaction.getLenderId(), actorId,
                transaction.getAmount(), NotificationRef.transaction(transactionId));
        reputation.record(actorId, ScoreChangeType.TRANSACTION_COMPLETED, transaction.getAmount(), transactionId,
                "Confirmed receipt of " + MoneyUtil.display(transaction.getAmount()));

        return transaction;
    }

    @Override
    public MoneyTransaction repay(UUID transactionId, UUID actorId, BigDecimal amount, ProofUpload proof) {
        BigDecimal submitted = MoneyUtil.format(amount);
        if (!MoneyUtil.isPositive(submitted)) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_AMOUNT,
                    "Repayment amount must be greater than zero");
        }
        proofService.validate(proof);

        MoneyTransaction transaction = transition(transactionId, t -> {
            t.requireRole(actorId, PartyRole.REQUESTOR);
            requireStatus(t, TransactionStatus.MONEY_RECEIVED, "repay");

            BigDecimal remaining = t.remainingBalance();
            if (submitted.compareTo(remaining) > 0) {
                throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_AMOUNT,
                        "Repayment of " + submitted + " exceeds the remaining balance of " + remaining);
            }

            // Only reachable from MONEY_RECEIVED, so earlier confirmed partial repayments are kept
            t.setRepaymentAmount(MoneyUtil.format(t.getRepaymentAmount().add(submitted)));
            t.setStatus(TransactionStatus.REPAYMENT_SENT);
            t.setRepaymentSentAt(Instant.now(clock));
            t.setRepaymentSentProofId(proofService.attach(t.getId(), actorId, ProofType.REPAYMENT_SENT, proof).getId());
            return t;
        });

        log.info("Transaction {}: borrower {} sent repayment of {} (total {})",
                transactionId, actorId, submitted, transaction.getRepaymentAmount());

        notifier.notify(NotificationEvent.REPAYMENT_RECEIVED, transaction.getLenderId(), actorId,
                submitted, NotificationRef.transaction(transactionId));
        reputation.record(actorId, ScoreChangeType.REPAYMENT_COMPLETED, submitted, transactionId,
                "Sent repayment of " + MoneyUtil.display(submitted));

        return transaction;
    }

    @Override
    public MoneyTransaction confirmRepayment(UUID transactionId, UUID actorId, ProofUpload proof) {
        if (proof != null) {
            proofService.validate(proof);
        }

        MoneyTransaction transaction = transition(transactionId, t -> {
            t.requireRole(actorId, PartyRole.LENDER);
            requireStatus(t, TransactionStatus.REPAYMENT_SENT, "confirm repayment of");

            t.setRepaymentReceivedAt(Instant.now(clock));
            if (proof != null) {
                t.setRepaymentReceivedProofId(
                        proofService.attach(t.getId(), actorId, ProofType.REPAYMENT_RECEIVED, proof).getId());
            }

            boolean fullyRepaid = t.getRepaymentAmount().compareTo(t.getAmount()) >= 0;
            t.setStatus(fullyRepaid ? TransactionStatus.REPAID : TransactionStatus.MONEY_RECEIVED);
            if (fullyRepaid) {
                cancelOpenTasks(t, "Transaction repaid");
            }
            return t;
        });

        boolean repaid = transaction.getStatus() == TransactionStatus.REPAID;
        boolean early = isEarly(transaction);
        boolean late = isLate(transaction);

        log.info("Transaction {}: lender {} confirmed repayment, total {} of {} ({})", transactionId, actorId,
                transaction.getRepaymentAmount(), transaction.getAmount(), transaction.getStatus());

        String detail = repaid
                ? " Transaction complete!"
                : " Remaining balance: " + MoneyUtil.display(transaction.remainingBalance()) + ".";
        notifier.notify(NotificationEvent.REPAYMENT_CONFIRMED, transaction.getRequestorId(), actorId,
                transaction.getRepaymentAmount(), NotificationRef.transaction(transactionId), detail);

        ScoreChangeType changeType = early ? ScoreChangeType.EARLY_REPAYMENT
                : late ? ScoreChangeType.LATE_REPAYMENT
                : ScoreChangeType.REPAYMENT_COMPLETED;
        reputation.record(transaction.getRequestorId(), changeType, transaction.getRepaymentAmount(), late,
                transactionId,
                (early ? "Early" : late ? "Late" : "Confirmed") + " repayment of "
                        + MoneyUtil.display(transaction.getRepaymentAmount()),
                Map.of("early", early, "late", late));

        return transaction;
    }

    @Override
    public MoneyTransaction rejectRepayment(UUID transactionId, UUID actorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.MISSING_REASON,
                    "A reason is required to reject a repayment");
        }

        MoneyTransaction transaction = transition(transactionId, t -> {
            t.requireRole(actorId, PartyRole.LENDER);
            requireStatus(t, TransactionStatus.REPAYMENT_SENT, "reject repayment of");

            t.setStatus(TransactionStatus.REPAYMENT_REJECTED);
            t.setRepaymentRejectedAt(Instant.now(clock));
            t.setRepaymentRejectionReason(reason.trim());
            cancelOpenTasks(t, "Repayment rejected");
            return t;
        });

        log.warn("Transaction {}: lender {} rejected repayment: {}", transactionId, actorId, reason);

        notifier.notify(NotificationEvent.REPAYMENT_REJECTED, transaction.getRequestorId(), actorId,
                transaction.getRepaymentAmount(), NotificationRef.transaction(transactionId),
                ": " + transaction.getRepaymentRejectionReason());
        reputation.record(transaction.getRequestorId(), ScoreChangeType.FRAUDULENT_PROOF,
                transaction.getRepaymentAmount(), transactionId,
                "Repayment proof rejected: " + transaction.getRepaymentRejectionReason());

        return transaction;
    }

    @Override
    public MoneyTransaction forgive(UUID transactionId, UUID actorId) {
        MoneyTransaction transaction = transition(transactionId, t -> {
            t.requireRole(actorId, PartyRole.LENDER);
            requireStatus(t, TransactionStatus.MONEY_RECEIVED, "forgive");

            BigDecimal remaining = t.remainingBalance();
            if (remaining.signum() <= 0) {
                throw new InvalidStateTransitionException("NOTHING_TO_FORGIVE",
                        "Nothing is left to forgive on " + t.describe());
            }

            t.setForgivenAmount(remaining);
            t.setStatus(TransactionStatus.FORGIVEN);
            t.setForgivenAt(Instant.now(clock));
            cancelOpenTasks(t, "Transaction forgiven");
            return t;
        });

        BigDecimal forgiven = transaction.getForgivenAmount();
        log.info("Transaction {}: lender {} forgave {}", transactionId, actorId, forgiven);

        notifier.notify(NotificationEvent.DEBT_FORGIVEN, transaction.getRequestorId(), actorId,
                forgiven, NotificationRef.transaction(transactionId));
        reputation.record(actorId, ScoreChangeType.FORGIVENESS_GIVEN, forgiven, transactionId,
                "Forgave a debt of " + MoneyUtil.display(forgiven));
        reputation.record(transaction.getRequestorId(), ScoreChangeType.FORGIVENESS_RECEIVED, forgiven, transactionId,
                "Debt of " + MoneyUtil.display(forgiven) + " was forgiven");

        return transaction;
    }

    @Override
    public RepaymentReminder sendReminder(UUID transactionId, UUID actorId, String message) {
        MoneyTransaction transaction = load(transactionId);
        transaction.requireRole(actorId, PartyRole.LENDER);

        if (!REMINDABLE.contains(transaction.getStatus())) {
            throw InvalidStateTransitionException.from(transaction.describe(), transaction.getStatus(), "send a reminder for");
        }
        BigDecimal remaining = transaction.remainingBalance();
        if (remaining.signum() <= 0) {
            throw new InvalidStateTransitionException("NOTHING_OWED",
                    "Nothing is left to repay on " + transaction.describe());
        }

        String text = message == null || message.isBlank() ? DEFAULT_REMINDER_MESSAGE : message.trim();
        RepaymentReminder reminder = reminderRepository.save(RepaymentReminder.builder()
                .transactionId(transactionId)
                .senderId(actorId)
                .recipientId(transaction.getRequestorId())
                .message(text)
                .build());

        log.info("Transaction {}: lender {} sent a repayment reminder", transactionId, actorId);

        notifier.notify(NotificationEvent.REPAYMENT_REMINDER, transaction.getRequestorId(), actorId,
                remaining, NotificationRef.transaction(transactionId), " " + text);

        return reminder;
    }

    @Override
    public MoneyTransaction getTransaction(UUID transactionId, UUID actorId) {
        MoneyTransaction transaction = load(transactionId);
        transaction.requireParty(actorId);
        return transaction;
    }

    @Override
    public List<MoneyTransaction> listTransactions(UUID userId) {
        return transactionRepository.findAllInvolving(userId);
    }

    @Override
    public EmiHistoryResponse emiHistory(UUID transactionId, UUID actorId) {
        MoneyTransaction transaction = getTransaction(transactionId, actorId);
        if (!transaction.isEmi()) {
            throw new NotEmiTransactionException(transactionId);
        }

        BigDecimal totalForgiven = transaction.getEmiForgiveness().stream()
                .map(ForgivenEmi::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal remaining = transaction.remainingBalance();
        BigDecimal installment = transaction.getEmiDetails().getInstallmentAmount();
        int remainingInstallments = remaining.signum() <= 0
                ? 0
                : remaining.divide(installment, 0, RoundingMode.CEILING).intValue();

        return new EmiHistoryResponse(
                transactionId,
                transaction.getEmiDetails(),
                transaction.getAmount(),
                transaction.getRepaymentAmount(),
                MoneyUtil.format(totalForgiven),
                remaining,
                transaction.getTotalForgivenEmis(),
                remainingInstallments,
                List.copyOf(transaction.getEmiForgiveness())
        );
    }

    @Override
    public PaymentDue paymentDue(UUID transactionId, UUID actorId) {
        MoneyTransaction transaction = getTransaction(transactionId, actorId);
        return paymentDueEvaluator.evaluate(transaction, Instant.now(clock));
    }

    // Load, check and mutate one transaction under its lock, in one database transaction
    private MoneyTransaction transition(UUID transactionId, UnaryOperator<MoneyTransaction> change) {
        return lockService.withLock(EntityLockService.transactionKey(transactionId), () -> tx.execute(status -> {
            MoneyTransaction transaction = load(transactionId);
            return transactionRepository.save(change.apply(transaction));
        }));
    }

    // A settled transaction keeps no open tasks
    private void cancelOpenTasks(MoneyTransaction transaction, String reason) {
        List<Task> open = taskRepository.findByReferenceTransactionIdAndStatusIn(transaction.getId(), TaskStatus.OPEN);
        if (open.isEmpty()) return;

        Instant now = Instant.now(clock);
        for (Task task : open) {
            task.setStatus(TaskStatus.CANCELLED);
            task.setCancelledAt(now);
            task.setCancellationReason(reason);
        }
        taskRepository.saveAll(open);
        log.info("Transaction {}: cancelled {} open task(s): {}", transaction.getId(), open.size(), reason);
    }

    private MoneyTransaction load(UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    private static void requireStatus(MoneyTransaction transaction, TransactionStatus expected, String operation) {
        if (transaction.getStatus() != expected) {
            throw InvalidStateTransitionException.from(transaction.describe(), transaction.getStatus(), operation);
        }
    }

    private static boolean isEarly(MoneyTransaction t) {
        return t.getMoneyReceivedAt() != null && t.getRepaymentReceivedAt() != null
                && Duration.between(t.getMoneyReceivedAt(), t.getRepaymentReceivedAt()).compareTo(EARLY_REPAYMENT_WINDOW) < 0;
    }

    private static boolean isLate(MoneyTransaction t) {
        return t.getMoneyReceivedAt() != null && t.getRepaymentReceivedAt() != null
                && Duration.between(t.getMoneyReceivedAt(), t.getRepaymentReceivedAt()).compareTo(LATE_REPAYMENT_THRESHOLD) > 0;
    }
}
