package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.client.SocialGraphGateway;
import com.good4it.lendingservice.core.auth.PartyRole;
import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;
import com.good4it.lendingservice.core.exception.InvalidStateTransitionException;
import com.good4it.lendingservice.core.exception.MoneyRequestNotFoundException;
import com.good4it.lendingservice.core.exception.NotFriendsException;
import com.good4it.lendingservice.core.util.MoneyUtil;
import com.good4it.lendingservice.dto.CreateMoneyRequest;
import com.good4it.lendingservice.dto.Decision;
import com.good4it.lendingservice.dto.EmiDetailsRequest;
import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.dto.RequestFilter;
import com.good4it.lendingservice.model.*;
import com.good4it.lendingservice.repository.MoneyRequestRepository;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.service.EntityLockService;
import com.good4it.lendingservice.service.MoneyRequestService;
import com.good4it.lendingservice.service.ProofService;
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
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class MoneyRequestServiceImp implements MoneyRequestService {

    private final MoneyRequestRepository requestRepository;
    private final MoneyTransactionRepository transactionRepository;
    private final SocialGraphGateway socialGraph;
    private final ProofService proofService;
    private final EntityLockService lockService;
    private final TransactionTemplate tx;
    private final LendingNotifier notifier;
    private final ReputationAdapter reputation;
    private final Clock clock;

    @Override
    public MoneyRequest createRequest(UUID requestorId, CreateMoneyRequest request) {
        validateNewRequest(requestorId, request);

        if (!socialGraph.areFriends(requestorId, request.lenderId())) {
            log.warn("Blocked money request from {} to non-friend {}", requestorId, request.lenderId());
            throw new NotFriendsException(requestorId, request.lenderId());
        }

        PaymentType paymentType = request.paymentTypeOrDefault();

        MoneyRequest saved = requestRepository.save(MoneyRequest.builder()
                .requestorId(requestorId)
                .lenderId(request.lenderId())
                .amount(MoneyUtil.format(request.amount()))
                .description(request.description())
                .paymentType(paymentType)
                .emiDetails(paymentType == PaymentType.EMI ? request.emiDetails().toEmbeddable() : null)
                .status(RequestStatus.PENDING)
                .build());

        log.info("Money request {} created: {} asks {} for {}", saved.getId(), requestorId, request.lenderId(), saved.getAmount());

        notifier.notify(NotificationEvent.MONEY_REQUEST, saved.getLenderId(), requestorId, saved.getAmount(),
                NotificationRef.request(saved.getId()));

        return saved;
    }

    @Override
    public MoneyRequest decide(UUID requestId, UUID actorId, Decision decision, String rejectionReason) {
        if (decision == Decision.REJECT && (rejectionReason == null || rejectionReason.isBlank())) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.MISSING_REASON,
                    "A reason is required to reject a money request");
        }

        MoneyRequest decided = lockService.withLock(EntityLockService.requestKey(requestId), () -> tx.execute(status -> {
            MoneyRequest request = load(requestId);
            request.requireRole(actorId, PartyRole.LENDER);
            requirePending(request, decision == Decision.APPROVE ? "approve" : "reject");

            Instant now = Instant.now(clock);
            request.setDecidedAt(now);
            if (decision == Decision.APPROVE) {
                request.setStatus(RequestStatus.APPROVED);
            } else {
                request.setStatus(RequestStatus.REJECTED);
                request.setRejectionReason(rejectionReason.trim());
                request.setRejectedAt(now);
            }
            return requestRepository.save(request);
        }));

        log.info("Money request {} {} by lender {}", requestId, decided.getStatus(), actorId);

        if (decided.getStatus() == RequestStatus.REJECTED) {
            notifier.notify(NotificationEvent.MONEY_REQUEST_REJECTED, decided.getRequestorId(), actorId,
                    decided.getAmount(), NotificationRef.request(requestId));
            reputation.record(actorId, ScoreChangeType.REQUEST_DECLINED, decided.getAmount(), null,
                    "Declined a money request of " + MoneyUtil.display(decided.getAmount()));
        }

        return decided;
    }

    @Override
    public MoneyTransaction approveAndPay(UUID requestId, UUID actorId, ProofUpload proof) {
        proofService.validate(proof);

        MoneyTransaction transaction = lockService.withLock(EntityLockService.requestKey(requestId), () -> tx.execute(status -> {
            MoneyRequest request = load(requestId);
            request.requireRole(actorId, PartyRole.LENDER);
            requirePending(request, "approve");

            Instant now = Instant.now(clock);
            request.setStatus(RequestStatus.APPROVED);
            request.setDecidedAt(now);
            requestRepository.save(request);

            return openTransaction(request, actorId, proof, now);
        }));

        afterMoneySent(transaction);
        return transaction;
    }

    @Override
    @Deprecated
    public MoneyTransaction sendMoney(UUID requestId, UUID actorId, ProofUpload proof) {
        if (proof != null) {
            proofService.validate(proof);
        }

        MoneyTransaction transaction = lockService.withLock(EntityLockService.requestKey(requestId), () -> tx.execute(status -> {
            MoneyRequest request = load(requestId);
            request.requireRole(actorId, PartyRole.LENDER);
            if (request.getStatus() != RequestStatus.APPROVED) {
                throw InvalidStateTransitionException.from(request.describe(), request.getStatus(), "send money for");
            }
            return openTransaction(request, actorId, proof, Instant.now(clock));
        }));

        afterMoneySent(transaction);
        return transaction;
    }

    @Override
    public MoneyRequest getRequest(UUID requestId, UUID actorId) {
        MoneyRequest request = load(requestId);
        request.requireParty(actorId);
        return request;
    }

    @Override
    public List<MoneyRequest> listRequests(UUID userId, RequestFilter filter) {
        return switch (filter == null ? RequestFilter.ALL : filter) {
            case SENT -> requestRepository.findByRequestorIdOrderByCreatedAtDesc(userId);
            case RECEIVED -> requestRepository.findByLenderIdOrderByCreatedAtDesc(userId);
            case REJECTED -> requestRepository.findAllInvolvingWithStatus(userId, RequestStatus.REJECTED);
            case ALL -> requestRepository.findAllInvolving(userId);
        };
    }

    private MoneyTransaction openTransaction(MoneyRequest request, UUID lenderId, ProofUpload proof, Instant now) {
        if (transactionRepository.existsByRequestId(request.getId())) {
            throw new InvalidStateTransitionException("ALREADY_FUNDED",
                    "Money was already sent for " + request.describe());
        }

        MoneyTransaction transaction = transactionRepository.save(MoneyTransaction.builder()
                .requestId(request.getId())
                .requestorId(request.getRequestorId())
                .lenderId(request.getLenderId())
                .amount(request.getAmount())
                .description(request.getDescription())
                .status(TransactionStatus.MONEY_SENT)
                .repaymentAmount(MoneyUtil.format(BigDecimal.ZERO))
                .paymentType(request.getPaymentType())
                .emiDetails(copyOf(request.getEmiDetails()))
                .moneySentAt(now)
                .build());

        if (proof != null) {
            TransactionProof stored = proofService.attach(transaction.getId(), lenderId, ProofType.MONEY_SENT, proof);
            transaction.setMoneySentProofId(stored.getId());
        }

        return transaction;
    }

    private void afterMoneySent(MoneyTransaction transaction) {
        log.info("Transaction {} opened for request {}: {} sent to {}",
                transaction.getId(), transaction.getRequestId(), transaction.getAmount(), transaction.getRequestorId());

        notifier.notify(NotificationEvent.MONEY_SENT, transaction.getRequestorId(), transaction.getLenderId(),
                transaction.getAmount(), NotificationRef.transaction(transaction.getId()));
        reputation.record(transaction.getLenderId(), ScoreChangeType.TRANSACTION_COMPLETED, transaction.getAmount(),
                transaction.getId(), "Sent " + MoneyUtil.display(transaction.getAmount()) + " to a friend");
    }

    private void validateNewRequest(UUID requestorId, CreateMoneyRequest request) {
        if (requestorId.equals(request.lenderId())) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.SELF_REQUEST,
                    "You cannot request money from yourself");
        }

        BigDecimal amount = request.amount();
        if (amount == null
                || amount.compareTo(MoneyUtil.MIN_REQUEST_AMOUNT) < 0
                || amount.compareTo(MoneyUtil.MAX_REQUEST_AMOUNT) > 0) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_AMOUNT,
                    "Amount must be between 1 and 1,000,000");
        }

        boolean emi = request.paymentTypeOrDefault() == PaymentType.EMI;
        EmiDetailsRequest emiDetails = request.emiDetails();
        if (emi && !isCompleteEmiPlan(emiDetails)) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_EMI_DETAILS,
                    "EMI requests need 1 to 24 installments, a positive installment amount and a frequency");
        }
        if (!emi && emiDetails != null) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_EMI_DETAILS,
                    "EMI details are only allowed for EMI requests");
        }
    }

    private static boolean isCompleteEmiPlan(EmiDetailsRequest emi) {
        return emi != null
                && emi.numberOfInstallments() != null
                && emi.numberOfInstallments() >= 1
                && emi.numberOfInstallments() <= 24
                && MoneyUtil.isPositive(emi.installmentAmount())
                && emi.frequency() != null;
    }

    private static EmiDetails copyOf(EmiDetails source) {
        if (source == null) return null;
        return EmiDetails.builder()
                .numberOfInstallments(source.getNumberOfInstallments())
                .installmentAmount(source.getInstallmentAmount())
                .frequency(source.getFrequency())
                .build();
    }

    private MoneyRequest load(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new MoneyRequestNotFoundException(requestId));
    }

    private static void requirePending(MoneyRequest request, String operation) {
        if (request.getStatus() != RequestStatus.PENDING) {
            throw new InvalidStateTransitionException("ALREADY_DECIDED",
                    "Cannot " + operation + " " + request.describe() + ": it is already " + request.getStatus());
        }
    }
}
