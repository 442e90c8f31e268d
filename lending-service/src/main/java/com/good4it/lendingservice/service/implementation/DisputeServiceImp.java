package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.core.auth.PartyRole;
import com.good4it.lendingservice.core.exception.*;
import com.good4it.lendingservice.model.*;
import com.good4it.lendingservice.repository.DisputeRepository;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.service.DisputeService;
import com.good4it.lendingservice.service.EntityLockService;
import com.good4it.lendingservice.service.notification.LendingNotifier;
import com.good4it.lendingservice.service.notification.NotificationEvent;
import com.good4it.lendingservice.service.notification.NotificationRef;
import com.good4it.lendingservice.service.reputation.ReputationAdapter;
import com.good4it.lendingservice.service.reputation.ScoreChangeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class DisputeServiceImp implements DisputeService {

    static final String PAYMENT_NOT_RECEIVED_DESCRIPTION = "Borrower reported that the money was not received.";

    private final DisputeRepository disputeRepository;
    private final MoneyTransactionRepository transactionRepository;
    private final EntityLockService lockService;
    private final TransactionTemplate tx;
    private final LendingNotifier notifier;
    private final ReputationAdapter reputation;
    private final Clock clock;

    // Only these users may resolve disputes until a moderation role exists
    @Value("${app.disputes.resolver-ids:}")
    private Set<UUID> resolverIds;

    @Override
    public Dispute raiseDispute(UUID transactionId, UUID actorId, DisputeType type, String description) {
        if (type == null || description == null || description.isBlank() || description.length() > 1000) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_DISPUTE,
                    "Dispute type and a description of at most 1000 characters are required");
        }

        MoneyTransaction transaction = load(transactionId);
        transaction.requireParty(actorId);

        Dispute dispute = open(transaction, actorId, type, description.trim());
        notifier.notify(NotificationEvent.DISPUTE_RAISED, dispute.getRespondentId(), actorId,
                transaction.getAmount(), NotificationRef.transaction(transactionId), ": " + type.name());
        return dispute;
    }

    @Override
    public Dispute flagPaymentNotReceived(UUID transactionId, UUID actorId) {
        MoneyTransaction transaction = load(transactionId);
        transaction.requireRole(actorId, PartyRole.REQUESTOR);
        if (transaction.getStatus() != TransactionStatus.MONEY_SENT) {
            throw InvalidStateTransitionException.from(transaction.describe(), transaction.getStatus(),
                    "flag as not received");
        }

        Dispute dispute = open(transaction, actorId, DisputeType.PAYMENT_NOT_RECEIVED, PAYMENT_NOT_RECEIVED_DESCRIPTION);

        notifier.notify(NotificationEvent.PAYMENT_NOT_RECEIVED, transaction.getLenderId(), actorId,
                transaction.getAmount(), NotificationRef.transaction(transactionId));
        reputation.record(transaction.getLenderId(), ScoreChangeType.PAYMENT_NOT_RECEIVED, transaction.getAmount(),
                transactionId, "Borrower reported the payment was not received");
        return dispute;
    }

    @Override
    public Dispute resolveDispute(UUID disputeId, UUID resolverId, DisputeOutcome outcome, String notes) {
        if (outcome == null) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_DISPUTE, "A dispute outcome is required");
        }

        Dispute resolved = tx.execute(status -> {
            Dispute dispute = disputeRepository.findById(disputeId)
                    .orElseThrow(() -> new DisputeNotFoundException(disputeId));

            if (resolverIds == null || !resolverIds.contains(resolverId)) {
                throw new NotAuthorizedPartyException("User " + resolverId + " cannot resolve disputes");
            }
            if (dispute.getStatus() != DisputeStatus.PENDING) {
                throw InvalidStateTransitionException.from("dispute " + disputeId, dispute.getStatus(), "resolve");
            }

            dispute.setStatus(DisputeStatus.RESOLVED);
            dispute.setResolution(DisputeResolution.builder()
                    .resolvedBy(resolverId)
                    .outcome(outcome)
                    .notes(notes)
                    .resolvedAt(Instant.now(clock))
                    .build());
            return disputeRepository.save(dispute);
        });

        log.info("Dispute {} resolved by {}: {}", disputeId, resolverId, outcome);

        notifier.notify(NotificationEvent.DISPUTE_RESOLVED, resolved.getDisputerId(), resolverId, null,
                NotificationRef.transaction(resolved.getTransactionId()), ": " + outcome.name());
        notifier.notify(NotificationEvent.DISPUTE_RESOLVED, resolved.getRespondentId(), resolverId, null,
                NotificationRef.transaction(resolved.getTransactionId()), ": " + outcome.name());

        switch (outcome) {
            case IN_FAVOR_OF_DISPUTER -> award(resolved, resolved.getDisputerId(), resolved.getRespondentId());
            case IN_FAVOR_OF_OTHER_PARTY -> award(resolved, resolved.getRespondentId(), resolved.getDisputerId());
            case NO_FAULT -> log.debug("Dispute {} closed without fault", disputeId);
        }

        return resolved;
    }

    @Override
    public List<Dispute> listDisputes(UUID userId, DisputeStatus status) {
        if (status == null) {
            return disputeRepository.findByDisputerIdOrderByCreatedAtDesc(userId);
        }
        return disputeRepository.findByDisputerIdAndStatusOrderByCreatedAtDesc(userId, status);
    }

    private Dispute open(MoneyTransaction transaction, UUID disputerId, DisputeType type, String description) {
        return lockService.withLock(EntityLockService.transactionKey(transaction.getId()), () -> tx.execute(status -> {
            if (disputeRepository.existsByTransactionIdAndDisputerIdAndStatus(
                    transaction.getId(), disputerId, DisputeStatus.PENDING)) {
                throw new InvalidLendingRequestException(InvalidLendingRequestException.DUPLICATE_DISPUTE,
                        "A pending dispute already exists for " + transaction.describe());
            }

            Dispute saved = disputeRepository.save(Dispute.builder()
                    .transactionId(transaction.getId())
                    .disputerId(disputerId)
                    .respondentId(transaction.counterpartyOf(disputerId))
                    .disputeType(type)
                    .status(DisputeStatus.PENDING)
                    .description(description)
                    .build());

            log.info("Dispute {} ({}) raised by {} on transaction {}",
                    saved.getId(), type, disputerId, transaction.getId());
            return saved;
        }));
    }

    private void award(Dispute dispute, UUID winner, UUID loser) {
        reputation.record(winner, ScoreChangeType.DISPUTE_RESOLVED, null, dispute.getTransactionId(),
                "Dispute resolved in your favour");
        reputation.record(loser, ScoreChangeType.FALSE_DISPUTE, null, dispute.getTransactionId(),
                "Dispute resolved against you");
    }

    private MoneyTransaction load(UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }
}
