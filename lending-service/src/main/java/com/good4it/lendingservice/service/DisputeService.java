package com.good4it.lendingservice.service;

import com.good4it.lendingservice.model.Dispute;
import com.good4it.lendingservice.model.DisputeOutcome;
import com.good4it.lendingservice.model.DisputeStatus;
import com.good4it.lendingservice.model.DisputeType;

import java.util.List;
import java.util.UUID;

public interface DisputeService {

    Dispute raiseDispute(UUID transactionId, UUID actorId, DisputeType type, String description);

    Dispute flagPaymentNotReceived(UUID transactionId, UUID actorId);

    Dispute resolveDispute(UUID disputeId, UUID resolverId, DisputeOutcome outcome, String notes);

    List<Dispute> listDisputes(UUID userId, DisputeStatus status);
}
