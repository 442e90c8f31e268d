package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.Dispute;
import com.good4it.lendingservice.model.DisputeResolution;
import com.good4it.lendingservice.model.DisputeStatus;
import com.good4it.lendingservice.model.DisputeType;

import java.time.Instant;
import java.util.UUID;

public record DisputeResponse(
        UUID id,
        UUID transactionId,
        UUID disputerId,
        UUID respondentId,
        DisputeType disputeType,
        DisputeStatus status,
        String description,
        DisputeResolution resolution,
        Instant createdAt
) {
    public static DisputeResponse from(Dispute dispute) {
        return new DisputeResponse(
                dispute.getId(),
                dispute.getTransactionId(),
                dispute.getDisputerId(),
                dispute.getRespondentId(),
                dispute.getDisputeType(),
                dispute.getStatus(),
                dispute.getDescription(),
                dispute.getResolution(),
                dispute.getCreatedAt()
        );
    }
}
