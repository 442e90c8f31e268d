package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.ProofType;
import com.good4it.lendingservice.model.TransactionProof;

import java.time.Instant;
import java.util.UUID;

public record ProofResponse(
        UUID id,
        UUID transactionId,
        UUID uploadedBy,
        ProofType proofType,
        String storageId,
        String fileName,
        long sizeBytes,
        String mimeType,
        Instant uploadedAt
) {
    public static ProofResponse from(TransactionProof proof) {
        return new ProofResponse(proof.getId(), proof.getTransactionId(), proof.getUploadedBy(), proof.getProofType(),
                proof.getStorageId(), proof.getFileName(), proof.getSizeBytes(), proof.getMimeType(), proof.getUploadedAt());
    }
}
