package com.good4it.lendingservice.service;

import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.model.ProofType;
import com.good4it.lendingservice.model.TransactionProof;

import java.util.List;
import java.util.UUID;

public interface ProofService {

    void validate(ProofUpload proof);

    TransactionProof attach(UUID transactionId, UUID uploaderId, ProofType proofType, ProofUpload proof);

    List<TransactionProof> listProofs(UUID transactionId, UUID actorId);
}
