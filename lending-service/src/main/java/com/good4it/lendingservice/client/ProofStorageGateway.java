package com.good4it.lendingservice.client;

import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.dto.client.ProofReference;
import com.good4it.lendingservice.model.ProofType;

import java.util.UUID;

public interface ProofStorageGateway {

    ProofReference storeProof(UUID transactionId, UUID uploaderId, ProofType proofType, ProofUpload file);
}
