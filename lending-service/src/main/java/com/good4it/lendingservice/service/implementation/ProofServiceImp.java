package com.good4it.lendingservice.service.implementation;

import com.good4it.lendingservice.client.ProofStorageGateway;
import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;
import com.good4it.lendingservice.core.exception.TransactionNotFoundException;
import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.dto.client.ProofReference;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.ProofType;
import com.good4it.lendingservice.model.TransactionProof;
import com.good4it.lendingservice.repository.MoneyTransactionRepository;
import com.good4it.lendingservice.repository.TransactionProofRepository;
import com.good4it.lendingservice.service.ProofService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class ProofServiceImp implements ProofService {

    public static final long MAX_PROOF_BYTES = 10L * 1024 * 1024;
    public static final Set<String> ALLOWED_MIME_TYPES = Set.of("image/jpeg", "image/jpg", "image/png", "image/heic");

    private final ProofStorageGateway proofStorage;
    private final TransactionProofRepository proofRepository;
    private final MoneyTransactionRepository transactionRepository;

    @Override
    public void validate(ProofUpload proof) {
        if (proof == null || proof.size() == 0) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.PROOF_REQUIRED,
                    "A payment proof image is required");
        }

        String mimeType = proof.contentType() == null ? "" : proof.contentType().toLowerCase(Locale.ROOT);
        if (!ALLOWED_MIME_TYPES.contains(mimeType)) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_PROOF,
                    "Only JPEG, PNG and HEIC images are accepted as proof, got " + proof.contentType());
        }

        if (proof.size() > MAX_PROOF_BYTES) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_PROOF,
                    "Proof images are limited to 10MB");
        }
    }

    @Override
    public TransactionProof attach(UUID transactionId, UUID uploaderId, ProofType proofType, ProofUpload proof) {
        ProofReference reference = proofStorage.storeProof(transactionId, uploaderId, proofType, proof);

        TransactionProof saved = proofRepository.save(TransactionProof.builder()
                .transactionId(transactionId)
                .uploadedBy(uploaderId)
                .proofType(proofType)
                .storageId(reference.id())
                .fileName(proof.fileName())
                .sizeBytes(reference.sizeBytes())
                .mimeType(reference.mimeType())
                .build());

        log.info("Stored {} proof {} for transaction {}", proofType, saved.getId(), transactionId);
        return saved;
    }

    @Override
    public List<TransactionProof> listProofs(UUID transactionId, UUID actorId) {
        MoneyTransaction transaction = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        transaction.requireParty(actorId);

        return proofRepository.findByTransactionIdOrderByUploadedAtAsc(transactionId);
    }
}
