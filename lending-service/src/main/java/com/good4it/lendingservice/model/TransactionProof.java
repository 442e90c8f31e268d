package com.good4it.lendingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transaction_proofs", indexes = {
        @Index(name = "idx_proof_transaction", columnList = "transaction_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionProof {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false)
    private UUID uploadedBy;

    @Column(nullable = false, length = 30, updatable = false)
    @Enumerated(EnumType.STRING)
    private ProofType proofType;

    //Identifier handed back by the media service
    @Column(nullable = false, updatable = false)
    private String storageId;

    private String fileName;

    private long sizeBytes;

    @Column(length = 50)
    private String mimeType;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant uploadedAt;
}
