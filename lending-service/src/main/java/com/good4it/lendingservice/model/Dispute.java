package com.good4it.lendingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "disputes", indexes = {
        @Index(name = "idx_dispute_transaction", columnList = "transaction_id"),
        @Index(name = "idx_dispute_disputer", columnList = "disputer_id"),
        @Index(name = "idx_dispute_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dispute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false)
    private UUID disputerId;

    // The other party of the transaction at the time of the dispute
    @Column(nullable = false, updatable = false)
    private UUID respondentId;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private DisputeType disputeType;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private DisputeStatus status;

    @Column(nullable = false, length = 1000)
    private String description;

    @Embedded
    private DisputeResolution resolution;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @Version
    private Long version;
}
