package com.good4it.lendingservice.model;

import com.good4it.lendingservice.core.auth.PartyAware;
import com.good4it.lendingservice.core.auth.PartyRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "money_requests", indexes = {
        @Index(name = "idx_request_requestor", columnList = "requestor_id"),
        @Index(name = "idx_request_lender", columnList = "lender_id"),
        @Index(name = "idx_request_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoneyRequest implements PartyAware {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private UUID requestorId;

    @Column(nullable = false)
    private UUID lenderId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(length = 500)
    private String description;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PaymentType paymentType = PaymentType.FULL_PAYMENT;

    //Only present for EMI requests
    @Embedded
    private EmiDetails emiDetails;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private RequestStatus status;

    @Column(length = 500)
    private String rejectionReason;

    private Instant rejectedAt;

    private Instant decidedAt;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isEmi() {
        return paymentType == PaymentType.EMI && emiDetails != null;
    }

    @Override
    public Optional<PartyRole> roleOf(UUID userId) {
        if (lenderId.equals(userId)) return Optional.of(PartyRole.LENDER);
        if (requestorId.equals(userId)) return Optional.of(PartyRole.REQUESTOR);
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "money request " + id;
    }
}
