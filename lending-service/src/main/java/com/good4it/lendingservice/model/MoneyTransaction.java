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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "money_transactions", indexes = {
        @Index(name = "idx_transaction_request", columnList = "request_id", unique = true),
        @Index(name = "idx_transaction_requestor", columnList = "requestor_id"),
        @Index(name = "idx_transaction_lender", columnList = "lender_id"),
        @Index(name = "idx_transaction_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoneyTransaction implements PartyAware {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    //One transaction per approved request
    @Column(nullable = false, unique = true, updatable = false)
    private UUID requestId;

    @Column(nullable = false, updatable = false)
    private UUID requestorId;

    @Column(nullable = false, updatable = false)
    private UUID lenderId;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(length = 500)
    private String description;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private TransactionStatus status;

    @Column(nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal repaymentAmount = BigDecimal.ZERO;

    // Snapshot of the request's repayment plan
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PaymentType paymentType = PaymentType.FULL_PAYMENT;

    @Embedded
    private EmiDetails emiDetails;

    private Instant moneySentAt;
    private Instant moneyReceivedAt;
    private Instant repaymentSentAt;
    private Instant repaymentReceivedAt;
    private Instant repaymentRejectedAt;
    private Instant forgivenAt;

    @Column(length = 500)
    private String repaymentRejectionReason;

    @Column(precision = 19, scale = 4)
    private BigDecimal forgivenAmount;

    private UUID moneySentProofId;
    private UUID moneyReceivedProofId;
    private UUID repaymentSentProofId;
    private UUID repaymentReceivedProofId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "transaction_emi_forgiveness", joinColumns = @JoinColumn(name = "transaction_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ForgivenEmi> emiForgiveness = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private int totalForgivenEmis = 0;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @Version
    private Long version;

    public BigDecimal remainingBalance() {
        if (status != null && status.isSettled()) {
            return BigDecimal.ZERO;
        }
        return amount.subtract(repaymentAmount).max(BigDecimal.ZERO);
    }

    public boolean isEmi() {
        return paymentType == PaymentType.EMI && emiDetails != null;
    }

    public UUID counterpartyOf(UUID userId) {
        return lenderId.equals(userId) ? requestorId : lenderId;
    }

    @Override
    public Optional<PartyRole> roleOf(UUID userId) {
        if (lenderId.equals(userId)) return Optional.of(PartyRole.LENDER);
        if (requestorId.equals(userId)) return Optional.of(PartyRole.REQUESTOR);
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "money transaction " + id;
    }
}
