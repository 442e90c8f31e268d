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
@Table(name = "tasks", indexes = {
        @Index(name = "idx_task_assigned_to", columnList = "assigned_to"),
        @Index(name = "idx_task_assigned_by", columnList = "assigned_by"),
        @Index(name = "idx_task_transaction", columnList = "reference_transaction_id"),
        @Index(name = "idx_task_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task implements PartyAware {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String title;

    @Column(length = 500)
    private String description;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TaskCategory category = TaskCategory.OTHER;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Column(length = 200)
    private String location;

    @Column(nullable = false)
    private Instant dueDate;

    //Lender of the referenced transaction
    @Column(nullable = false)
    private UUID assignedBy;

    //Borrower of the referenced transaction
    @Column(nullable = false)
    private UUID assignedTo;

    @Column(nullable = false)
    private UUID referenceTransactionId;

    @Column(nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal monetaryValue = BigDecimal.ZERO;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private TaskStatus status;

    @Column(nullable = false)
    private boolean emiTask;

    @Embedded
    private EmiForgivenessWindow emiForgiveness;

    private Instant acceptedAt;
    private Instant startedAt;
    private Instant completedAt;

    @Column(length = 500)
    private String completionNotes;

    private Instant confirmedAt;

    @Column(length = 500)
    private String confirmationNotes;

    @Column(precision = 19, scale = 4)
    private BigDecimal amountRepaid;

    private Instant declinedAt;

    @Column(length = 500)
    private String declineReason;

    private Instant cancelledAt;

    @Column(length = 500)
    private String cancellationReason;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @Version
    private Long version;

    @Override
    public Optional<PartyRole> roleOf(UUID userId) {
        if (assignedBy.equals(userId)) return Optional.of(PartyRole.ASSIGNED_BY);
        if (assignedTo.equals(userId)) return Optional.of(PartyRole.ASSIGNED_TO);
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "task " + id;
    }
}
