package com.good4it.lendingservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeResolution {

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "outcome", length = 30)
    @Enumerated(EnumType.STRING)
    private DisputeOutcome outcome;

    @Column(name = "resolution_notes", length = 1000)
    private String notes;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
