package com.good4it.scoreservice.model;

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
@Table(name = "user_scores")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserScore {

    // One row per user, keyed by the user id itself
    @Id
    private UUID userId;

    @Column(nullable = false)
    private int score;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
