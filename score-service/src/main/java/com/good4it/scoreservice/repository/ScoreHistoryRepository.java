package com.good4it.scoreservice.repository;

import com.good4it.scoreservice.model.ScoreChangeType;
import com.good4it.scoreservice.model.ScoreHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScoreHistoryRepository extends JpaRepository<ScoreHistory, UUID> {

    List<ScoreHistory> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    List<ScoreHistory> findByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(UUID userId, Instant since,
                                                                                    Pageable pageable);

    long countByUserId(UUID userId);

    @Query("""
            select h.changeType as changeType, count(h) as occurrences, sum(h.scoreChange) as totalChange
            from ScoreHistory h
            where h.userId = :userId
            group by h.changeType
            """)
    List<ChangeTypeTotal> totalsByChangeType(@Param("userId") UUID userId);

    interface ChangeTypeTotal {
        ScoreChangeType getChangeType();

        long getOccurrences();

        long getTotalChange();
    }
}
