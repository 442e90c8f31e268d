package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {

    @Query(value = """
                    select * from outbox_events
                    where status = 'PENDING'
                    order by created_at
                    limit :batchSize
                    for update skip locked
            """, nativeQuery = true)
    List<OutboxEvent> findTopForProcessing(@Param("batchSize") int batchSize);
}
