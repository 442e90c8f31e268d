package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.Dispute;
import com.good4it.lendingservice.model.DisputeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, UUID> {

    boolean existsByTransactionIdAndDisputerIdAndStatus(UUID transactionId, UUID disputerId, DisputeStatus status);

    List<Dispute> findByDisputerIdOrderByCreatedAtDesc(UUID disputerId);

    List<Dispute> findByDisputerIdAndStatusOrderByCreatedAtDesc(UUID disputerId, DisputeStatus status);
}
