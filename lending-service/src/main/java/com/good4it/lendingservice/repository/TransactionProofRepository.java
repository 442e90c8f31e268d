package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.TransactionProof;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TransactionProofRepository extends JpaRepository<TransactionProof, UUID> {

    List<TransactionProof> findByTransactionIdOrderByUploadedAtAsc(UUID transactionId);
}
