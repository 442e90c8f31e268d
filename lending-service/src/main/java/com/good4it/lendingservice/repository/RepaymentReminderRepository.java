package com.good4it.lendingservice.repository;

import com.good4it.lendingservice.model.RepaymentReminder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RepaymentReminderRepository extends JpaRepository<RepaymentReminder, UUID> {

    List<RepaymentReminder> findByTransactionIdOrderBySentAtDesc(UUID transactionId);
}
