package com.good4it.lendingservice.service;

import com.good4it.lendingservice.dto.EmiHistoryResponse;
import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.RepaymentReminder;
import com.good4it.lendingservice.service.emi.PaymentDue;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public interface MoneyTransactionService {

    MoneyTransaction confirmReceipt(UUID transactionId, UUID actorId, ProofUpload proof);

    MoneyTransaction repay(UUID transactionId, UUID actorId, BigDecimal amount, ProofUpload proof);

    MoneyTransaction confirmRepayment(UUID transactionId, UUID actorId, ProofUpload proof);

    MoneyTransaction rejectRepayment(UUID transactionId, UUID actorId, String reason);

    MoneyTransaction forgive(UUID transactionId, UUID actorId);

    RepaymentReminder sendReminder(UUID transactionId, UUID actorId, String message);

    MoneyTransaction getTransaction(UUID transactionId, UUID actorId);

    List<MoneyTransaction> listTransactions(UUID userId);

    EmiHistoryResponse emiHistory(UUID transactionId, UUID actorId);

    PaymentDue paymentDue(UUID transactionId, UUID actorId);
}
