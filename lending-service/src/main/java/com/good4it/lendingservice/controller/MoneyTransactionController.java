package com.good4it.lendingservice.controller;

import com.good4it.lendingservice.dto.*;
import com.good4it.lendingservice.service.MoneyTransactionService;
import com.good4it.lendingservice.service.ProofService;
import com.good4it.lendingservice.service.emi.PaymentDue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/transactions")
@RequiredArgsConstructor
public class MoneyTransactionController {

    private final MoneyTransactionService transactionService;
    private final ProofService proofService;

    @GetMapping
    public ResponseEntity<List<TransactionResponse>> listTransactions(@RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(transactionService.listTransactions(userId).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> getTransaction(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId
    ) {
        return ResponseEntity.ok(TransactionResponse.from(transactionService.getTransaction(transactionId, userId)));
    }

    @PostMapping(value = "/{transactionId}/confirm-receipt", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TransactionResponse> confirmReceipt(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId,
            @RequestPart(value = "proof", required = false) MultipartFile proof
    ) {
        return ResponseEntity.ok(TransactionResponse.from(
                transactionService.confirmReceipt(transactionId, userId, ProofUpload.from(proof))));
    }

    @PostMapping(value = "/{transactionId}/repayments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TransactionResponse> repay(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId,
            @RequestParam("amount") BigDecimal amount,
            @RequestPart(value = "proof", required = false) MultipartFile proof
    ) {
        return ResponseEntity.ok(TransactionResponse.from(
                transactionService.repay(transactionId, userId, amount, ProofUpload.from(proof))));
    }

    @PostMapping(value = "/{transactionId}/repayments/confirm", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TransactionResponse> confirmRepayment(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId,
            @RequestPart(value = "proof", required = false) MultipartFile proof
    ) {
        return ResponseEntity.ok(TransactionResponse.from(
                transactionService.confirmRepayment(transactionId, userId, ProofUpload.from(proof))));
    }

    @PostMapping("/{transactionId}/repayments/reject")
    public ResponseEntity<TransactionResponse> rejectRepayment(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId,
            @RequestBody @Valid ReasonRequest request
    ) {
        return ResponseEntity.ok(TransactionResponse.from(
                transactionService.rejectRepayment(transactionId, userId, request.reason())));
    }

    @PostMapping("/{transactionId}/forgive")
    public ResponseEntity<TransactionResponse> forgive(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId
    ) {
        return ResponseEntity.ok(TransactionResponse.from(transactionService.forgive(transactionId, userId)));
    }

    @PostMapping("/{transactionId}/reminders")
    public ResponseEntity<ReminderResponse> sendReminder(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId,
            @RequestBody(required = false) @Valid NotesRequest request
    ) {
        String message = request == null ? null : request.notes();
        return new ResponseEntity<>(
                ReminderResponse.from(transactionService.sendReminder(transactionId, userId, message)),
                HttpStatus.CREATED);
    }

    @GetMapping("/{transactionId}/proofs")
    public ResponseEntity<List<ProofResponse>> listProofs(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId
    ) {
        return ResponseEntity.ok(proofService.listProofs(transactionId, userId).stream()
                .map(ProofResponse::from)
                .toList());
    }

    @GetMapping("/{transactionId}/emi-history")
    public ResponseEntity<EmiHistoryResponse> emiHistory(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId
    ) {
        return ResponseEntity.ok(transactionService.emiHistory(transactionId, userId));
    }

    @GetMapping("/{transactionId}/payment-due")
    public ResponseEntity<PaymentDue> paymentDue(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId
    ) {
        return ResponseEntity.ok(transactionService.paymentDue(transactionId, userId));
    }
}
