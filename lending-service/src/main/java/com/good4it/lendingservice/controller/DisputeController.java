package com.good4it.lendingservice.controller;

import com.good4it.lendingservice.dto.DisputeResponse;
import com.good4it.lendingservice.dto.RaiseDisputeRequest;
import com.good4it.lendingservice.dto.ResolveDisputeRequest;
import com.good4it.lendingservice.model.DisputeStatus;
import com.good4it.lendingservice.service.DisputeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class DisputeController {

    private final DisputeService disputeService;

    @PostMapping("/transactions/{transactionId}/disputes")
    public ResponseEntity<DisputeResponse> raiseDispute(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId,
            @RequestBody @Valid RaiseDisputeRequest request
    ) {
        return new ResponseEntity<>(DisputeResponse.from(
                disputeService.raiseDispute(transactionId, userId, request.disputeType(), request.description())),
                HttpStatus.CREATED);
    }

    @PostMapping("/transactions/{transactionId}/payment-not-received")
    public ResponseEntity<DisputeResponse> flagPaymentNotReceived(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID transactionId
    ) {
        return new ResponseEntity<>(DisputeResponse.from(disputeService.flagPaymentNotReceived(transactionId, userId)),
                HttpStatus.CREATED);
    }

    @PostMapping("/disputes/{disputeId}/resolve")
    public ResponseEntity<DisputeResponse> resolveDispute(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID disputeId,
            @RequestBody @Valid ResolveDisputeRequest request
    ) {
        return ResponseEntity.ok(DisputeResponse.from(
                disputeService.resolveDispute(disputeId, userId, request.outcome(), request.notes())));
    }

    @GetMapping("/disputes")
    public ResponseEntity<List<DisputeResponse>> listDisputes(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestParam(required = false) DisputeStatus status
    ) {
        return ResponseEntity.ok(disputeService.listDisputes(userId, status).stream()
                .map(DisputeResponse::from)
                .toList());
    }
}
