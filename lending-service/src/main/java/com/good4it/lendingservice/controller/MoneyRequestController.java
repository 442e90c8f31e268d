package com.good4it.lendingservice.controller;

import com.good4it.lendingservice.dto.*;
import com.good4it.lendingservice.model.MoneyRequest;
import com.good4it.lendingservice.service.MoneyRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/money-requests")
@RequiredArgsConstructor
public class MoneyRequestController {

    private final MoneyRequestService moneyRequestService;

    @PostMapping
    public ResponseEntity<MoneyRequestResponse> createRequest(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody @Valid CreateMoneyRequest request
    ) {
        MoneyRequest created = moneyRequestService.createRequest(userId, request);
        return new ResponseEntity<>(MoneyRequestResponse.from(created), HttpStatus.CREATED);
    }

    @PostMapping("/{requestId}/decision")
    public ResponseEntity<MoneyRequestResponse> decide(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID requestId,
            @RequestBody @Valid DecisionRequest request
    ) {
        MoneyRequest decided = moneyRequestService.decide(requestId, userId, request.decision(), request.rejectionReason());
        return ResponseEntity.ok(MoneyRequestResponse.from(decided));
    }

    @PostMapping(value = "/{requestId}/approve-and-pay", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TransactionResponse> approveAndPay(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID requestId,
            @RequestPart(value = "proof", required = false) MultipartFile proof
    ) {
        return new ResponseEntity<>(
                TransactionResponse.from(moneyRequestService.approveAndPay(requestId, userId, ProofUpload.from(proof))),
                HttpStatus.CREATED);
    }

    @SuppressWarnings("deprecation")
    @PostMapping(value = "/{requestId}/send-money", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TransactionResponse> sendMoney(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID requestId,
            @RequestPart(value = "proof", required = false) MultipartFile proof
    ) {
        return new ResponseEntity<>(
                TransactionResponse.from(moneyRequestService.sendMoney(requestId, userId, ProofUpload.from(proof))),
                HttpStatus.CREATED);
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<MoneyRequestResponse> getRequest(
            @RequestHeader("X-User-ID") UUID userId,
            @PathVariable UUID requestId
    ) {
        return ResponseEntity.ok(MoneyRequestResponse.from(moneyRequestService.getRequest(requestId, userId)));
    }

    @GetMapping
    public ResponseEntity<List<MoneyRequestResponse>> listRequests(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestParam(defaultValue = "ALL") RequestFilter filter
    ) {
        return ResponseEntity.ok(moneyRequestService.listRequests(userId, filter).stream()
                .map(MoneyRequestResponse::from)
                .toList());
    }
}
