package com.good4it.lendingservice.service;

import com.good4it.lendingservice.dto.CreateMoneyRequest;
import com.good4it.lendingservice.dto.Decision;
import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.dto.RequestFilter;
import com.good4it.lendingservice.model.MoneyRequest;
import com.good4it.lendingservice.model.MoneyTransaction;

import java.util.List;
import java.util.UUID;

public interface MoneyRequestService {

    MoneyRequest createRequest(UUID requestorId, CreateMoneyRequest request);

    MoneyRequest decide(UUID requestId, UUID actorId, Decision decision, String rejectionReason);

    MoneyTransaction approveAndPay(UUID requestId, UUID actorId, ProofUpload proof);

    // Older approve-then-send flow; proof optional
    @Deprecated
    MoneyTransaction sendMoney(UUID requestId, UUID actorId, ProofUpload proof);

    MoneyRequest getRequest(UUID requestId, UUID actorId);

    List<MoneyRequest> listRequests(UUID userId, RequestFilter filter);
}
