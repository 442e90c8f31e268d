package com.good4it.lendingservice.service;

import com.good4it.lendingservice.core.exception.ConcurrentTransitionException;

import java.util.UUID;
import java.util.function.Supplier;

public interface EntityLockService {

    boolean acquire(String key);

    void release(String key);

    default <T> T withLock(String key, Supplier<T> action) {
        if (!acquire(key)) {
            throw new ConcurrentTransitionException(key);
        }
        try {
            return action.get();
        } finally {
            release(key);
        }
    }

    static String requestKey(UUID requestId) {
        return "lock:money-request:" + requestId;
    }

    static String transactionKey(UUID transactionId) {
        return "lock:money-transaction:" + transactionId;
    }

    static String taskKey(UUID taskId) {
        return "lock:task:" + taskId;
    }
}
