package com.good4it.lendingservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ConcurrentTransitionException extends RuntimeException {
    public ConcurrentTransitionException(String lockKey) {
        super("Another operation is already in progress for " + lockKey);
    }
}
