package com.good4it.lendingservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class NotEmiTransactionException extends RuntimeException {
    public NotEmiTransactionException(UUID transactionId) {
        super("Transaction " + transactionId + " is not repaid in EMIs");
    }
}
