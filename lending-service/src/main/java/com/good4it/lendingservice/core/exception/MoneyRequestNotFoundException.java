package com.good4it.lendingservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class MoneyRequestNotFoundException extends RuntimeException {
    public MoneyRequestNotFoundException(UUID id) {
        super("Cannot find money request with id: " + id);
    }
}
