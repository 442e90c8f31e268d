package com.good4it.scoreservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidHistoryLimitException extends RuntimeException {
    public InvalidHistoryLimitException(int limit, int max) {
        super("History limit must be between 1 and " + max + ", got " + limit);
    }
}
