package com.good4it.scoreservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnknownChangeTypeException extends RuntimeException {
    public UnknownChangeTypeException(String changeType) {
        super("Unknown score change type: " + changeType);
    }
}
