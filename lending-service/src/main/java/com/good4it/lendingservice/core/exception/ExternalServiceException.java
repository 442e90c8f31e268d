package com.good4it.lendingservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class ExternalServiceException extends RuntimeException {
    public ExternalServiceException(String service, Throwable cause) {
        super(service + " is unavailable", cause);
    }
}
