package com.good4it.lendingservice.core.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStateTransitionException extends RuntimeException {

    private final String code;

    public InvalidStateTransitionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static InvalidStateTransitionException from(String subject, Enum<?> current, String operation) {
        return new InvalidStateTransitionException("INVALID_STATE",
                "Cannot " + operation + " " + subject + " while it is " + current.name());
    }
}
