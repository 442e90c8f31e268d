package com.good4it.lendingservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class NotFriendsException extends RuntimeException {
    public NotFriendsException(UUID userA, UUID userB) {
        super("Users " + userA + " and " + userB + " are not friends");
    }
}
