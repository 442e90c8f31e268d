package com.good4it.lendingservice.core.exception;

import com.good4it.lendingservice.core.auth.PartyRole;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@Getter
@ResponseStatus(HttpStatus.FORBIDDEN)
public class NotAuthorizedPartyException extends RuntimeException {

    private final PartyRole requiredRole;

    public NotAuthorizedPartyException(UUID userId, String subject) {
        super("User " + userId + " is not a party to " + subject);
        this.requiredRole = null;
    }

    public NotAuthorizedPartyException(UUID userId, PartyRole requiredRole, String subject) {
        super("Only the " + requiredRole.name().toLowerCase().replace('_', ' ')
                + " of " + subject + " can do this (user " + userId + ")");
        this.requiredRole = requiredRole;
    }

    public NotAuthorizedPartyException(String message) {
        super(message);
        this.requiredRole = null;
    }
}
