package com.good4it.lendingservice.core.auth;

import com.good4it.lendingservice.core.exception.NotAuthorizedPartyException;

import java.util.Optional;
import java.util.UUID;

public interface PartyAware {

    Optional<PartyRole> roleOf(UUID userId);

    String describe();

    default PartyRole requireParty(UUID userId) {
        return roleOf(userId)
                .orElseThrow(() -> new NotAuthorizedPartyException(userId, describe()));
    }

    default void requireRole(UUID userId, PartyRole required) {
        PartyRole actual = requireParty(userId);
        if (actual != required) {
            throw new NotAuthorizedPartyException(userId, required, describe());
        }
    }
}
