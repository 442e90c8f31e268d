package com.good4it.lendingservice.client;

import com.good4it.lendingservice.core.exception.ExternalServiceException;
import com.good4it.lendingservice.dto.client.FriendshipResponse;
import com.good4it.lendingservice.dto.client.UserProfileResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class SocialGraphClient implements SocialGraphGateway {

    static final String UNKNOWN_USER = "Your friend";

    private final RestClient restClient;

    @Value("${app.user-service.url}")
    private String userServiceUrl;

    @Override
    public boolean areFriends(UUID userA, UUID userB) {
        try {
            FriendshipResponse response = restClient.get()
                    .uri(userServiceUrl + "/users/{userA}/friends/{userB}", userA, userB)
                    .retrieve()
                    .body(FriendshipResponse.class);

            return response != null && response.friends();
        } catch (Exception e) {
            log.error("User service unreachable while checking friendship of {} and {}", userA, userB, e);
            throw new ExternalServiceException("User service", e);
        }
    }

    @Override
    public String displayName(UUID userId) {
        try {
            UserProfileResponse profile = restClient.get()
                    .uri(userServiceUrl + "/users/{userId}", userId)
                    .retrieve()
                    .body(UserProfileResponse.class);

            return profile != null && profile.fullName() != null ? profile.fullName() : UNKNOWN_USER;
        } catch (Exception e) {
            log.warn("Cannot resolve display name of user {}: {}", userId, e.getMessage());
            return UNKNOWN_USER;
        }
    }
}
