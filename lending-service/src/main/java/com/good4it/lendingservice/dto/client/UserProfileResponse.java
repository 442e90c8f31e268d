package com.good4it.lendingservice.dto.client;

import java.util.UUID;

public record UserProfileResponse(UUID id, String fullName) {
}
