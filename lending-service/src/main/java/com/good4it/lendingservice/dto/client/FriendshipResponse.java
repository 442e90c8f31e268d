package com.good4it.lendingservice.dto.client;

public record FriendshipResponse(boolean friends) {
}
