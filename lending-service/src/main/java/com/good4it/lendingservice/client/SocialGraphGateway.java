package com.good4it.lendingservice.client;

import java.util.UUID;

public interface SocialGraphGateway {

    boolean areFriends(UUID userA, UUID userB);

    String displayName(UUID userId);
}
