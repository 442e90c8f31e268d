package com.good4it.lendingservice.dto.client;

public record ProofReference(String id, long sizeBytes, String mimeType) {
}
