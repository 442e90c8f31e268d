package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

public record ProofUpload(String fileName, String contentType, byte[] content) {

    public long size() {
        return content == null ? 0 : content.length;
    }

    // null when no file was sent
    public static ProofUpload from(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return null;
        }
        try {
            return new ProofUpload(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_PROOF,
                    "Cannot read uploaded proof: " + e.getMessage());
        }
    }
}
