package com.good4it.lendingservice.client;

import com.good4it.lendingservice.core.exception.ExternalServiceException;
import com.good4it.lendingservice.dto.ProofUpload;
import com.good4it.lendingservice.dto.client.ProofReference;
import com.good4it.lendingservice.model.ProofType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class ProofStorageClient implements ProofStorageGateway {

    private final RestClient restClient;

    @Value("${app.media-service.url}")
    private String mediaServiceUrl;

    @Override
    public ProofReference storeProof(UUID transactionId, UUID uploaderId, ProofType proofType, ProofUpload file) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("transactionId", transactionId.toString());
        body.part("uploaderId", uploaderId.toString());
        body.part("proofType", proofType.name());
        body.part("file", new ByteArrayResource(file.content()) {
            @Override
            public String getFilename() {
                return file.fileName();
            }
        }).contentType(MediaType.parseMediaType(file.contentType()));

        ProofReference reference;
        try {
            reference = restClient.post()
                    .uri(mediaServiceUrl + "/proofs")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(body.build())
                    .retrieve()
                    .body(ProofReference.class);
        } catch (Exception e) {
            log.error("Media service failed to store {} proof for transaction {}", proofType, transactionId, e);
            throw new ExternalServiceException("Media service", e);
        }

        if (reference == null || reference.id() == null) {
            throw new ExternalServiceException("Media service", new IllegalStateException("Empty proof reference"));
        }
        return reference;
    }
}
