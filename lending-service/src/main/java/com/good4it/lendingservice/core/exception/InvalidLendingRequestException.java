package com.good4it.lendingservice.core.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@Getter
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidLendingRequestException extends RuntimeException {

    public static final String SELF_REQUEST = "SELF_REQUEST";
    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String INVALID_EMI_DETAILS = "INVALID_EMI_DETAILS";
    public static final String MISSING_REASON = "MISSING_REASON";
    public static final String PROOF_REQUIRED = "PROOF_REQUIRED";
    public static final String INVALID_PROOF = "INVALID_PROOF";
    public static final String INVALID_TASK = "INVALID_TASK";
    public static final String INVALID_DISPUTE = "INVALID_DISPUTE";
    public static final String DUPLICATE_DISPUTE = "DUPLICATE_DISPUTE";
    public static final String INVALID_PERIOD = "INVALID_PERIOD";

    private final String code;

    public InvalidLendingRequestException(String code, String message) {
        super(message);
        this.code = code;
    }
}
