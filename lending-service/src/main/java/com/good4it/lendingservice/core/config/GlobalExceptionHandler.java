package com.good4it.lendingservice.core.config;

import com.good4it.lendingservice.core.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(InvalidLendingRequestException.class)
    public ProblemDetail handleInvalidRequest(InvalidLendingRequestException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION", ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({NotFriendsException.class, NotEmiTransactionException.class})
    public ProblemDetail handleRelationship(RuntimeException ex) {
        String code = ex instanceof NotFriendsException ? "NOT_FRIENDS" : "NOT_EMI";
        return problem(HttpStatus.BAD_REQUEST, "Invalid Request", "VALIDATION", code, ex.getMessage());
    }

    @ExceptionHandler(NotAuthorizedPartyException.class)
    public ProblemDetail handleNotAuthorized(NotAuthorizedPartyException ex) {
        ProblemDetail problemDetail = problem(HttpStatus.FORBIDDEN, "Not Authorized", "AUTHORIZATION",
                "NOT_A_PARTY", ex.getMessage());
        if (ex.getRequiredRole() != null) {
            problemDetail.setProperty("requiredRole", ex.getRequiredRole());
        }
        return problemDetail;
    }

    @ExceptionHandler({MoneyRequestNotFoundException.class, TransactionNotFoundException.class,
            TaskNotFoundException.class, DisputeNotFoundException.class})
    public ProblemDetail handleNotFound(RuntimeException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "NOT_FOUND", "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ProblemDetail handleInvalidState(InvalidStateTransitionException ex) {
        return problem(HttpStatus.CONFLICT, "Invalid State", "STATE_CONFLICT", ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(ConcurrentTransitionException.class)
    public ProblemDetail handleConcurrentTransition(ConcurrentTransitionException ex) {
        return problem(HttpStatus.CONFLICT, "Concurrent Update", "STATE_CONFLICT", "LOCKED", ex.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ProblemDetail handleOptimisticLock(OptimisticLockingFailureException ex) {
        log.warn("Optimistic lock failure: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Concurrent Update", "STATE_CONFLICT", "STALE_STATE",
                "The record was modified concurrently, retry the operation");
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ProblemDetail handleExternalService(ExternalServiceException ex) {
        log.error("Dependency failure: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Dependency Unavailable", "DEPENDENCY", "DEPENDENCY_FAILED",
                ex.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String kind, String code, String detail) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("kind", kind);
        problemDetail.setProperty("code", code);
        problemDetail.setProperty("timestamp", Instant.now());
        return problemDetail;
    }
}
