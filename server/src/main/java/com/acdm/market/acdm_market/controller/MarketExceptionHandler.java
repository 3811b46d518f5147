package com.acdm.market.acdm_market.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.acdm.market.acdm_market.controller.dto.ErrorResponse;
import com.acdm.market.acdm_market.exception.GuardViolationException;
import com.acdm.market.acdm_market.exception.MarketException;
import com.acdm.market.acdm_market.exception.PermissionDeniedException;
import com.acdm.market.acdm_market.exception.StateNotFoundException;
import com.acdm.market.acdm_market.exception.TransferFailureException;
import com.acdm.market.acdm_market.exception.ValidationException;
import com.acdm.market.acdm_market.execution.MarketCallTimeoutException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class MarketExceptionHandler {

    @ExceptionHandler(MarketException.class)
    public ResponseEntity<ErrorResponse> market(MarketException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Market call failed: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getReason(), e.getMessage()));
    }

    /**
     * 503 when the call was cancelled before it ran and can be retried, 504 when it may still commit.
     */
    @ExceptionHandler(MarketCallTimeoutException.class)
    public ResponseEntity<ErrorResponse> timedOut(MarketCallTimeoutException e) {
        if (e.isStarted()) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(new ErrorResponse("OutcomeUnknown", e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("CallNotExecuted", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(new ErrorResponse(ValidationException.REASON, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ValidationException.REASON, "Malformed request body"));
    }

    static HttpStatus statusOf(MarketException e) {
        if (e instanceof GuardViolationException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof StateNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof TransferFailureException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (e instanceof PermissionDeniedException) {
            return HttpStatus.FORBIDDEN;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
