package com.inboxai.credit_core.exception;

import com.inboxai.credit_core.credit.ActionExecutionException;
import com.inboxai.credit_core.credit.InsufficientCreditsException;
import com.inboxai.credit_core.integration.IntegrationException;
import com.inboxai.credit_core.ledger.LedgerWriteConflictException;
import com.inboxai.credit_core.schedule.ScheduleNotFoundException;
import com.inboxai.credit_core.schedule.TierLimitExceededException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to the uniform {@link ErrorResponse} body.
 *
 * Credit failures carry their numbers in {@code details}: required and available credits for a
 * rejection, credits_used for an action that failed after charging.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCredits(InsufficientCreditsException e) {
        log.info("Insufficient credits: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_type", e.getActionType());
        details.put("required_credits", e.getRequiredCredits());
        details.put("available_credits", e.getAvailableCredits());

        return respond(HttpStatus.PAYMENT_REQUIRED, "Insufficient Credits", e.getMessage(), details);
    }

    @ExceptionHandler(ActionExecutionException.class)
    public ResponseEntity<ErrorResponse> handleActionExecution(ActionExecutionException e) {
        log.warn("Action failed after charging: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_type", e.getActionType().code());
        details.put("credits_used", e.getCreditsUsed());
        details.put("available_credits", e.getAvailableCredits());

        return respond(HttpStatus.BAD_GATEWAY, "Action Failed",
            "The action failed after " + e.getCreditsUsed() + " credits were charged", details);
    }

    @ExceptionHandler(LedgerWriteConflictException.class)
    public ResponseEntity<ErrorResponse> handleLedgerConflict(LedgerWriteConflictException e) {
        log.error("Ledger write conflict persisted after retries: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Ledger Busy",
            "The credit ledger is busy, please retry", null);
    }

    @ExceptionHandler(TierLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleTierLimit(TierLimitExceededException e) {
        log.info("Tier limit reached: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subscription_tier", e.getTier().code());
        details.put("limit", e.getLimit());

        return respond(HttpStatus.CONFLICT, "Tier Limit Exceeded", e.getMessage(), details);
    }

    @ExceptionHandler(ScheduleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleScheduleNotFound(ScheduleNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(IntegrationException.class)
    public ResponseEntity<ErrorResponse> handleIntegration(IntegrationException e) {
        log.error("Upstream collaborator failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Upstream Failure", "An upstream service failed", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    @Value
    @Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, Object> details;
        Instant timestamp;
    }
}
