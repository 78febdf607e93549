package com.linlay.agentroom.controller;

import com.linlay.agentroom.agent.UnknownAgentException;
import com.linlay.agentroom.config.ConfigurationException;
import com.linlay.agentroom.model.api.ApiResponse;
import com.linlay.agentroom.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Maps orchestration failures onto the {@link ApiResponse} envelope. Unknown agents are 404,
 * configuration and input problems 400, upstream provider failures 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownAgentException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownAgent(UnknownAgentException ex) {
        return reply(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    // covers InputValidationException
    @ExceptionHandler({ConfigurationException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(RuntimeException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return reply(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiResponse<Void>> handleProvider(ProviderException ex) {
        log.warn("Provider call failed after retries: {}", ex.getMessage());
        return reply(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiResponse<Map<String, Map<String, String>>>> handleValidation(WebExchangeBindException ex) {
        Map<String, String> fields = new TreeMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure(HttpStatus.BAD_REQUEST, "Validation failed", Map.of("fields", fields)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse<Void>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String message = ex.getReason();
        if (message == null || message.isBlank()) {
            HttpStatus known = HttpStatus.resolve(status.value());
            message = known != null ? known.getReasonPhrase() : "Request failed";
        }
        return reply(status, message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unhandled request failure", ex);
        return reply(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiResponse<Void>> reply(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.failure(status, message));
    }
}
