package com.saltbet.web;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders rejected request bodies with the same {@code code} field as betting errors,
 * plus the first message reported for each invalid field.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<InvalidRequestResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        String message = fieldErrors.isEmpty()
                ? "Request body is invalid"
                : "Request body is invalid: " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(new InvalidRequestResponse("invalid_request", message, fieldErrors));
    }

    public record InvalidRequestResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
