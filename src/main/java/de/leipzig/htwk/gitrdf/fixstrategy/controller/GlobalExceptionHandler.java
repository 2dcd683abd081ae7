package de.leipzig.htwk.gitrdf.fixstrategy.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.fasterxml.jackson.core.JsonParseException;

import de.leipzig.htwk.gitrdf.fixstrategy.exception.EmbeddingVariantMismatchException;
import de.leipzig.htwk.gitrdf.fixstrategy.exception.RequestValidationException;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = ex.getBindingResult().getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing + "; " + replacement
                ));

        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Validation failed",
                "message", "Please fix the following field errors:",
                "fieldErrors", fieldErrors,
                "hint", "Check that all required fields are provided and have valid values"
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleJsonParseError(HttpMessageNotReadableException ex) {
        String message = "Invalid JSON format";
        String hint = "Check your JSON syntax";

        if (ex.getCause() instanceof JsonParseException jsonEx) {
            message = "JSON parsing error: " + jsonEx.getOriginalMessage();
            hint = "Common issues: trailing commas, missing quotes, unescaped characters";
        } else if (ex.getMessage() != null && ex.getMessage().contains("Cannot deserialize")) {
            message = "JSON value has the wrong type";
            hint = "Booleans are true/false, confidences are numbers between 0.0 and 1.0";
        }

        log.warn("JSON parsing error: {}", ex.getMessage());

        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Invalid JSON",
                "message", message,
                "hint", hint
        ));
    }

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<Map<String, Object>> handleRequestValidation(RequestValidationException ex) {
        log.warn("Request validation failed for {}: {}", ex.getRequestType(), ex.getMessage());

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", "Request validation failed");
        response.put("requestType", ex.getRequestType());
        response.put("message", ex.getMessage());

        RequestValidationException.FieldRejection rejection = ex.getRejection();
        Map<String, Object> fieldError = new HashMap<>();
        fieldError.put("field", rejection.field());
        fieldError.put("providedValue", rejection.providedValue());
        fieldError.put("message", rejection.message());
        if (rejection.allowedValues() != null && !rejection.allowedValues().isEmpty()) {
            fieldError.put("allowedValues", rejection.allowedValues());
        }
        if (rejection.suggestion() != null) {
            fieldError.put("suggestion", rejection.suggestion());
        }

        response.put("validationErrors", List.of(fieldError));
        response.put("hint", "See validationErrors for the offending fields");

        if (ex.getValidExample() != null) {
            response.put("validExample", ex.getValidExample());
        }

        return ResponseEntity.badRequest().body(response);
    }

    // Comparing vectors from different feature spaces is a programming error, not a client error
    @ExceptionHandler(EmbeddingVariantMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleVariantMismatch(EmbeddingVariantMismatchException ex) {
        log.error("Embedding variant mismatch: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "error", "Embedding variant mismatch",
                "message", ex.getMessage(),
                "hint", "Stored and query embeddings come from different embedders"
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        String message = ex.getMessage();
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", "Invalid argument");
        response.put("message", message != null ? message : "Invalid argument provided");

        if (message != null && message.contains("issue type")) {
            response.put("allowedValues", IssueType.getAllValues());
            response.put("hint", "Use one of the lower-case issue type names");
        } else {
            response.put("hint", "Check that all provided values are valid for this operation");
        }

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericError(Exception ex) {
        log.error("Unexpected error occurred", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "error", "Internal server error",
                "message", "An unexpected error occurred",
                "hint", "If this persists, please check the server logs"
        ));
    }
}
