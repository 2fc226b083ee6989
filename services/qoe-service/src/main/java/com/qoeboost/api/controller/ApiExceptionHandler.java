package com.qoeboost.api.controller;

import com.qoeboost.api.dto.ErrorResponse;
import com.qoeboost.api.exception.ConflictException;
import com.qoeboost.api.exception.NotFoundException;
import com.qoeboost.api.exception.UnauthorizedException;
import com.qoeboost.api.exception.ValidationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps the service's exceptions to uniform JSON error bodies.
 *
 * <ul>
 *   <li>validation_error: 400, names the offending field where known</li>
 *   <li>conflict: 400, username or email already registered</li>
 *   <li>unauthorized: 401, always the same message whatever the cause</li>
 *   <li>not_found: 404</li>
 * </ul>
 *
 * Unreadable bodies (malformed or double-encoded JSON, unknown fields, wrong
 * types) are validation errors; no attempt is made to repair them.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationFailedException ex, HttpServletRequest request) {
        return validation(ex.getField(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        if (fieldError == null) {
            return validation(null, "Invalid request body", request);
        }
        return validation(fieldError.getField(), fieldError.getDefaultMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return validation(null, "Malformed JSON request body", request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return validation(ex.getParameterName(), "Required parameter is missing", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return validation(ex.getName(), "Parameter has the wrong type", request);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "conflict", ex.getMessage(), null, request);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, "unauthorized", UnauthorizedException.MESSAGE, null, request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null, request);
    }

    private static ResponseEntity<ErrorResponse> validation(String field, String message, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_error", message, field, request);
    }

    private static ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String code, String message, String field, HttpServletRequest request) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (status == HttpStatus.UNAUTHORIZED) {
            builder.header("WWW-Authenticate", "Bearer");
        }
        return builder.body(ErrorResponse.builder()
                .error(code)
                .message(message)
                .field(field)
                .status(status.value())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
    }
}
