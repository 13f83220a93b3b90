package com.karting.entries.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as {@code { "error", "message", "field" }}. Drivers get a generic message
 * for internal faults; admin paths get the underlying kind and message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "Something went wrong on our side, please try again";

    @ExceptionHandler(EntryServiceException.class)
    public ResponseEntity<Map<String, Object>> handleEntryService(EntryServiceException ex, HttpServletRequest request) {
        boolean admin = ClientRequests.isAdminPath(request);
        if (ex.isClientFacing()) {
            log.info("Request refused: path={}, error={}, message={}", request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        } else {
            log.error("Request failed: path={}, error={}", request.getRequestURI(), ex.getErrorCode(), ex);
        }
        String field = ex instanceof ValidationFailedException ? ((ValidationFailedException) ex).getField() : null;
        String message = ex.isClientFacing() || admin ? ex.getMessage() : GENERIC_MESSAGE;
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(ex.getStatus());
        if (ex instanceof AuthenticationFailedException && !admin) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"karting\"");
        }
        return builder.body(envelope(ex.getErrorCode(), message, field));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid");
        }
        String field = errors.isEmpty() ? null : errors.keySet().iterator().next();
        Map<String, Object> body = envelope("VALIDATION_FAILED",
                field == null ? "Request is invalid" : errors.get(field), field);
        body.put("details", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        String field = ex instanceof MethodArgumentTypeMismatchException
                ? ((MethodArgumentTypeMismatchException) ex).getName()
                : ex instanceof MissingServletRequestParameterException
                        ? ((MissingServletRequestParameterException) ex).getParameterName() : null;
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(envelope("VALIDATION_FAILED", "Request could not be read", field));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(envelope("VALIDATION_FAILED", ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            if (status.is4xxClientError()) {
                return ResponseEntity.status(status).body(envelope(status.value() == 404 ? "NOT_FOUND" : "BAD_REQUEST",
                        ((ErrorResponse) ex).getBody().getDetail(), null));
            }
        }
        log.error("Unhandled error: path={}", request.getRequestURI(), ex);
        String message = ClientRequests.isAdminPath(request) ? getMessageOrCause(ex) : GENERIC_MESSAGE;
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(envelope("INTERNAL_ERROR", message, null));
    }

    private static Map<String, Object> envelope(String error, String message, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("field", field);
        return body;
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return ex.getClass().getSimpleName() + ": " + t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
