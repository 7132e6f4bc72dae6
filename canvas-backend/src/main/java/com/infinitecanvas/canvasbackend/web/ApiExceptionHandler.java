package com.infinitecanvas.canvasbackend.web;

import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.storage.RoomPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures of the REST endpoints to {@code {error, message}} bodies. Both
 * fields carry the same text; browser clients read {@code message}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CanvasException.class)
    public ResponseEntity<Map<String, String>> handleCanvas(CanvasException e) {
        HttpStatus status = switch (e.getCode()) {
            case AUTHENTICATION_REJECTED, PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
        log.warn("Request rejected ({}): {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status)
                .body(withCode(errorBody(e.getMessage()), e.getCode().name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField())
                .sorted()
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(errorBody(message));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleUploadSize(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(errorBody("Upload too large"));
    }

    @ExceptionHandler(RoomPersistenceException.class)
    public ResponseEntity<Map<String, String>> handlePersistence(RoomPersistenceException e) {
        log.error("Room storage failure", e);
        return ResponseEntity.internalServerError().body(errorBody("Room storage unavailable"));
    }

    static Map<String, String> errorBody(String message) {
        String text = message != null ? message : "Request failed";
        return Map.of("error", text, "message", text);
    }

    private static Map<String, String> withCode(Map<String, String> body, String code) {
        Map<String, String> withCode = new LinkedHashMap<>(body);
        withCode.put("code", code);
        return withCode;
    }
}
