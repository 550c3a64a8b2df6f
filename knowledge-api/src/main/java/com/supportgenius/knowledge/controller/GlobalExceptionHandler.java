package com.supportgenius.knowledge.controller;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final long maxFileSizeBytes;

    public GlobalExceptionHandler(@Value("${knowledge.uploads.max-file-size-bytes:10485760}") long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    @ExceptionHandler(KnowledgeException.class)
    public ResponseEntity<Map<String, Object>> handleKnowledgeException(KnowledgeException exception) {
        if (exception.status().is5xxServerError()) {
            log.error("Request failed with {}", exception.code(), exception);
        }
        return error(exception.code(), exception.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException exception) {
        String message = exception.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request");
        return error(KnowledgeErrorCode.INVALID_INPUT, message);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException exception) {
        return handleKnowledgeException(KnowledgeException.fileTooLarge(maxFileSizeBytes));
    }

    private ResponseEntity<Map<String, Object>> error(KnowledgeErrorCode code, String message) {
        return ResponseEntity.status(code.status())
                .body(Map.of(
                        "error", message,
                        "code", code.name()
                ));
    }
}
