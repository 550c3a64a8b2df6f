package com.supportgenius.knowledge.exception;

import org.springframework.http.HttpStatus;

import java.util.Objects;

public class KnowledgeException extends RuntimeException {

    private final KnowledgeErrorCode code;

    public KnowledgeException(KnowledgeErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public KnowledgeException(KnowledgeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public static KnowledgeException fileTooLarge(long maxFileSizeBytes) {
        return new KnowledgeException(KnowledgeErrorCode.FILE_TOO_LARGE,
                "File size must be less than " + (maxFileSizeBytes / (1024 * 1024)) + "MB");
    }

    public KnowledgeErrorCode code() {
        return code;
    }

    public HttpStatus status() {
        return code.status();
    }
}
