package com.supportgenius.knowledge.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable failure categories of the knowledge pipeline. The code is what gets persisted and logged,
 * the status is only used when a failure surfaces through the REST layer.
 */
public enum KnowledgeErrorCode {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    FILE_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE),
    EXTRACTION_FAILURE(HttpStatus.UNPROCESSABLE_ENTITY),
    EMPTY_DOCUMENT(HttpStatus.UNPROCESSABLE_ENTITY),
    NO_CHUNKS_PRODUCED(HttpStatus.UNPROCESSABLE_ENTITY),
    EMBEDDING_FAILURE(HttpStatus.BAD_GATEWAY),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    EMPTY_DELETE_SET(HttpStatus.BAD_REQUEST),
    VECTOR_STORE_FAILURE(HttpStatus.BAD_GATEWAY),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    KnowledgeErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
