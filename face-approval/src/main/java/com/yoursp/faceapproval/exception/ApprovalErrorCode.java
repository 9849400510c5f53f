package com.yoursp.faceapproval.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy surfaced to API callers. Each code carries its HTTP status.
 */
public enum ApprovalErrorCode {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    DECODE_FAILURE(HttpStatus.BAD_REQUEST),
    NO_FACE_DETECTED(HttpStatus.BAD_REQUEST),
    MULTIPLE_FACES_DETECTED(HttpStatus.BAD_REQUEST),
    ENCODING_FAILURE(HttpStatus.BAD_REQUEST),
    MISSING_CAPTURE(HttpStatus.BAD_REQUEST),
    DUPLICATE_IDENTITY(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    NO_MATCH(HttpStatus.NOT_FOUND),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    EXTRACTOR_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ApprovalErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
