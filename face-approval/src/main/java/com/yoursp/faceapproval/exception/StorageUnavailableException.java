package com.yoursp.faceapproval.exception;

/**
 * Thrown when the active storage backend fails a call. Never retried.
 */
public class StorageUnavailableException extends ApprovalException {

    public StorageUnavailableException(String message) {
        super(ApprovalErrorCode.STORAGE_UNAVAILABLE, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ApprovalErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
