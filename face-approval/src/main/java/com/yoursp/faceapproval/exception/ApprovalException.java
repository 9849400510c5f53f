package com.yoursp.faceapproval.exception;

import lombok.Getter;

/**
 * Base unchecked exception for every rejection the approval flows report to a
 * caller. The handler turns {@link #getCode()} into the response status.
 */
@Getter
public class ApprovalException extends RuntimeException {

    private final ApprovalErrorCode code;

    public ApprovalException(ApprovalErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ApprovalException(ApprovalErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ApprovalException invalidInput(String message) {
        return new ApprovalException(ApprovalErrorCode.INVALID_INPUT, message);
    }

    public static ApprovalException notFound(String message) {
        return new ApprovalException(ApprovalErrorCode.NOT_FOUND, message);
    }
}
