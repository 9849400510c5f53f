package com.yoursp.faceapproval.modules.extractor;

import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;

/**
 * Thrown when the face embedding service is unreachable, answers with an
 * error, or its circuit breaker is open.
 */
public class FeatureExtractorUnavailableException extends ApprovalException {

    public FeatureExtractorUnavailableException(String message) {
        super(ApprovalErrorCode.EXTRACTOR_UNAVAILABLE, message);
    }

    public FeatureExtractorUnavailableException(String message, Throwable cause) {
        super(ApprovalErrorCode.EXTRACTOR_UNAVAILABLE, message, cause);
    }
}
