package com.yoursp.faceapproval.service.storage;

public enum EnrollmentOutcome {
    ENROLLED,
    MISSING_CAPTURE,
    NAME_TAKEN
}
