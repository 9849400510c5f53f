package com.yoursp.faceapproval.modules.enrollment.dto;

/**
 * @param accessCode code handed to the newly enrolled subject
 * @param name       enrolled name, trimmed
 */
public record EnrollmentResult(String accessCode, String name) {
}
