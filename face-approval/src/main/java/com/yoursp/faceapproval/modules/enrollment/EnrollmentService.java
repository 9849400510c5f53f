package com.yoursp.faceapproval.modules.enrollment;

import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.exception.StorageUnavailableException;
import com.yoursp.faceapproval.model.entity.Identity;
import com.yoursp.faceapproval.modules.enrollment.dto.EnrollmentResult;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.SecureTokens;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import com.yoursp.faceapproval.service.storage.EnrollmentOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Turns a capture ticket plus form metadata into a permanent identity.
 * <p>
 * Enrollment is all-or-nothing: the store consumes the ticket and inserts the
 * identity in one step, so a capture yields at most one identity.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    private final ApprovalStore store;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Enroll the face held for {@code sessionToken}.
     *
     * @param sessionToken capture token from the cookie (may be null)
     * @param name         unique subject name
     * @param groupName    class / group label
     * @param rollId       roll number or other identifier
     * @return the generated access code and the stored name
     */
    public EnrollmentResult enroll(String sessionToken, String name, String groupName, String rollId) {
        String trimmedName = trim(name);
        String trimmedGroup = trim(groupName);
        String trimmedRoll = trim(rollId);

        if (trimmedName.isEmpty() || trimmedGroup.isEmpty() || trimmedRoll.isEmpty()) {
            throw ApprovalException.invalidInput("All fields are required (name, class, roll)");
        }

        if (sessionToken == null) {
            throw missingCapture();
        }

        String accessCode = SecureTokens.accessCode();
        EnrollmentOutcome outcome;
        try {
            outcome = store.enrollFromTicket(sessionToken, ticket -> Identity.builder()
                    .name(trimmedName)
                    .embedding(ticket.embedding())
                    .groupName(trimmedGroup)
                    .rollId(trimmedRoll)
                    .accessCode(accessCode)
                    .imagePreview(ticket.imagePreview())
                    .registeredAt(OffsetDateTime.now(clock))
                    .build());
        } catch (StorageUnavailableException e) {
            auditService.record("ERROR: Registration failed for " + trimmedName + " - " + e.getMessage());
            throw e;
        }

        switch (outcome) {
            case MISSING_CAPTURE -> throw missingCapture();
            case NAME_TAKEN -> {
                auditService.record("REGISTRATION REJECTED: '" + trimmedName + "' is already registered");
                throw new ApprovalException(ApprovalErrorCode.DUPLICATE_IDENTITY,
                        "User '" + trimmedName + "' is already registered.");
            }
            case ENROLLED -> {
            }
        }

        auditService.record("NEW REGISTRATION: " + trimmedName + " | Class: " + trimmedGroup
                + " | Roll: " + trimmedRoll + " | Code: " + accessCode);
        log.info("Identity enrolled: name={}", trimmedName);

        return new EnrollmentResult(accessCode, trimmedName);
    }

    private static ApprovalException missingCapture() {
        return new ApprovalException(ApprovalErrorCode.MISSING_CAPTURE,
                "No face captured. Please capture your face first using the camera.");
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }
}
