package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.exception.StorageUnavailableException;
import com.yoursp.faceapproval.model.CaptureTicket;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.SecureTokens;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Registration capture: validates a face image and parks its embedding in a
 * short-lived capture ticket until the enrollment form is submitted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaceCaptureService {

    private final FaceEmbeddingService faceEmbeddingService;
    private final ApprovalStore store;
    private final AuditService auditService;
    private final FaceApprovalProperties properties;
    private final Clock clock;

    /**
     * Validate the image and store (or replace) the ticket for the token.
     *
     * @param sessionToken capture session token from the cookie
     * @param faceImage    base64 payload
     */
    public void capture(String sessionToken, String faceImage) {
        double[] embedding = faceEmbeddingService.extractSingleEmbedding(faceImage, "registration");

        CaptureTicket ticket = new CaptureTicket(sessionToken, preview(faceImage), embedding,
                OffsetDateTime.now(clock));
        try {
            store.saveTicket(ticket);
        } catch (StorageUnavailableException e) {
            auditService.record("ERROR: Face capture failed - " + e.getMessage());
            throw e;
        }

        auditService.record("Face captured and validated for registration (Session: "
                + SecureTokens.abbreviate(sessionToken) + ")");
        log.info("Capture ticket stored: session={}", SecureTokens.abbreviate(sessionToken));
    }

    /**
     * Drop any ticket held for the token. Succeeds whether or not one exists.
     */
    public void clear(String sessionToken) {
        store.deleteTicket(sessionToken);
        auditService.record("Face capture cleared (Session: " + SecureTokens.abbreviate(sessionToken) + ")");
    }

    private String preview(String faceImage) {
        int limit = properties.getCapture().getPreviewLength();
        return faceImage.length() <= limit ? faceImage : faceImage.substring(0, limit);
    }
}
