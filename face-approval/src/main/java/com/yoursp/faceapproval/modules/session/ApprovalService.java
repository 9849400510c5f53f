package com.yoursp.faceapproval.modules.session;

import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.modules.capture.FaceEmbeddingService;
import com.yoursp.faceapproval.modules.matcher.EmbeddingMatcher;
import com.yoursp.faceapproval.modules.matcher.MatchResult;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Face approval: live image in, access session out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalService {

    private final FaceEmbeddingService faceEmbeddingService;
    private final EmbeddingMatcher matcher;
    private final AccessSessionService sessionService;
    private final ApprovalStore store;
    private final AuditService auditService;

    /**
     * @param faceImage base64 payload of the live capture
     * @return the new session for the matched identity
     * @throws ApprovalException {@code NO_MATCH} when no enrolled face is close
     *                           enough, or any capture validation error
     */
    public AccessSession approve(String faceImage) {
        double[] liveEmbedding = faceEmbeddingService.extractSingleEmbedding(faceImage, "approval");

        MatchResult match = matcher.match(liveEmbedding, store.findAllIdentities())
                .orElseThrow(() -> {
                    auditService.record("APPROVAL DENIED: Face not recognized");
                    log.info("Approval denied: no identity under threshold");
                    return new ApprovalException(ApprovalErrorCode.NO_MATCH,
                            "Face not recognized. Please register first or try again.");
                });

        log.debug("Matched name={} at distance={}", match.identity().getName(), match.distance());
        return sessionService.issue(match.identity(), match.confidence());
    }
}
