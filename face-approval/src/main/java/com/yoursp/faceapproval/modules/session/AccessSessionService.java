package com.yoursp.faceapproval.modules.session;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.model.entity.Identity;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.SecureTokens;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Access session lifecycle.
 * <ul>
 * <li>A session is either active (stored) or absent</li>
 * <li>absent to active only through {@link #issue}</li>
 * <li>active to absent through {@link #end}, a superseding {@link #issue} for
 * the same identity, or, when {@code face-approval.session.max-age} is set,
 * expiry</li>
 * <li>At most one active session per identity name</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessSessionService {

    private final ApprovalStore store;
    private final AuditService auditService;
    private final FaceApprovalProperties properties;
    private final Clock clock;

    /**
     * Replace any session held by the identity with a fresh one.
     *
     * @param identity   matched identity; its fields are copied into the session
     * @param confidence match confidence, 0 to 100
     * @return the stored session
     */
    public AccessSession issue(Identity identity, double confidence) {
        AccessSession session = AccessSession.builder()
                .sessionId(SecureTokens.sessionToken())
                .name(identity.getName())
                .groupName(identity.getGroupName())
                .rollId(identity.getRollId())
                .accessCode(identity.getAccessCode())
                .startTime(OffsetDateTime.now(clock))
                .matchConfidence(confidence)
                .build();

        store.replaceSession(session);

        auditService.record("APPROVAL SUCCESS: " + identity.getName()
                + " | Class: " + identity.getGroupName()
                + " | Roll: " + identity.getRollId()
                + " | Confidence: " + confidence + "%");
        log.info("Access session issued: name={}, session={}", identity.getName(),
                SecureTokens.abbreviate(session.getSessionId()));
        return session;
    }

    /**
     * @throws ApprovalException {@code NOT_FOUND} if absent or expired
     */
    public AccessSession get(String sessionId) {
        AccessSession session = store.findSession(sessionId)
                .orElseThrow(() -> ApprovalException.notFound("Session not found"));
        if (isExpired(session)) {
            store.deleteSession(sessionId);
            auditService.record("SESSION EXPIRED: " + SecureTokens.abbreviate(sessionId));
            throw ApprovalException.notFound("Session not found");
        }
        return session;
    }

    /**
     * @throws ApprovalException {@code NOT_FOUND} if no such session
     */
    public void end(String sessionId) {
        if (!store.deleteSession(sessionId)) {
            throw ApprovalException.notFound("Session not found");
        }
        auditService.record("SESSION ENDED: " + SecureTokens.abbreviate(sessionId));
        log.info("Access session ended: session={}", SecureTokens.abbreviate(sessionId));
    }

    /**
     * Delete sessions older than the configured max age. No-op when unset.
     *
     * @return number of sessions removed
     */
    public int expireStaleSessions() {
        Duration maxAge = properties.getSession().getMaxAge();
        if (maxAge == null) {
            return 0;
        }
        int count = store.deleteSessionsStartedBefore(OffsetDateTime.now(clock).minus(maxAge));
        if (count > 0) {
            auditService.record("SESSIONS EXPIRED: " + count);
        }
        return count;
    }

    private boolean isExpired(AccessSession session) {
        Duration maxAge = properties.getSession().getMaxAge();
        return maxAge != null
                && session.getStartTime().isBefore(OffsetDateTime.now(clock).minus(maxAge));
    }
}
