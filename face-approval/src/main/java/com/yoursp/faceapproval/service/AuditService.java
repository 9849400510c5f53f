package com.yoursp.faceapproval.service;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.model.entity.ConsoleLog;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Service for recording console audit entries.
 * Should be called from every state-changing operation and every rejected
 * attempt (capture, enroll, approve, session end, admin changes).
 * <p>
 * Only the most recent entries are kept (see {@code face-approval.audit.retention}).
 * A failed write is logged and dropped so that auditing never blocks the
 * operation being audited.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ApprovalStore store;
    private final FaceApprovalProperties properties;
    private final Clock clock;

    /**
     * Record an audit entry.
     *
     * @param action free-text description, e.g. "SESSION ENDED: 3f2a9c1b..."
     */
    public void record(String action) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        ConsoleLog entry = ConsoleLog.builder()
                .timestamp(now)
                .action(action)
                .formatted("[" + FORMAT.format(now) + "] " + action)
                .build();
        try {
            store.appendLog(entry, properties.getAudit().getRetention());
            log.debug("Audit logged: {}", action);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit entry, dropping it: action={}, error={}", action, e.getMessage());
        }
    }

    /**
     * @return formatted entries, most recent first
     */
    public List<String> recentEntries() {
        return store.recentLogs(properties.getAudit().getRetention());
    }
}
