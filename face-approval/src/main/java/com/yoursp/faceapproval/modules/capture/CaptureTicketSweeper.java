package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Reclaims capture tickets past their TTL. Only the in-memory store has
 * anything to purge; Redis expires keys itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaptureTicketSweeper {

    private final ApprovalStore store;
    private final FaceApprovalProperties properties;
    private final Clock clock;

    @Scheduled(fixedRate = 60_000) // 1 minute
    public void purgeExpiredTickets() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(properties.getCapture().getTicketTtl());
        int count = store.purgeExpiredTickets(cutoff);
        if (count > 0) {
            log.info("Purged {} expired capture ticket(s)", count);
        }
    }
}
