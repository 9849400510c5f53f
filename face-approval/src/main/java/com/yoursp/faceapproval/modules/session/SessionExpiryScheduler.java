package com.yoursp.faceapproval.modules.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ends access sessions older than {@code face-approval.session.max-age}.
 * Does nothing while the property is unset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionExpiryScheduler {

    private final AccessSessionService sessionService;

    @Scheduled(fixedRate = 60_000) // 1 minute
    public void expireStaleSessions() {
        int count = sessionService.expireStaleSessions();
        if (count > 0) {
            log.info("Expired {} stale access session(s)", count);
        }
    }
}
