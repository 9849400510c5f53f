package com.yoursp.faceapproval.service;

import com.yoursp.faceapproval.service.storage.ApprovalStore;
import com.yoursp.faceapproval.service.storage.StorageMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes start and shutdown markers into the console log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SystemLifecycleAuditor {

    private final ApprovalStore store;
    private final AuditService auditService;

    @EventListener(ApplicationReadyEvent.class)
    public void onStarted() {
        String backend = store.mode() == StorageMode.DATABASE ? "DATABASE" : "IN-MEMORY";
        auditService.record("=== SYSTEM STARTED WITH " + backend + " STORAGE ===");
        log.info("Face approval service ready: storage={}", store.mode().label());
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        auditService.record("=== SYSTEM SHUTDOWN ===");
    }
}
