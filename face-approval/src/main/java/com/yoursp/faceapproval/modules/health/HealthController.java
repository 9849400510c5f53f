package com.yoursp.faceapproval.modules.health;

import com.yoursp.faceapproval.service.storage.ApprovalStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Liveness endpoint. Reports which storage backend was selected at start-up.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ApprovalStore store;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "storage", store.mode().label(),
                "timestamp", OffsetDateTime.now(clock).toString()));
    }
}
