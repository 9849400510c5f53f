package com.yoursp.faceapproval.modules.session;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.modules.capture.FaceCaptureService;
import com.yoursp.faceapproval.modules.capture.FaceEmbeddingService;
import com.yoursp.faceapproval.modules.capture.FaceImageDecoder;
import com.yoursp.faceapproval.modules.enrollment.EnrollmentService;
import com.yoursp.faceapproval.modules.enrollment.dto.EnrollmentResult;
import com.yoursp.faceapproval.modules.extractor.FaceDetection;
import com.yoursp.faceapproval.modules.extractor.FeatureExtractor;
import com.yoursp.faceapproval.modules.matcher.EmbeddingMatcher;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.storage.InMemoryApprovalStore;
import com.yoursp.faceapproval.support.MutableClock;
import com.yoursp.faceapproval.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Capture, enroll and approve against the in-memory store with a scripted
 * extractor.
 */
@ExtendWith(MockitoExtension.class)
class ApprovalServiceTest {

    private static final double[] ALICE = { 0.10, 0.20, 0.30, 0.40 };
    private static final double[] ALICE_LIVE = { 0.12, 0.21, 0.29, 0.41 };
    private static final double[] STRANGER = { 0.90, -0.50, 0.70, -0.20 };

    @Mock
    private FeatureExtractor featureExtractor;

    private final FaceApprovalProperties properties = new FaceApprovalProperties();
    private InMemoryApprovalStore store;
    private AuditService auditService;
    private FaceCaptureService captureService;
    private EnrollmentService enrollmentService;
    private ApprovalService approvalService;
    private AccessSessionService sessionService;
    private String image;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        store = new InMemoryApprovalStore(clock, Duration.ofHours(1));
        auditService = new AuditService(store, properties, clock);
        FaceEmbeddingService embeddingService = new FaceEmbeddingService(
                new FaceImageDecoder(properties), featureExtractor, auditService);
        captureService = new FaceCaptureService(embeddingService, store, auditService, properties, clock);
        enrollmentService = new EnrollmentService(store, auditService, clock);
        sessionService = new AccessSessionService(store, auditService, properties, clock);
        approvalService = new ApprovalService(embeddingService, new EmbeddingMatcher(properties),
                sessionService, store, auditService);
        image = TestImages.pngBase64();
    }

    @Test
    @DisplayName("Enrolled face is approved with its metadata and a high confidence")
    void enrolledFaceApproved() {
        EnrollmentResult enrolled = enrollAlice();
        scriptFaces(ALICE_LIVE);

        AccessSession session = approvalService.approve(image);

        assertEquals("alice", session.getName());
        assertEquals("10-A", session.getGroupName());
        assertEquals("R-1", session.getRollId());
        assertEquals(enrolled.accessCode(), session.getAccessCode());
        assertTrue(session.getMatchConfidence() >= 90.0);
        assertEquals("alice", sessionService.get(session.getSessionId()).getName());
        assertTrue(auditService.recentEntries().get(0).contains("APPROVAL SUCCESS: alice"));
    }

    @Test
    @DisplayName("Unknown face → NO_MATCH, audited, no session")
    void unknownFaceDenied() {
        enrollAlice();
        scriptFaces(STRANGER);

        ApprovalException ex = assertThrows(ApprovalException.class, () -> approvalService.approve(image));

        assertEquals(ApprovalErrorCode.NO_MATCH, ex.getCode());
        assertTrue(auditService.recentEntries().get(0).endsWith("APPROVAL DENIED: Face not recognized"));
    }

    @Test
    @DisplayName("Empty registry → NO_MATCH")
    void emptyRegistry() {
        scriptFaces(ALICE);

        assertEquals(ApprovalErrorCode.NO_MATCH,
                assertThrows(ApprovalException.class, () -> approvalService.approve(image)).getCode());
    }

    @Test
    @DisplayName("Two faces in frame → MULTIPLE_FACES_DETECTED and no session is created")
    void multipleFacesRejected() {
        enrollAlice();
        scriptFaces(ALICE, STRANGER);

        ApprovalException ex = assertThrows(ApprovalException.class, () -> approvalService.approve(image));

        assertEquals(ApprovalErrorCode.MULTIPLE_FACES_DETECTED, ex.getCode());
        assertFalse(auditService.recentEntries().stream().anyMatch(e -> e.contains("APPROVAL SUCCESS")));
    }

    @Test
    @DisplayName("Approving twice replaces the earlier session")
    void secondApprovalReplacesSession() {
        enrollAlice();
        scriptFaces(ALICE_LIVE);

        AccessSession first = approvalService.approve(image);
        AccessSession second = approvalService.approve(image);

        assertTrue(store.findSession(first.getSessionId()).isEmpty());
        assertTrue(store.findSession(second.getSessionId()).isPresent());
    }

    private EnrollmentResult enrollAlice() {
        scriptFaces(ALICE);
        captureService.capture("capture-token", image);
        return enrollmentService.enroll("capture-token", "alice", "10-A", "R-1");
    }

    private void scriptFaces(double[]... embeddings) {
        when(featureExtractor.detect(any())).thenReturn(new FaceDetection(embeddings.length, List.of(embeddings)));
    }
}
