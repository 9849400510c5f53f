package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.exception.StorageUnavailableException;
import com.yoursp.faceapproval.model.CaptureTicket;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import com.yoursp.faceapproval.service.storage.InMemoryApprovalStore;
import com.yoursp.faceapproval.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FaceCaptureServiceTest {

    @Mock
    private FaceEmbeddingService faceEmbeddingService;

    @Mock
    private AuditService auditService;

    private final FaceApprovalProperties properties = new FaceApprovalProperties();
    private MutableClock clock;
    private InMemoryApprovalStore store;
    private FaceCaptureService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        store = new InMemoryApprovalStore(clock, Duration.ofHours(1));
        service = new FaceCaptureService(faceEmbeddingService, store, auditService, properties, clock);
    }

    @Test
    @DisplayName("Capture stores a ticket with a bounded preview and audits an abbreviated token")
    void captureStoresTicket() {
        String payload = "A".repeat(2000);
        when(faceEmbeddingService.extractSingleEmbedding(payload, "registration"))
                .thenReturn(new double[] { 0.1, 0.2 });

        service.capture("0123456789abcdef0123456789abcdef", payload);

        CaptureTicket ticket = store.findTicket("0123456789abcdef0123456789abcdef").orElseThrow();
        assertEquals(500, ticket.imagePreview().length());
        assertTrue(ticket.isComplete());
        verify(auditService).record("Face captured and validated for registration (Session: 01234567...)");
    }

    @Test
    @DisplayName("Second capture on the same token replaces the first")
    void recaptureReplaces() {
        when(faceEmbeddingService.extractSingleEmbedding(anyString(), eq("registration")))
                .thenReturn(new double[] { 0.1 }, new double[] { 0.9 });

        service.capture("tok", "first-image");
        service.capture("tok", "second-image");

        assertEquals(0.9, store.findTicket("tok").orElseThrow().embedding()[0]);
    }

    @Test
    @DisplayName("Rejected image leaves no ticket behind")
    void rejectedImageStoresNothing() {
        when(faceEmbeddingService.extractSingleEmbedding(anyString(), anyString()))
                .thenThrow(new ApprovalException(ApprovalErrorCode.NO_FACE_DETECTED, "No face"));

        assertThrows(ApprovalException.class, () -> service.capture("tok", "image"));
        assertTrue(store.findTicket("tok").isEmpty());
    }

    @Test
    @DisplayName("Storage failure is audited and rethrown")
    void storageFailure() {
        ApprovalStore failing = mock(ApprovalStore.class);
        doThrow(new StorageUnavailableException("redis down")).when(failing).saveTicket(any());
        when(faceEmbeddingService.extractSingleEmbedding(anyString(), anyString())).thenReturn(new double[] { 0.1 });
        FaceCaptureService failingService = new FaceCaptureService(faceEmbeddingService, failing, auditService,
                properties, clock);

        assertThrows(StorageUnavailableException.class, () -> failingService.capture("tok", "image"));
        verify(auditService).record("ERROR: Face capture failed - redis down");
    }

    @Test
    @DisplayName("Clear removes the ticket and is fine when nothing is held")
    void clear() {
        when(faceEmbeddingService.extractSingleEmbedding(anyString(), anyString())).thenReturn(new double[] { 0.1 });
        service.capture("tok", "image");

        service.clear("tok");
        service.clear("tok");

        assertTrue(store.findTicket("tok").isEmpty());
    }
}
