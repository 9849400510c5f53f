package com.yoursp.faceapproval.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.StorageUnavailableException;
import com.yoursp.faceapproval.model.CaptureTicket;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.model.entity.ConsoleLog;
import com.yoursp.faceapproval.model.entity.Identity;
import com.yoursp.faceapproval.repository.AccessSessionRepository;
import com.yoursp.faceapproval.repository.ConsoleLogRepository;
import com.yoursp.faceapproval.repository.IdentityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseApprovalStoreTest {

    @Mock
    private IdentityRepository identityRepository;

    @Mock
    private AccessSessionRepository sessionRepository;

    @Mock
    private ConsoleLogRepository consoleLogRepository;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private TransactionTemplate transactionTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DatabaseApprovalStore store;

    @BeforeEach
    void setUp() {
        objectMapper.findAndRegisterModules();
        store = new DatabaseApprovalStore(identityRepository, sessionRepository, consoleLogRepository,
                redisTemplate, objectMapper, transactionTemplate, Duration.ofHours(1),
                Clock.fixed(Instant.parse("2024-05-01T08:10:00Z"), ZoneOffset.UTC));
    }

    private void runTransactionsInline() {
        doAnswer(invocation -> {
            Consumer<TransactionStatus> callback = invocation.getArgument(0);
            callback.accept(null);
            return null;
        }).when(transactionTemplate).executeWithoutResult(any());
    }

    // ================================================================
    // Identities
    // ================================================================

    @Test
    @DisplayName("insertIdentityIfAbsent returns false when the name exists")
    void insertRejectsExistingName() {
        when(identityRepository.existsByName("alice")).thenReturn(true);

        assertFalse(store.insertIdentityIfAbsent(Identity.builder().name("alice").build()));
        verify(identityRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("insertIdentityIfAbsent treats a unique-constraint violation as a lost race")
    void insertLosesRace() {
        Identity identity = Identity.builder().name("alice").build();
        when(identityRepository.existsByName("alice")).thenReturn(false);
        when(identityRepository.saveAndFlush(identity))
                .thenThrow(new DataIntegrityViolationException("ux_registered_identities_name"));

        assertFalse(store.insertIdentityIfAbsent(identity));
    }

    @Test
    @DisplayName("Rename onto an existing name is refused before any update")
    void renameCollision() {
        when(identityRepository.existsByName("alice")).thenReturn(true);
        when(identityRepository.existsByName("bob")).thenReturn(true);

        assertEquals(IdentityUpdateResult.NAME_TAKEN,
                store.updateIdentityMetadata("alice", "bob", "10-A", "R-1"));
        verify(identityRepository, never()).updateMetadata(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Database failures surface as STORAGE_UNAVAILABLE")
    void databaseFailureWrapped() {
        when(identityRepository.findAllByOrderByRegisteredAtAscIdAsc())
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class,
                () -> store.findAllIdentities());
        assertEquals(ApprovalErrorCode.STORAGE_UNAVAILABLE, ex.getCode());
    }

    // ================================================================
    // Capture tickets
    // ================================================================

    @Test
    @DisplayName("saveTicket writes JSON under capture_ticket:<token> with the configured TTL")
    void saveTicketUsesTtl() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        CaptureTicket ticket = new CaptureTicket("tok-1", "preview", new double[] { 0.25, 0.5 },
                OffsetDateTime.of(2024, 5, 1, 8, 0, 0, 0, ZoneOffset.UTC));

        store.saveTicket(ticket);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("capture_ticket:tok-1"), json.capture(), eq(Duration.ofHours(1)));

        CaptureTicket stored = objectMapper.readValue(json.getValue(), CaptureTicket.class);
        assertEquals("preview", stored.imagePreview());
        assertArrayEquals(new double[] { 0.25, 0.5 }, stored.embedding());
        assertFalse(json.getValue().contains("complete"));
    }

    @Test
    @DisplayName("findTicket returns empty when Redis has no key")
    void findTicketMissing() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("capture_ticket:tok-1")).thenReturn(null);

        assertTrue(store.findTicket("tok-1").isEmpty());
    }

    @Test
    @DisplayName("Redis failures surface as STORAGE_UNAVAILABLE")
    void redisFailureWrapped() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThrows(StorageUnavailableException.class, () -> store.findTicket("tok-1"));
    }

    @Test
    @DisplayName("enrollFromTicket claims the ticket with GETDEL and inserts the identity")
    void enrollClaimsTicket() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.getAndDelete("capture_ticket:tok-1")).thenReturn(ticketJson());
        when(identityRepository.existsByName("alice")).thenReturn(false);

        EnrollmentOutcome outcome = store.enrollFromTicket("tok-1",
                ticket -> Identity.builder().name("alice").embedding(ticket.embedding()).build());

        assertEquals(EnrollmentOutcome.ENROLLED, outcome);
        verify(identityRepository).saveAndFlush(argThat((Identity i) -> i.getEmbedding()[1] == 0.5));
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("enrollFromTicket reports a missing capture when another caller already claimed it")
    void enrollTicketAlreadyClaimed() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.getAndDelete("capture_ticket:tok-1")).thenReturn(null);

        assertEquals(EnrollmentOutcome.MISSING_CAPTURE,
                store.enrollFromTicket("tok-1", ticket -> Identity.builder().name("alice").build()));
        verifyNoInteractions(identityRepository);
    }

    @Test
    @DisplayName("enrollFromTicket puts the ticket back with its remaining TTL when the name is taken")
    void enrollNameTakenRestoresTicket() throws Exception {
        String json = ticketJson();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.getAndDelete("capture_ticket:tok-1")).thenReturn(json);
        when(identityRepository.existsByName("alice")).thenReturn(true);

        assertEquals(EnrollmentOutcome.NAME_TAKEN,
                store.enrollFromTicket("tok-1", ticket -> Identity.builder().name("alice").build()));
        verify(valueOperations).set("capture_ticket:tok-1", json, Duration.ofMinutes(50));
    }

    @Test
    @DisplayName("A failed ticket restore is attached to the original insert failure")
    void enrollRestoreFailureKeepsOriginalError() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.getAndDelete("capture_ticket:tok-1")).thenReturn(ticketJson());
        when(identityRepository.existsByName("alice"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class,
                () -> store.enrollFromTicket("tok-1", ticket -> Identity.builder().name("alice").build()));

        assertEquals("Storage unavailable during insert identity", ex.getMessage());
        assertEquals(1, ex.getSuppressed().length);
        assertInstanceOf(RedisConnectionFailureException.class, ex.getSuppressed()[0]);
    }

    @Test
    @DisplayName("Redis expires tickets itself, so the sweep has nothing to do")
    void purgeIsNoop() {
        assertEquals(0, store.purgeExpiredTickets(OffsetDateTime.now()));
        verifyNoInteractions(redisTemplate);
    }

    private String ticketJson() throws Exception {
        return objectMapper.writeValueAsString(new CaptureTicket("tok-1", "preview", new double[] { 0.25, 0.5 },
                OffsetDateTime.of(2024, 5, 1, 8, 0, 0, 0, ZoneOffset.UTC)));
    }

    // ================================================================
    // Sessions and log
    // ================================================================

    @Test
    @DisplayName("replaceSession deletes the identity's session, flushes, then inserts in one transaction")
    void replaceSessionOrder() {
        runTransactionsInline();
        AccessSession session = AccessSession.builder().sessionId("s-1").name("alice").build();

        store.replaceSession(session);

        InOrder inOrder = inOrder(sessionRepository);
        inOrder.verify(sessionRepository).deleteByName("alice");
        inOrder.verify(sessionRepository).flush();
        inOrder.verify(sessionRepository).saveAndFlush(argThat((AccessSession s) -> "s-1".equals(s.getSessionId())));
    }

    @Test
    @DisplayName("replaceSession retries once when a concurrent approval took the name index")
    void replaceSessionRetriesOnNameCollision() {
        runTransactionsInline();
        when(sessionRepository.saveAndFlush(any(AccessSession.class)))
                .thenThrow(new DataIntegrityViolationException("ux_access_sessions_name"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        store.replaceSession(AccessSession.builder().sessionId("s-2").name("alice").build());

        verify(sessionRepository, times(2)).deleteByName("alice");
        verify(sessionRepository, times(2)).saveAndFlush(any(AccessSession.class));
    }

    @Test
    @DisplayName("replaceSession gives up after the retry and reports STORAGE_UNAVAILABLE")
    void replaceSessionRetryExhausted() {
        runTransactionsInline();
        when(sessionRepository.saveAndFlush(any(AccessSession.class)))
                .thenThrow(new DataIntegrityViolationException("ux_access_sessions_name"));

        assertThrows(StorageUnavailableException.class,
                () -> store.replaceSession(AccessSession.builder().sessionId("s-2").name("alice").build()));
        verify(sessionRepository, times(2)).saveAndFlush(any(AccessSession.class));
    }

    @Test
    @DisplayName("appendLog prunes the oldest rows beyond retention")
    void appendLogPrunes() {
        runTransactionsInline();
        ConsoleLog oldest = ConsoleLog.builder().id(1L).formatted("old").build();
        when(consoleLogRepository.count()).thenReturn(101L);
        when(consoleLogRepository.findAllByOrderByTimestampAscIdAsc(any(Pageable.class)))
                .thenReturn(List.of(oldest));

        store.appendLog(ConsoleLog.builder().formatted("new").build(), 100);

        verify(consoleLogRepository).deleteById(1L);
        verify(transactionTemplate).executeWithoutResult(any());
    }

    @Test
    @DisplayName("findSession delegates to the repository")
    void findSession() {
        AccessSession session = AccessSession.builder().sessionId("s-1").name("alice").build();
        when(sessionRepository.findBySessionId("s-1")).thenReturn(Optional.of(session));

        assertEquals("alice", store.findSession("s-1").orElseThrow().getName());
        assertEquals(StorageMode.DATABASE, store.mode());
    }
}
