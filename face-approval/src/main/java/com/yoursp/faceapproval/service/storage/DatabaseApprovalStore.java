package com.yoursp.faceapproval.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.faceapproval.exception.StorageUnavailableException;
import com.yoursp.faceapproval.model.CaptureTicket;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.model.entity.ConsoleLog;
import com.yoursp.faceapproval.model.entity.Identity;
import com.yoursp.faceapproval.repository.AccessSessionRepository;
import com.yoursp.faceapproval.repository.ConsoleLogRepository;
import com.yoursp.faceapproval.repository.IdentityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Durable backend.
 * <ul>
 * <li>Identities, sessions and the console log live in PostgreSQL; unique
 * indexes on identity name, session id and session name back the
 * uniqueness rules</li>
 * <li>Capture tickets live in Redis under {@code capture_ticket:<token>} with
 * a native TTL, so no sweep is needed</li>
 * <li>Every {@link DataAccessException} is surfaced as
 * {@link StorageUnavailableException}</li>
 * </ul>
 */
@Slf4j
@SuppressWarnings("null")
public class DatabaseApprovalStore implements ApprovalStore {

    static final String TICKET_KEY_PREFIX = "capture_ticket:";

    private final IdentityRepository identityRepository;
    private final AccessSessionRepository sessionRepository;
    private final ConsoleLogRepository consoleLogRepository;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Duration ticketTtl;
    private final Clock clock;

    public DatabaseApprovalStore(IdentityRepository identityRepository,
            AccessSessionRepository sessionRepository,
            ConsoleLogRepository consoleLogRepository,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            TransactionTemplate transactionTemplate,
            Duration ticketTtl,
            Clock clock) {
        this.identityRepository = identityRepository;
        this.sessionRepository = sessionRepository;
        this.consoleLogRepository = consoleLogRepository;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.ticketTtl = ticketTtl;
        this.clock = clock;
    }

    @Override
    public StorageMode mode() {
        return StorageMode.DATABASE;
    }

    // ================================================================
    // Identities
    // ================================================================

    @Override
    public Optional<Identity> findIdentity(String name) {
        return call("find identity", () -> identityRepository.findByName(name));
    }

    @Override
    public List<Identity> findAllIdentities() {
        return call("list identities", identityRepository::findAllByOrderByRegisteredAtAscIdAsc);
    }

    @Override
    public boolean insertIdentityIfAbsent(Identity identity) {
        return call("insert identity", () -> {
            if (identityRepository.existsByName(identity.getName())) {
                return false;
            }
            try {
                identityRepository.saveAndFlush(identity);
                return true;
            } catch (DataIntegrityViolationException e) {
                // Lost the race to a concurrent insert of the same name.
                log.debug("Unique constraint rejected identity name={}", identity.getName());
                return false;
            }
        });
    }

    @Override
    public IdentityUpdateResult updateIdentityMetadata(String oldName, String newName, String groupName,
            String rollId) {
        return call("update identity", () -> {
            if (!identityRepository.existsByName(oldName)) {
                return IdentityUpdateResult.NOT_FOUND;
            }
            if (!oldName.equals(newName) && identityRepository.existsByName(newName)) {
                return IdentityUpdateResult.NAME_TAKEN;
            }
            try {
                int updated = identityRepository.updateMetadata(oldName, newName, groupName, rollId);
                return updated == 0 ? IdentityUpdateResult.NOT_FOUND : IdentityUpdateResult.UPDATED;
            } catch (DataIntegrityViolationException e) {
                return IdentityUpdateResult.NAME_TAKEN;
            }
        });
    }

    @Override
    public boolean deleteIdentity(String name) {
        return call("delete identity", () -> identityRepository.deleteByName(name) > 0);
    }

    // ================================================================
    // Capture tickets (Redis)
    // ================================================================

    @Override
    public void saveTicket(CaptureTicket ticket) {
        String json;
        try {
            json = objectMapper.writeValueAsString(ticket);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Failed to serialize capture ticket", e);
        }
        run("save ticket", () -> redisTemplate.opsForValue()
                .set(ticketKey(ticket.sessionToken()), json, ticketTtl));
    }

    @Override
    public Optional<CaptureTicket> findTicket(String sessionToken) {
        String json = call("find ticket", () -> redisTemplate.opsForValue().get(ticketKey(sessionToken)));
        return json == null ? Optional.empty() : Optional.of(readTicket(json));
    }

    @Override
    public void deleteTicket(String sessionToken) {
        run("delete ticket", () -> redisTemplate.delete(ticketKey(sessionToken)));
    }

    /**
     * GETDEL claims the ticket, so concurrent callers on one token see it at
     * most once. If the identity is not stored the ticket is put back with
     * its remaining TTL.
     */
    @Override
    public EnrollmentOutcome enrollFromTicket(String sessionToken,
            Function<CaptureTicket, Identity> identityFactory) {
        String key = ticketKey(sessionToken);
        String json = call("claim ticket", () -> redisTemplate.opsForValue().getAndDelete(key));
        if (json == null) {
            return EnrollmentOutcome.MISSING_CAPTURE;
        }
        CaptureTicket ticket = readTicket(json);
        if (!ticket.isComplete()) {
            return EnrollmentOutcome.MISSING_CAPTURE;
        }

        boolean inserted;
        try {
            inserted = insertIdentityIfAbsent(identityFactory.apply(ticket));
        } catch (RuntimeException e) {
            restoreTicket(key, json, ticket, e);
            throw e;
        }
        if (!inserted) {
            restoreTicket(key, json, ticket, null);
            return EnrollmentOutcome.NAME_TAKEN;
        }
        return EnrollmentOutcome.ENROLLED;
    }

    @Override
    public int purgeExpiredTickets(OffsetDateTime cutoff) {
        return 0;
    }

    // ================================================================
    // Access sessions
    // ================================================================

    @Override
    public void replaceSession(AccessSession session) {
        run("replace session", () -> {
            try {
                replaceSessionOnce(session);
            } catch (DataIntegrityViolationException e) {
                // A concurrent approval for the same name committed between our delete and insert.
                log.debug("Session name collision for name={}, retrying replace", session.getName());
                replaceSessionOnce(session);
            }
        });
    }

    private void replaceSessionOnce(AccessSession session) {
        AccessSession fresh = session.copy();
        fresh.setId(null);
        transactionTemplate.executeWithoutResult(status -> {
            sessionRepository.deleteByName(session.getName());
            // Hibernate orders inserts before deletes; flush so the unique name index is free.
            sessionRepository.flush();
            sessionRepository.saveAndFlush(fresh);
        });
    }

    @Override
    public Optional<AccessSession> findSession(String sessionId) {
        return call("find session", () -> sessionRepository.findBySessionId(sessionId));
    }

    @Override
    public boolean deleteSession(String sessionId) {
        return call("delete session", () -> sessionRepository.deleteBySessionId(sessionId) > 0);
    }

    @Override
    public int deleteSessionsForIdentity(String name) {
        return call("delete sessions", () -> (int) sessionRepository.deleteByName(name));
    }

    @Override
    public int deleteSessionsStartedBefore(OffsetDateTime cutoff) {
        return call("expire sessions", () -> (int) sessionRepository.deleteByStartTimeBefore(cutoff));
    }

    // ================================================================
    // Console log
    // ================================================================

    @Override
    public void appendLog(ConsoleLog entry, int retention) {
        run("append log", () -> transactionTemplate.executeWithoutResult(status -> {
            consoleLogRepository.save(entry);
            long count = consoleLogRepository.count();
            if (count > retention) {
                int excess = (int) (count - retention);
                List<ConsoleLog> oldest = consoleLogRepository
                        .findAllByOrderByTimestampAscIdAsc(PageRequest.of(0, excess));
                for (ConsoleLog old : oldest) {
                    consoleLogRepository.deleteById(old.getId());
                }
            }
        }));
    }

    @Override
    public List<String> recentLogs(int limit) {
        return call("read logs", () -> consoleLogRepository
                .findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, limit))
                .stream()
                .map(ConsoleLog::getFormatted)
                .toList());
    }

    // ================================================================
    // Helpers
    // ================================================================

    private static String ticketKey(String sessionToken) {
        return TICKET_KEY_PREFIX + sessionToken;
    }

    private CaptureTicket readTicket(String json) {
        try {
            return objectMapper.readValue(json, CaptureTicket.class);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Stored capture ticket is unreadable", e);
        }
    }

    /**
     * Put a claimed ticket back. A restore failure is attached to
     * {@code failure} when there is one, otherwise it is raised.
     */
    private void restoreTicket(String key, String json, CaptureTicket ticket, RuntimeException failure) {
        Duration remaining = ticket.createdAt() == null ? ticketTtl
                : Duration.between(OffsetDateTime.now(clock), ticket.createdAt().plus(ticketTtl));
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, json, remaining);
        } catch (DataAccessException e) {
            if (failure == null) {
                log.error("Capture ticket restore failed: error={}", e.getMessage());
                throw new StorageUnavailableException("Storage unavailable during restore ticket", e);
            }
            failure.addSuppressed(e);
            log.error("Capture ticket restore failed after enrollment error", failure);
        }
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Storage call failed: operation={}, error={}", operation, e.getMessage());
            throw new StorageUnavailableException("Storage unavailable during " + operation, e);
        }
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
