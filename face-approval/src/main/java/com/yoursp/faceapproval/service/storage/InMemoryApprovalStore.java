package com.yoursp.faceapproval.service.storage;

import com.yoursp.faceapproval.model.CaptureTicket;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.model.entity.ConsoleLog;
import com.yoursp.faceapproval.model.entity.Identity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Process-local fallback used when the database or Redis is unreachable at
 * start-up. Nothing survives a restart.
 * <ul>
 * <li>All collections are guarded by one monitor, so name uniqueness, ticket
 * consumption and the session replace are atomic here as well</li>
 * <li>Ticket TTL is checked on every read; {@link #purgeExpiredTickets}
 * reclaims memory</li>
 * <li>Entities are copied on the way in and out</li>
 * </ul>
 */
@Slf4j
public class InMemoryApprovalStore implements ApprovalStore {

    private final Object lock = new Object();

    private final Map<String, Identity> identities = new LinkedHashMap<>();
    private final Map<String, CaptureTicket> tickets = new HashMap<>();
    private final Map<String, AccessSession> sessions = new LinkedHashMap<>();
    private final Deque<ConsoleLog> logs = new ArrayDeque<>();

    private final Clock clock;
    private final Duration ticketTtl;

    public InMemoryApprovalStore(Clock clock, Duration ticketTtl) {
        this.clock = clock;
        this.ticketTtl = ticketTtl;
        log.warn("In-memory storage active: data will be lost on restart");
    }

    @Override
    public StorageMode mode() {
        return StorageMode.IN_MEMORY;
    }

    // ================================================================
    // Identities
    // ================================================================

    @Override
    public Optional<Identity> findIdentity(String name) {
        synchronized (lock) {
            return Optional.ofNullable(identities.get(name)).map(Identity::copy);
        }
    }

    @Override
    public List<Identity> findAllIdentities() {
        synchronized (lock) {
            return identities.values().stream().map(Identity::copy).toList();
        }
    }

    @Override
    public boolean insertIdentityIfAbsent(Identity identity) {
        synchronized (lock) {
            return insertLocked(identity);
        }
    }

    @Override
    public IdentityUpdateResult updateIdentityMetadata(String oldName, String newName, String groupName,
            String rollId) {
        synchronized (lock) {
            Identity current = identities.get(oldName);
            if (current == null) {
                return IdentityUpdateResult.NOT_FOUND;
            }
            if (!oldName.equals(newName) && identities.containsKey(newName)) {
                return IdentityUpdateResult.NAME_TAKEN;
            }
            Identity updated = current.toBuilder()
                    .name(newName)
                    .groupName(groupName)
                    .rollId(rollId)
                    .build();

            // Rebuild so a rename keeps the identity's enrollment position.
            Map<String, Identity> reordered = new LinkedHashMap<>();
            for (Map.Entry<String, Identity> e : identities.entrySet()) {
                if (e.getKey().equals(oldName)) {
                    reordered.put(newName, updated);
                } else {
                    reordered.put(e.getKey(), e.getValue());
                }
            }
            identities.clear();
            identities.putAll(reordered);
            return IdentityUpdateResult.UPDATED;
        }
    }

    @Override
    public boolean deleteIdentity(String name) {
        synchronized (lock) {
            return identities.remove(name) != null;
        }
    }

    // ================================================================
    // Capture tickets
    // ================================================================

    @Override
    public void saveTicket(CaptureTicket ticket) {
        synchronized (lock) {
            tickets.put(ticket.sessionToken(), detach(ticket));
        }
    }

    @Override
    public Optional<CaptureTicket> findTicket(String sessionToken) {
        synchronized (lock) {
            return Optional.ofNullable(liveTicketLocked(sessionToken)).map(InMemoryApprovalStore::detach);
        }
    }

    @Override
    public void deleteTicket(String sessionToken) {
        synchronized (lock) {
            tickets.remove(sessionToken);
        }
    }

    @Override
    public EnrollmentOutcome enrollFromTicket(String sessionToken,
            Function<CaptureTicket, Identity> identityFactory) {
        synchronized (lock) {
            CaptureTicket ticket = liveTicketLocked(sessionToken);
            if (ticket == null || !ticket.isComplete()) {
                return EnrollmentOutcome.MISSING_CAPTURE;
            }
            if (!insertLocked(identityFactory.apply(detach(ticket)))) {
                return EnrollmentOutcome.NAME_TAKEN;
            }
            tickets.remove(sessionToken);
            return EnrollmentOutcome.ENROLLED;
        }
    }

    @Override
    public int purgeExpiredTickets(OffsetDateTime cutoff) {
        synchronized (lock) {
            int removed = 0;
            Iterator<CaptureTicket> it = tickets.values().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next(), cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        }
    }

    // ================================================================
    // Access sessions
    // ================================================================

    @Override
    public void replaceSession(AccessSession session) {
        synchronized (lock) {
            sessions.values().removeIf(s -> s.getName().equals(session.getName()));
            AccessSession stored = session.copy();
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID());
            }
            if (stored.getStartTime() == null) {
                stored.setStartTime(OffsetDateTime.now(clock));
            }
            sessions.put(stored.getSessionId(), stored);
        }
    }

    @Override
    public Optional<AccessSession> findSession(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(sessionId)).map(AccessSession::copy);
        }
    }

    @Override
    public boolean deleteSession(String sessionId) {
        synchronized (lock) {
            return sessions.remove(sessionId) != null;
        }
    }

    @Override
    public int deleteSessionsForIdentity(String name) {
        synchronized (lock) {
            int before = sessions.size();
            sessions.values().removeIf(s -> s.getName().equals(name));
            return before - sessions.size();
        }
    }

    @Override
    public int deleteSessionsStartedBefore(OffsetDateTime cutoff) {
        synchronized (lock) {
            int before = sessions.size();
            sessions.values().removeIf(s -> s.getStartTime().isBefore(cutoff));
            return before - sessions.size();
        }
    }

    // ================================================================
    // Console log
    // ================================================================

    @Override
    public void appendLog(ConsoleLog entry, int retention) {
        synchronized (lock) {
            logs.addLast(entry);
            while (logs.size() > retention) {
                logs.removeFirst();
            }
        }
    }

    @Override
    public List<String> recentLogs(int limit) {
        synchronized (lock) {
            List<String> lines = new ArrayList<>(Math.min(limit, logs.size()));
            Iterator<ConsoleLog> it = logs.descendingIterator();
            while (it.hasNext() && lines.size() < limit) {
                lines.add(it.next().getFormatted());
            }
            return lines;
        }
    }

    // ================================================================
    // Helpers
    // ================================================================

    private boolean insertLocked(Identity identity) {
        if (identities.containsKey(identity.getName())) {
            return false;
        }
        Identity stored = identity.copy();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID());
        }
        if (stored.getRegisteredAt() == null) {
            stored.setRegisteredAt(OffsetDateTime.now(clock));
        }
        identities.put(stored.getName(), stored);
        return true;
    }

    /** Unexpired ticket or null; drops the entry if it has expired. */
    private CaptureTicket liveTicketLocked(String sessionToken) {
        CaptureTicket ticket = tickets.get(sessionToken);
        if (ticket != null && isExpired(ticket, OffsetDateTime.now(clock).minus(ticketTtl))) {
            tickets.remove(sessionToken);
            return null;
        }
        return ticket;
    }

    private static boolean isExpired(CaptureTicket ticket, OffsetDateTime cutoff) {
        return !ticket.createdAt().isAfter(cutoff);
    }

    private static CaptureTicket detach(CaptureTicket ticket) {
        double[] embedding = ticket.embedding() != null ? ticket.embedding().clone() : null;
        return new CaptureTicket(ticket.sessionToken(), ticket.imagePreview(), embedding, ticket.createdAt());
    }
}
