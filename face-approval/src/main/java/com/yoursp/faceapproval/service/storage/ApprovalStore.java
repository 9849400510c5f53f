package com.yoursp.faceapproval.service.storage;

import com.yoursp.faceapproval.model.CaptureTicket;
import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.model.entity.ConsoleLog;
import com.yoursp.faceapproval.model.entity.Identity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Storage contract shared by the database-backed and in-memory backends.
 * <p>
 * Business code is written against this interface only. Implementations
 * report backend failures as
 * {@link com.yoursp.faceapproval.exception.StorageUnavailableException}.
 * Returned entities are detached: mutating them never changes stored state.
 * </p>
 */
public interface ApprovalStore {

    StorageMode mode();

    // ---- Identities ----

    Optional<Identity> findIdentity(String name);

    /** All identities in enrollment order. */
    List<Identity> findAllIdentities();

    /**
     * Insert the identity unless one with the same name exists. The check and
     * the insert form one atomic step.
     *
     * @return false if the name was already taken
     */
    boolean insertIdentityIfAbsent(Identity identity);

    /**
     * Rename and/or re-label an identity. The embedding is never touched.
     */
    IdentityUpdateResult updateIdentityMetadata(String oldName, String newName, String groupName,
            String rollId);

    /**
     * @return false if no identity had that name
     */
    boolean deleteIdentity(String name);

    // ---- Capture tickets ----

    /** Upsert: replaces any ticket already held for the same token. */
    void saveTicket(CaptureTicket ticket);

    /** Only returns tickets that have not yet expired. */
    Optional<CaptureTicket> findTicket(String sessionToken);

    /** Idempotent. */
    void deleteTicket(String sessionToken);

    /**
     * Consume the ticket held for {@code sessionToken} and insert the identity
     * built from it, as one step. A ticket can be enrolled at most once. When
     * the name is taken the ticket is left in place.
     *
     * @param identityFactory builds the identity from a complete ticket
     */
    EnrollmentOutcome enrollFromTicket(String sessionToken, Function<CaptureTicket, Identity> identityFactory);

    /**
     * Remove tickets created before {@code cutoff}. Backends with native expiry
     * return 0.
     */
    int purgeExpiredTickets(OffsetDateTime cutoff);

    // ---- Access sessions ----

    /**
     * Delete every session for {@code session.getName()} and store the new
     * one, as a single step.
     */
    void replaceSession(AccessSession session);

    Optional<AccessSession> findSession(String sessionId);

    /**
     * @return false if no session had that id
     */
    boolean deleteSession(String sessionId);

    int deleteSessionsForIdentity(String name);

    int deleteSessionsStartedBefore(OffsetDateTime cutoff);

    // ---- Console log ----

    /**
     * Append an entry, then evict the oldest entries beyond {@code retention}.
     */
    void appendLog(ConsoleLog entry, int retention);

    /** Formatted lines, most recent first, at most {@code limit}. */
    List<String> recentLogs(int limit);
}
