package com.yoursp.faceapproval.repository;

import com.yoursp.faceapproval.model.entity.AccessSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccessSessionRepository extends JpaRepository<AccessSession, UUID> {

    Optional<AccessSession> findBySessionId(String sessionId);

    @Modifying
    @Transactional
    long deleteBySessionId(String sessionId);

    @Modifying
    @Transactional
    long deleteByName(String name);

    @Modifying
    @Transactional
    long deleteByStartTimeBefore(OffsetDateTime cutoff);
}
