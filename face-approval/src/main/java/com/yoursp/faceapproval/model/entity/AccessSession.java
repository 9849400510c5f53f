package com.yoursp.faceapproval.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A live access grant issued after a successful match. Identity fields are a
 * snapshot taken at issue time; deleting the identity leaves the session alone.
 */
@Entity
@Table(name = "access_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AccessSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", unique = true, nullable = false, length = 64)
    private String sessionId;

    @Column(name = "name", unique = true, nullable = false, length = 200)
    private String name;

    @Column(name = "group_name", length = 100)
    private String groupName;

    @Column(name = "roll_id", length = 100)
    private String rollId;

    @Column(name = "access_code", length = 32)
    private String accessCode;

    @Column(name = "start_time", updatable = false)
    private OffsetDateTime startTime;

    @Column(name = "match_confidence")
    private double matchConfidence;

    @PrePersist
    protected void onCreate() {
        if (startTime == null)
            startTime = OffsetDateTime.now();
    }

    public AccessSession copy() {
        return toBuilder().build();
    }
}
