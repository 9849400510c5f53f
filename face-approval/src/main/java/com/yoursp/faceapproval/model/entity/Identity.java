package com.yoursp.faceapproval.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A permanently enrolled subject. {@code name} is the logical key; the
 * embedding is written once at enrollment and never updated.
 */
@Entity
@Table(name = "registered_identities")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Identity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", unique = true, nullable = false, length = 200)
    private String name;

    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", columnDefinition = "TEXT", nullable = false, updatable = false)
    private double[] embedding;

    @Column(name = "group_name", length = 100)
    private String groupName;

    @Column(name = "roll_id", length = 100)
    private String rollId;

    @Column(name = "access_code", length = 32, nullable = false)
    private String accessCode;

    @Column(name = "image_preview", columnDefinition = "TEXT")
    private String imagePreview;

    @Column(name = "registered_at", updatable = false)
    private OffsetDateTime registeredAt;

    @PrePersist
    protected void onCreate() {
        if (registeredAt == null)
            registeredAt = OffsetDateTime.now();
    }

    /** Detached copy, embedding array included. */
    public Identity copy() {
        return toBuilder()
                .embedding(embedding != null ? embedding.clone() : null)
                .build();
    }
}
