package com.yoursp.faceapproval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;

/**
 * Ephemeral holder of one captured, not-yet-enrolled face, keyed by the
 * capture session token. Serialized as JSON when kept in Redis.
 *
 * @param sessionToken opaque token from the {@code session_id} cookie
 * @param imagePreview bounded prefix of the raw payload, never used for matching
 * @param embedding    face embedding produced by the extractor
 * @param createdAt    capture time, the TTL is measured from here
 */
public record CaptureTicket(String sessionToken, String imagePreview, double[] embedding,
        OffsetDateTime createdAt) {

    @JsonIgnore
    public boolean isComplete() {
        return imagePreview != null && !imagePreview.isEmpty()
                && embedding != null && embedding.length > 0;
    }
}
