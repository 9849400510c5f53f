package com.yoursp.faceapproval.modules.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yoursp.faceapproval.model.entity.Identity;

import java.time.OffsetDateTime;

/**
 * Admin listing row. The embedding is deliberately absent.
 */
public record IdentitySummary(
        String name,
        @JsonProperty("class") String groupName,
        @JsonProperty("roll") String rollId,
        @JsonProperty("code") String accessCode,
        @JsonProperty("registered_at") OffsetDateTime registeredAt) {

    public static IdentitySummary from(Identity identity) {
        return new IdentitySummary(identity.getName(), identity.getGroupName(), identity.getRollId(),
                identity.getAccessCode(), identity.getRegisteredAt());
    }
}
