package com.yoursp.faceapproval.modules.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yoursp.faceapproval.model.entity.AccessSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

@Getter
@Builder
@AllArgsConstructor
public class SessionResponse {

    @JsonProperty("session_id")
    private final String sessionId;

    private final String name;

    @JsonProperty("class")
    private final String groupName;

    @JsonProperty("roll")
    private final String rollId;

    @JsonProperty("code")
    private final String accessCode;

    @JsonProperty("start_time")
    private final OffsetDateTime startTime;

    @JsonProperty("match_confidence")
    private final double matchConfidence;

    public static SessionResponse from(AccessSession session) {
        return SessionResponse.builder()
                .sessionId(session.getSessionId())
                .name(session.getName())
                .groupName(session.getGroupName())
                .rollId(session.getRollId())
                .accessCode(session.getAccessCode())
                .startTime(session.getStartTime())
                .matchConfidence(session.getMatchConfidence())
                .build();
    }
}
