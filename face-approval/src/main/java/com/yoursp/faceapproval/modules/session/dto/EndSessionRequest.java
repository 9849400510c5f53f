package com.yoursp.faceapproval.modules.session.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class EndSessionRequest {

    @NotBlank(message = "session_id is required")
    @JsonProperty("session_id")
    @JsonAlias("sessionId")
    private String sessionId;
}
