package com.yoursp.faceapproval.modules.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class RegisterEntryRequest {

    private String name;

    @JsonProperty("class")
    private String groupName;

    @JsonProperty("roll")
    private String rollId;
}
