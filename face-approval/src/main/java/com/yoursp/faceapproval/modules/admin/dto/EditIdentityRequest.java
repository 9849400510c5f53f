package com.yoursp.faceapproval.modules.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class EditIdentityRequest {

    @NotBlank(message = "old_name is required")
    @JsonProperty("old_name")
    private String oldName;

    private String name;

    @JsonProperty("class")
    private String groupName;

    @JsonProperty("roll")
    private String rollId;
}
