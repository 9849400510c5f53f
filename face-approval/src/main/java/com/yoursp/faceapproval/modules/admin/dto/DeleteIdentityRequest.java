package com.yoursp.faceapproval.modules.admin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class DeleteIdentityRequest {

    @NotBlank(message = "name is required")
    private String name;
}
