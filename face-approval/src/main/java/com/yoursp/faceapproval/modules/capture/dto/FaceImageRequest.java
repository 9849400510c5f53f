package com.yoursp.faceapproval.modules.capture.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body of capture-face and approve-face. Length and format are checked by
 * {@link com.yoursp.faceapproval.modules.capture.FaceImageDecoder} so that a
 * bad payload is audited like any other rejection.
 */
@Getter
@Setter
@NoArgsConstructor
public class FaceImageRequest {

    @JsonProperty("face_image")
    private String faceImage;
}
