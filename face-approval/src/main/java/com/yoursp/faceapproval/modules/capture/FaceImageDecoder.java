package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Turns the {@code face_image} payload (base64, optionally data-URL prefixed)
 * into image bytes that are known to decode.
 */
@Component
@RequiredArgsConstructor
public class FaceImageDecoder {

    private static final String BASE64_MARKER = "base64,";

    private final FaceApprovalProperties properties;

    /**
     * @param payload raw request value
     * @return decoded image bytes
     * @throws ApprovalException {@code INVALID_INPUT} for empty or too-short
     *                           payloads, {@code DECODE_FAILURE} if the bytes are
     *                           not base64 or not an image
     */
    public byte[] decode(String payload) {
        // Cheap length guard before any decoding work.
        if (payload == null || payload.length() < properties.getCapture().getMinPayloadLength()) {
            throw ApprovalException.invalidInput("Invalid face data - image too small or empty");
        }

        int marker = payload.indexOf(BASE64_MARKER);
        String data = marker >= 0 ? payload.substring(marker + BASE64_MARKER.length()) : payload;

        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(data.trim());
        } catch (IllegalArgumentException e) {
            throw new ApprovalException(ApprovalErrorCode.DECODE_FAILURE,
                    "Image decoding error: " + e.getMessage(), e);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new ApprovalException(ApprovalErrorCode.DECODE_FAILURE,
                    "Image decoding error: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ApprovalException(ApprovalErrorCode.DECODE_FAILURE,
                    "Failed to decode image. Please try capturing again.");
        }
        return bytes;
    }
}
