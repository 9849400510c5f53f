package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.modules.capture.dto.FaceImageRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Registration capture endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/capture-face: validate a face and hold it for enrollment</li>
 * <li>POST /api/clear-face: discard the held face</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CaptureController {

    private final FaceCaptureService captureService;

    @PostMapping("/capture-face")
    public ResponseEntity<Map<String, Object>> captureFace(@RequestBody FaceImageRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse response) {
        String sessionToken = CaptureSessionCookie.readOrCreate(httpRequest);
        captureService.capture(sessionToken, request.getFaceImage());
        CaptureSessionCookie.write(response, sessionToken);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Face captured and validated successfully"));
    }

    @PostMapping("/clear-face")
    public ResponseEntity<Map<String, Object>> clearFace(HttpServletRequest httpRequest) {
        String sessionToken = CaptureSessionCookie.read(httpRequest);
        if (sessionToken != null) {
            captureService.clear(sessionToken);
        }
        return ResponseEntity.ok(Map.of("success", true, "message", "Face data cleared"));
    }
}
