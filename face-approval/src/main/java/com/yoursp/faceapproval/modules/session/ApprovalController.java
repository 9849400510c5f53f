package com.yoursp.faceapproval.modules.session;

import com.yoursp.faceapproval.model.entity.AccessSession;
import com.yoursp.faceapproval.modules.capture.dto.FaceImageRequest;
import com.yoursp.faceapproval.modules.session.dto.EndSessionRequest;
import com.yoursp.faceapproval.modules.session.dto.SessionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Face approval and access session endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/approve-face: match a live face and open a session</li>
 * <li>GET /api/session/{sessionId}: look up an active session</li>
 * <li>POST /api/end-session: end a session</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalService approvalService;
    private final AccessSessionService sessionService;

    @PostMapping("/approve-face")
    public ResponseEntity<Map<String, Object>> approveFace(@RequestBody FaceImageRequest request) {
        AccessSession session = approvalService.approve(request.getFaceImage());

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("session_id", session.getSessionId());
        body.put("name", session.getName());
        body.put("class", session.getGroupName());
        body.put("roll", session.getRollId());
        body.put("code", session.getAccessCode());
        body.put("confidence", session.getMatchConfidence());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.get(sessionId)));
    }

    @PostMapping("/end-session")
    public ResponseEntity<Map<String, Object>> endSession(@Valid @RequestBody EndSessionRequest request) {
        sessionService.end(request.getSessionId());
        return ResponseEntity.ok(Map.of("success", true, "message", "Session ended successfully"));
    }
}
