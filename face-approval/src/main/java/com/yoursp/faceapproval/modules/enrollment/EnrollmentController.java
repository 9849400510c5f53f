package com.yoursp.faceapproval.modules.enrollment;

import com.yoursp.faceapproval.modules.capture.CaptureSessionCookie;
import com.yoursp.faceapproval.modules.enrollment.dto.EnrollmentResult;
import com.yoursp.faceapproval.modules.enrollment.dto.RegisterEntryRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    @PostMapping("/register-entry")
    public ResponseEntity<Map<String, Object>> registerEntry(@RequestBody RegisterEntryRequest request,
            HttpServletRequest httpRequest) {
        EnrollmentResult result = enrollmentService.enroll(
                CaptureSessionCookie.read(httpRequest),
                request.getName(), request.getGroupName(), request.getRollId());

        return ResponseEntity.ok(Map.of(
                "success", true,
                "code", result.accessCode(),
                "name", result.name(),
                "message", "Registration successful!"));
    }
}
