package com.yoursp.faceapproval.modules.admin;

import com.yoursp.faceapproval.modules.admin.dto.AdminLoginRequest;
import com.yoursp.faceapproval.modules.admin.dto.DeleteIdentityRequest;
import com.yoursp.faceapproval.modules.admin.dto.EditIdentityRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Administration endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/admin/login</li>
 * <li>GET /api/admin/users</li>
 * <li>GET /api/admin/logs</li>
 * <li>DELETE /api/admin/user</li>
 * <li>PUT /api/admin/user</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody AdminLoginRequest request) {
        adminService.login(request.getUsername(), request.getPassword());
        return ResponseEntity.ok(Map.of("success", true, "message", "Login successful"));
    }

    @GetMapping("/users")
    public ResponseEntity<Map<String, Object>> users() {
        return ResponseEntity.ok(Map.of("users", adminService.listIdentities()));
    }

    @GetMapping("/logs")
    public ResponseEntity<Map<String, Object>> logs() {
        return ResponseEntity.ok(Map.of("logs", adminService.recentLogs()));
    }

    @DeleteMapping("/user")
    public ResponseEntity<Map<String, Object>> deleteUser(@Valid @RequestBody DeleteIdentityRequest request) {
        adminService.deleteIdentity(request.getName());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "User '" + request.getName() + "' deleted successfully"));
    }

    @PutMapping("/user")
    public ResponseEntity<Map<String, Object>> editUser(@Valid @RequestBody EditIdentityRequest request) {
        adminService.editIdentity(request.getOldName(), request.getName(),
                request.getGroupName(), request.getRollId());
        return ResponseEntity.ok(Map.of("success", true, "message", "User updated successfully"));
    }
}
