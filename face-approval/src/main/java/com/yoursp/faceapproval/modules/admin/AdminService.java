package com.yoursp.faceapproval.modules.admin;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.modules.admin.dto.IdentitySummary;
import com.yoursp.faceapproval.service.AuditService;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import com.yoursp.faceapproval.service.storage.IdentityUpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Registry administration: login check, identity listing, edit and delete,
 * console log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final ApprovalStore store;
    private final AuditService auditService;
    private final FaceApprovalProperties properties;

    /**
     * @throws ApprovalException {@code UNAUTHORIZED} on mismatch, or when no
     *                           credentials are configured
     */
    public void login(String username, String password) {
        FaceApprovalProperties.Admin admin = properties.getAdmin();
        if (!StringUtils.hasText(admin.getUsername()) || !StringUtils.hasText(admin.getPassword())) {
            log.warn("Admin login attempted but no admin credentials are configured");
        } else if (constantTimeEquals(admin.getUsername(), username)
                && constantTimeEquals(admin.getPassword(), password)) {
            auditService.record("ADMIN LOGIN: " + username);
            return;
        }
        auditService.record("FAILED ADMIN LOGIN ATTEMPT: " + username);
        throw new ApprovalException(ApprovalErrorCode.UNAUTHORIZED, "Invalid credentials");
    }

    public List<IdentitySummary> listIdentities() {
        return store.findAllIdentities().stream()
                .map(IdentitySummary::from)
                .toList();
    }

    public List<String> recentLogs() {
        return auditService.recentEntries();
    }

    /**
     * Remove an identity. Its active session, if any, is left to run out.
     */
    public void deleteIdentity(String name) {
        if (!store.deleteIdentity(name)) {
            throw ApprovalException.notFound("User not found");
        }
        auditService.record("USER DELETED: " + name);
        log.info("Identity deleted: name={}", name);
    }

    /**
     * Change name, class and roll. The stored embedding is never touched.
     */
    public void editIdentity(String oldName, String name, String groupName, String rollId) {
        String newName = trim(name);
        String newGroup = trim(groupName);
        String newRoll = trim(rollId);

        if (newName.isEmpty() || newGroup.isEmpty() || newRoll.isEmpty()) {
            throw ApprovalException.invalidInput("All fields are required");
        }

        IdentityUpdateResult result = store.updateIdentityMetadata(oldName, newName, newGroup, newRoll);
        switch (result) {
            case NOT_FOUND -> throw ApprovalException.notFound("User not found");
            case NAME_TAKEN -> throw new ApprovalException(ApprovalErrorCode.DUPLICATE_IDENTITY,
                    "User '" + newName + "' already exists");
            case UPDATED -> {
                auditService.record("USER EDITED: " + oldName + " -> " + newName
                        + " | Class: " + newGroup + " | Roll: " + newRoll);
                log.info("Identity edited: {} -> {}", oldName, newName);
            }
        }
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }
}
