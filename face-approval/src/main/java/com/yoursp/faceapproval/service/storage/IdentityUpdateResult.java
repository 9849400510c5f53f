package com.yoursp.faceapproval.service.storage;

public enum IdentityUpdateResult {
    UPDATED,
    NOT_FOUND,
    NAME_TAKEN
}
