package com.yoursp.faceapproval.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogMaskingConverter: access codes, tokens and image payloads must
 * not reach the log.
 */
class LogMaskingConverterTest {

    private final LogMaskingConverter converter = new LogMaskingConverter();

    @Test
    void masksAccessCodeInAuditLine() {
        String input = "NEW REGISTRATION: alice | Class: 10-A | Roll: R-1 | Code: ABCDEF012345";
        String result = converter.transform(null, input);
        assertTrue(result.endsWith("Code: [REDACTED]"));
        assertTrue(result.contains("Class: 10-A"));
        assertFalse(result.contains("ABCDEF012345"));
    }

    @Test
    void masksSessionIdValue() {
        String input = "session_id=0123456789abcdef0123456789abcdef";
        String result = converter.transform(null, input);
        assertEquals("session_id=01234567...", result);
    }

    @Test
    void masksSessionIdInJson() {
        String input = "{\"session_id\":\"0123456789abcdef0123456789abcdef\"}";
        String result = converter.transform(null, input);
        assertTrue(result.contains("01234567..."));
        assertFalse(result.contains("89abcdef0123456789abcdef"));
    }

    @Test
    void masksDataUrlImage() {
        String input = "payload=data:image/jpeg;base64,/9j/4AAQSkZJRgABAQAAAQABAAD";
        String result = converter.transform(null, input);
        assertEquals("payload=[IMAGE]", result);
    }

    @Test
    void masksLongBase64Run() {
        String input = "face_image " + "iVBORw0KGgo".repeat(30);
        String result = converter.transform(null, input);
        assertEquals("face_image [IMAGE]", result);
    }

    @Test
    void passesNonSensitiveDataThrough() {
        String input = "Identity deleted: name=alice, error code=404";
        String result = converter.transform(null, input);
        assertEquals(input, result);
    }

    @Test
    void handlesNullAndEmpty() {
        assertNull(converter.transform(null, null));
        assertEquals("", converter.transform(null, ""));
    }
}
