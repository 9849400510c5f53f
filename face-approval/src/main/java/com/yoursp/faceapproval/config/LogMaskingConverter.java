package com.yoursp.faceapproval.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>Access codes ({@code Code: ABCDEF012345}): "[REDACTED]"</li>
 * <li>session_id / sessionId / token values: first 8 chars + "..."</li>
 * <li>Base64 image payloads (data URLs or long base64 runs):
 * "[IMAGE]"</li>
 * </ul>
 * <p>
 * Register in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.faceapproval.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches data:image/...;base64,<payload>
    private static final Pattern DATA_URL_PATTERN = Pattern
            .compile("data:image/[A-Za-z0-9.+-]+;base64,[A-Za-z0-9+/=]+");

    // Matches bare base64 runs long enough to be an image
    private static final Pattern BASE64_RUN_PATTERN = Pattern.compile("[A-Za-z0-9+/]{200,}={0,2}");

    // Matches "Code: <value>", code=<value> or "code":"<value>"
    private static final Pattern ACCESS_CODE_PATTERN = Pattern
            .compile("((?i:code)[\"=:]+\\s*[\"']?)[A-Fa-f0-9]{6,}");

    // Matches session_id=<value>, sessionId=<value>, token=<value> and JSON forms
    private static final Pattern SESSION_TOKEN_PATTERN = Pattern
            .compile("((?:session_id|sessionId|sessionToken|token)[\"=:]+\\s*[\"']?)([A-Za-z0-9]{8})[A-Za-z0-9]+");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        return mask(formattedMessage);
    }

    static String mask(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }

        String masked = message;
        masked = DATA_URL_PATTERN.matcher(masked).replaceAll("[IMAGE]");
        masked = BASE64_RUN_PATTERN.matcher(masked).replaceAll("[IMAGE]");
        masked = ACCESS_CODE_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = SESSION_TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");

        return masked;
    }
}
