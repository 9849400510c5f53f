package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.service.SecureTokens;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;

import java.util.Arrays;

/**
 * The {@code session_id} cookie that ties a capture to the later enrollment.
 */
public final class CaptureSessionCookie {

    public static final String COOKIE_NAME = "session_id";

    private CaptureSessionCookie() {
        // utility class
    }

    /**
     * @return the token carried by the request, or null
     */
    public static String read(HttpServletRequest request) {
        if (request.getCookies() == null)
            return null;
        return Arrays.stream(request.getCookies())
                .filter(c -> COOKIE_NAME.equals(c.getName()))
                .map(Cookie::getValue)
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(null);
    }

    /**
     * Reuse the request's token, or mint a new one.
     */
    public static String readOrCreate(HttpServletRequest request) {
        String token = read(request);
        return token != null ? token : SecureTokens.sessionToken();
    }

    public static void write(HttpServletResponse response, String token) {
        ResponseCookie cookie = ResponseCookie.from(COOKIE_NAME, token)
                .httpOnly(true)
                .sameSite("Lax")
                .path("/")
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
