package com.yoursp.faceapproval.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the {@code face-approval.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "face-approval")
public class FaceApprovalProperties {

    private Admin admin = new Admin();
    private Capture capture = new Capture();
    private Matching matching = new Matching();
    private Audit audit = new Audit();
    private Session session = new Session();
    private Extractor extractor = new Extractor();

    @Getter
    @Setter
    public static class Admin {
        private String username;
        private String password;
    }

    @Getter
    @Setter
    public static class Capture {
        /** Payloads shorter than this (in characters) are rejected before decoding. */
        private int minPayloadLength = 100;
        private Duration ticketTtl = Duration.ofHours(1);
        private int previewLength = 500;
    }

    @Getter
    @Setter
    public static class Matching {
        /** Maximum Euclidean distance accepted as the same face. */
        private double threshold = 0.6;
    }

    @Getter
    @Setter
    public static class Audit {
        private int retention = 100;
    }

    @Getter
    @Setter
    public static class Session {
        /** Unset means sessions live until ended or superseded. */
        private Duration maxAge;
    }

    @Getter
    @Setter
    public static class Extractor {
        private String url = "http://localhost:8090";
        private Duration timeout = Duration.ofSeconds(30);
    }
}
