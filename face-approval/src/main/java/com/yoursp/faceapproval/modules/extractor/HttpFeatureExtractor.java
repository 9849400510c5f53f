package com.yoursp.faceapproval.modules.extractor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.faceapproval.config.FaceApprovalProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the face embedding sidecar.
 * <p>
 * {@code POST {extractor.url}/faces} with {@code {"image": "<base64>"}};
 * the sidecar answers {@code {"face_count": n, "embeddings": [[...], ...]}}.
 * Protected by a Resilience4j circuit breaker. No retries.
 * </p>
 */
@Slf4j
@Component
public class HttpFeatureExtractor implements FeatureExtractor {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final FaceApprovalProperties properties;

    public HttpFeatureExtractor(ObjectMapper objectMapper, FaceApprovalProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    @CircuitBreaker(name = "featureExtractor", fallbackMethod = "detectFallback")
    public FaceDetection detect(byte[] imageBytes) {
        String url = properties.getExtractor().getUrl() + "/faces";
        log.debug("Extractor request: url={}, imageSize={}", url, imageBytes.length);

        try {
            String requestBody = objectMapper.writeValueAsString(Map.of(
                    "image", Base64.getEncoder().encodeToString(imageBytes)));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(properties.getExtractor().getTimeout())
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new FeatureExtractorUnavailableException(
                        "Feature extractor returned HTTP " + response.statusCode());
            }

            ExtractorResponse body = objectMapper.readValue(response.body(), ExtractorResponse.class);
            log.debug("Extractor response: faceCount={}, embeddings={}",
                    body.faceCount(), body.embeddings() != null ? body.embeddings().size() : 0);

            return new FaceDetection(body.faceCount(), body.embeddings());

        } catch (FeatureExtractorUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeatureExtractorUnavailableException("Feature extractor call interrupted", e);
        } catch (java.net.ConnectException e) {
            throw new FeatureExtractorUnavailableException(
                    "Feature extractor is not reachable at " + properties.getExtractor().getUrl(), e);
        } catch (Exception e) {
            log.error("Feature extractor call failed: {}", e.getMessage());
            throw new FeatureExtractorUnavailableException("Feature extractor call failed", e);
        }
    }

    @SuppressWarnings("unused")
    private FaceDetection detectFallback(byte[] imageBytes, Throwable t) {
        log.error("Feature extractor circuit breaker fallback: {}", t.getMessage());
        if (t instanceof FeatureExtractorUnavailableException unavailable) {
            throw unavailable;
        }
        throw new FeatureExtractorUnavailableException("Feature extractor temporarily unavailable", t);
    }

    record ExtractorResponse(
            @JsonProperty("face_count") int faceCount,
            @JsonProperty("embeddings") List<double[]> embeddings) {
    }
}
