package com.yoursp.faceapproval.modules.matcher;

import com.yoursp.faceapproval.config.FaceApprovalProperties;
import com.yoursp.faceapproval.model.entity.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-embedding matcher over the whole registry (linear scan).
 * <p>
 * A candidate becomes the best match only if its distance is strictly below
 * both the acceptance threshold and the best distance so far, so on equal
 * distances the identity enrolled first wins.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingMatcher {

    private final FaceApprovalProperties properties;

    /**
     * @param liveEmbedding embedding of the face being approved
     * @param identities    registry in enrollment order
     * @return the best match, or empty when nothing is under the threshold
     */
    public Optional<MatchResult> match(double[] liveEmbedding, List<Identity> identities) {
        double threshold = properties.getMatching().getThreshold();

        Identity best = null;
        double bestDistance = Double.POSITIVE_INFINITY;

        for (Identity candidate : identities) {
            double[] stored = candidate.getEmbedding();
            if (stored == null || stored.length != liveEmbedding.length) {
                log.warn("Skipping identity with incompatible embedding: name={}", candidate.getName());
                continue;
            }
            double distance = euclideanDistance(liveEmbedding, stored);
            if (distance < threshold && distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }

        if (best == null) {
            log.debug("No match under threshold {} among {} identities", threshold, identities.size());
            return Optional.empty();
        }
        return Optional.of(new MatchResult(best, bestDistance, confidence(bestDistance)));
    }

    static double euclideanDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    static double confidence(double distance) {
        return new BigDecimal((1 - distance) * 100)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
