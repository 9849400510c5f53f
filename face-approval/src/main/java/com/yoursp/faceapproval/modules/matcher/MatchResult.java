package com.yoursp.faceapproval.modules.matcher;

import com.yoursp.faceapproval.model.entity.Identity;

/**
 * Winning identity of a match.
 *
 * @param identity   closest enrolled identity under the threshold
 * @param distance   Euclidean distance to it
 * @param confidence {@code (1 - distance) * 100}, two decimals
 */
public record MatchResult(Identity identity, double distance, double confidence) {
}
