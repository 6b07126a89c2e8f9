package com.shardfeed.feed.service.feed;

import com.shardfeed.feed.core.exception.ConfigurationException;

/**
 * engagement 가중치 (정책 입력, 음수 불가)
 */
public record ScoringWeights(double likes, double shares, double comments) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(1.0, 2.0, 1.5);

    public ScoringWeights {
        requireValid("likes", likes);
        requireValid("shares", shares);
        requireValid("comments", comments);
    }

    private static void requireValid(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0) {
            throw new ConfigurationException("scoring weight '" + name + "' must be finite and >= 0, got: " + weight);
        }
    }
}
