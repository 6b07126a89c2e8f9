package com.shardfeed.feed.service.feed;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * 게시물 점수 계산
 *
 * score = f(engagement) * timeDecay(age)
 * - f = likes * wL + shares * wS + comments * wC
 * - timeDecay = 1 / (1 + ageHours / 24), 미래 timestamp는 age 0
 *
 * 정렬: score 내림차순 → timestamp 내림차순 → postId 오름차순 (total order)
 */
public final class FeedScorer {
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    public static final Comparator<ScoredPost> RANKING_ORDER =
            Comparator.comparingDouble(ScoredPost::score).reversed()
                      .thenComparing((ScoredPost s) -> s.post().timestamp(), Comparator.reverseOrder())
                      .thenComparing(ScoredPost::postId);

    private final ScoringWeights weights;

    public FeedScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public ScoredPost score(PostCandidate post, Instant now) {
        double score = engagementScore(post.engagement()) * timeDecay(Duration.between(post.timestamp(), now));
        return new ScoredPost(score, post);
    }

    public double engagementScore(Engagement engagement) {
        return engagement.likes() * weights.likes()
             + engagement.shares() * weights.shares()
             + engagement.comments() * weights.comments();
    }

    /**
     * 나이에 대해 단조 비증가
     */
    public static double timeDecay(Duration age) {
        if (age.isNegative()) {
            return 1.0;
        }
        double ageHours = age.toMillis() / MILLIS_PER_HOUR;
        return 1.0 / (1.0 + ageHours / 24.0);
    }

    public ScoringWeights getWeights() {
        return weights;
    }
}
