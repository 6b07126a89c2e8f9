package com.shardfeed.feed.service.feed;

import com.shardfeed.feed.core.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("피드 점수 계산")
class FeedScorerTest {

    private static final Instant NOW = Instant.parse("2024-05-02T00:00:00Z");

    private final FeedScorer scorer = new FeedScorer(ScoringWeights.DEFAULT);

    @Test
    @DisplayName("기본 가중치: likes 1, shares 2, comments 1.5")
    void testEngagementScore() {
        assertEquals(10 + 2 * 2 + 4 * 1.5, scorer.engagementScore(new Engagement(10, 2, 4)), 1e-9);
        assertEquals(0.0, scorer.engagementScore(Engagement.NONE), 1e-9);
    }

    @Test
    @DisplayName("시간 감쇠: 0시간 1.0, 24시간 0.5, 미래는 1.0")
    void testTimeDecay() {
        assertEquals(1.0, FeedScorer.timeDecay(Duration.ZERO), 1e-9);
        assertEquals(0.5, FeedScorer.timeDecay(Duration.ofHours(24)), 1e-9);
        assertEquals(1.0 / 3, FeedScorer.timeDecay(Duration.ofHours(48)), 1e-9);
        assertEquals(1.0, FeedScorer.timeDecay(Duration.ofHours(-5)), 1e-9);
        assertTrue(FeedScorer.timeDecay(Duration.ofHours(1)) > FeedScorer.timeDecay(Duration.ofHours(2)));
    }

    @Test
    @DisplayName("같은 engagement면 최신 게시물이 높음")
    void testNewerWinsAtEqualEngagement() {
        Engagement engagement = new Engagement(5, 1, 1);
        ScoredPost newer = scorer.score(post("new", NOW.minus(Duration.ofHours(1)), engagement), NOW);
        ScoredPost older = scorer.score(post("old", NOW.minus(Duration.ofHours(10)), engagement), NOW);

        assertTrue(newer.score() > older.score());
        assertTrue(FeedScorer.RANKING_ORDER.compare(newer, older) < 0);
    }

    @Test
    @DisplayName("같은 시각이면 engagement 높은 게시물이 높음")
    void testHigherEngagementWinsAtEqualTime() {
        Instant ts = NOW.minus(Duration.ofHours(3));
        ScoredPost popular = scorer.score(post("popular", ts, new Engagement(100, 0, 0)), NOW);
        ScoredPost quiet = scorer.score(post("quiet", ts, new Engagement(1, 0, 0)), NOW);

        assertTrue(FeedScorer.RANKING_ORDER.compare(popular, quiet) < 0);
    }

    @Test
    @DisplayName("동점은 timestamp 내림차순, 그다음 postId 오름차순")
    void testTieBreakers() {
        List<ScoredPost> posts = new ArrayList<>(List.of(
            new ScoredPost(0.0, post("b", NOW, Engagement.NONE)),
            new ScoredPost(0.0, post("a", NOW, Engagement.NONE)),
            new ScoredPost(0.0, post("c", NOW.plusSeconds(1), Engagement.NONE))
        ));

        posts.sort(FeedScorer.RANKING_ORDER);

        assertEquals(List.of("c", "a", "b"), posts.stream().map(ScoredPost::postId).toList());
    }

    @Test
    @DisplayName("음수/무한 가중치 거부")
    void testInvalidWeights() {
        assertThrows(ConfigurationException.class, () -> new ScoringWeights(-1, 1, 1));
        assertThrows(ConfigurationException.class, () -> new ScoringWeights(1, Double.NaN, 1));
        assertThrows(ConfigurationException.class, () -> new ScoringWeights(1, 1, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> new Engagement(-1, 0, 0));
    }

    private static PostCandidate post(String id, Instant ts, Engagement engagement) {
        return new PostCandidate(id, "author", ts, engagement);
    }
}
