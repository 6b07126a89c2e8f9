package com.shardfeed.feed.service.feed;

import com.shardfeed.feed.core.exception.BackendException;
import com.shardfeed.feed.metrics.MetricsCollector;
import com.shardfeed.feed.repository.AccessResult;
import com.shardfeed.feed.repository.ContentStore;
import com.shardfeed.feed.repository.SocialGraph;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 개인화 피드 랭커 (호출 단위 stateless)
 *
 * 1. followees = SocialGraph.following(userId) (정렬된 순서로 순회)
 * 2. followee마다 최근 K개 게시물 조회 (ContentStore, 캐시 우선)
 * 3. 점수 계산 후 RANKING_ORDER로 정렬
 * 4. pageSize로 자름
 *
 * 실패 처리:
 * - followee 조회 실패 → 건너뛰고 partial=true
 * - 실패 수가 maxFailedFollowees 초과 → 남은 followee 조회 중단, 모은 만큼 반환
 * - 소셜 그래프 실패 → 빈 partial 페이지
 */
public final class FeedRanker {
    private static final Logger log = LoggerFactory.getLogger(FeedRanker.class);

    private final SocialGraph socialGraph;
    private final ContentStore contentStore;
    private final FeedScorer scorer;
    private final int candidateWindow;
    private final int maxFailedFollowees;
    private final Clock clock;
    private final MetricsCollector metrics;

    public FeedRanker(SocialGraph socialGraph,
                      ContentStore contentStore,
                      FeedScorer scorer,
                      int candidateWindow,
                      int maxFailedFollowees,
                      Clock clock,
                      MetricsCollector metrics) {
        if (candidateWindow <= 0) {
            throw new IllegalArgumentException("candidateWindow must be > 0, got: " + candidateWindow);
        }
        if (maxFailedFollowees < 0) {
            throw new IllegalArgumentException("maxFailedFollowees must be >= 0, got: " + maxFailedFollowees);
        }
        this.socialGraph = socialGraph;
        this.contentStore = contentStore;
        this.scorer = scorer;
        this.candidateWindow = candidateWindow;
        this.maxFailedFollowees = maxFailedFollowees;
        this.clock = clock;
        this.metrics = metrics;
    }

    public FeedPage rank(String userId, int pageSize) {
        return rank(userId, pageSize, clock.instant());
    }

    public FeedPage rank(String userId, int pageSize, Instant now) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0, got: " + pageSize);
        }

        Timer.Sample sample = metrics.startTimer();

        Set<String> followees;
        try {
            followees = new TreeSet<>(socialGraph.following(userId));
        } catch (BackendException e) {
            log.error("Social graph unavailable: user={} code={}", userId, e.getErrorCode(), e);
            metrics.recordPartialFeed();
            metrics.recordRankLatency(sample, true);
            return FeedPage.failed(userId, now);
        }

        Map<String, ScoredPost> candidates = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        int visited = 0;

        for (String followee : followees) {
            if (failed.size() > maxFailedFollowees) {
                break;
            }
            visited++;

            List<PostCandidate> posts = fetch(followee);
            if (posts == null) {
                failed.add(followee);
                metrics.recordFolloweeFetchFailure();
                continue;
            }

            for (PostCandidate post : posts) {
                candidates.putIfAbsent(post.postId(), scorer.score(post, now));
            }
        }

        if (visited < followees.size()) {
            List<String> skipped = new ArrayList<>(followees).subList(visited, followees.size());
            log.warn("Fetch failure tolerance exceeded: user={} failed={} skipped={}",
                     userId, failed.size(), skipped.size());
            failed.addAll(skipped);
        }

        List<ScoredPost> ranked = new ArrayList<>(candidates.values());
        ranked.sort(FeedScorer.RANKING_ORDER);

        List<String> postIds = new ArrayList<>(Math.min(pageSize, ranked.size()));
        for (int i = 0; i < ranked.size() && i < pageSize; i++) {
            postIds.add(ranked.get(i).postId());
        }

        boolean partial = !failed.isEmpty();
        if (partial) {
            metrics.recordPartialFeed();
            log.info("Partial feed: user={} followees={} failed={} candidates={}",
                     userId, followees.size(), failed.size(), ranked.size());
        }
        metrics.recordRankLatency(sample, partial);

        return new FeedPage(userId, postIds, partial, failed, ranked.size(), now);
    }

    /**
     * @return posts, or null if the followee's timeline could not be fetched
     */
    private List<PostCandidate> fetch(String followee) {
        try {
            AccessResult<List<PostCandidate>> result = contentStore.recentPosts(followee, candidateWindow);
            if (result.isSuccess()) {
                return result.value();
            }
            log.warn("Skipping followee: followee={} status={} detail={}",
                     followee, result.status(), result.detail());
            return null;
        } catch (BackendException e) {
            log.warn("Skipping followee: followee={} code={} message={}",
                     followee, e.getErrorCode(), e.getMessage());
            return null;
        }
    }

    public int getCandidateWindow() {
        return candidateWindow;
    }

    public int getMaxFailedFollowees() {
        return maxFailedFollowees;
    }
}
