package com.shardfeed.feed.service.feed;

import com.shardfeed.feed.core.exception.BackendException;
import com.shardfeed.feed.metrics.MetricsCollector;
import com.shardfeed.feed.repository.AccessResult;
import com.shardfeed.feed.repository.ContentStore;
import com.shardfeed.feed.repository.SocialGraph;
import com.shardfeed.feed.shard.RouteStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("피드 랭커")
class FeedRankerTest {

    private static final Instant NOW = Instant.parse("2024-05-02T00:00:00Z");
    private static final int WINDOW = 5;

    @Mock
    private SocialGraph socialGraph;

    @Mock
    private ContentStore contentStore;

    private SimpleMeterRegistry registry;
    private FeedRanker ranker;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ranker = newRanker(2);
    }

    private FeedRanker newRanker(int maxFailedFollowees) {
        return new FeedRanker(socialGraph, contentStore, new FeedScorer(ScoringWeights.DEFAULT),
                              WINDOW, maxFailedFollowees, Clock.fixed(NOW, ZoneOffset.UTC),
                              new MetricsCollector(registry));
    }

    @Test
    @DisplayName("followee들의 게시물을 점수순으로 합쳐서 pageSize만큼 반환")
    void testRanksAcrossFollowees() {
        when(socialGraph.following("u")).thenReturn(Set.of("alice", "bob"));
        when(contentStore.recentPosts("alice", WINDOW)).thenReturn(ok(
            post("a1", "alice", 1, 10),
            post("a2", "alice", 30, 10)
        ));
        when(contentStore.recentPosts("bob", WINDOW)).thenReturn(ok(
            post("b1", "bob", 2, 50)
        ));

        FeedPage page = ranker.rank("u", 2);

        assertEquals(List.of("b1", "a1"), page.postIds());
        assertFalse(page.partial());
        assertEquals(3, page.candidateCount());
        assertEquals(NOW, page.generatedAt());
    }

    @Test
    @DisplayName("같은 입력이면 같은 순서")
    void testDeterministic() {
        when(socialGraph.following("u")).thenReturn(Set.of("alice", "bob", "carol"));
        when(contentStore.recentPosts(anyString(), eq(WINDOW))).thenAnswer(invocation -> {
            String author = invocation.getArgument(0);
            return ok(post(author + "-1", author, 5, 3), post(author + "-2", author, 5, 3));
        });

        FeedPage first = ranker.rank("u", 10, NOW);
        FeedPage second = ranker.rank("u", 10, NOW);

        assertEquals(first.postIds(), second.postIds());
        // 모두 동점 → postId 오름차순
        assertEquals(List.of("alice-1", "alice-2", "bob-1", "bob-2", "carol-1", "carol-2"), first.postIds());
    }

    @Test
    @DisplayName("중복 게시물은 한 번만")
    void testDeduplicatesPosts() {
        when(socialGraph.following("u")).thenReturn(Set.of("alice", "bob"));
        PostCandidate shared = post("x", "alice", 1, 5);
        when(contentStore.recentPosts("alice", WINDOW)).thenReturn(ok(shared));
        when(contentStore.recentPosts("bob", WINDOW)).thenReturn(ok(shared));

        assertEquals(List.of("x"), ranker.rank("u", 10).postIds());
    }

    @Test
    @DisplayName("한 followee 조회 실패 시 나머지로 partial 페이지")
    void testPartialOnFolloweeFailure() {
        when(socialGraph.following("u")).thenReturn(Set.of("alice", "bob"));
        when(contentStore.recentPosts("alice", WINDOW))
                .thenReturn(AccessResult.unavailable(RouteStatus.EXHAUSTED, "p1"));
        when(contentStore.recentPosts("bob", WINDOW)).thenReturn(ok(post("b1", "bob", 1, 1)));

        FeedPage page = ranker.rank("u", 10);

        assertTrue(page.partial());
        assertEquals(List.of("alice"), page.failedFollowees());
        assertEquals(List.of("b1"), page.postIds());
        assertEquals(1.0, registry.get("feed.partial").counter().count(), 1e-9);
    }

    @Test
    @DisplayName("협력자가 BackendException을 던져도 건너뜀")
    void testSkipsThrowingFollowee() {
        when(socialGraph.following("u")).thenReturn(Set.of("alice", "bob"));
        when(contentStore.recentPosts("alice", WINDOW))
                .thenThrow(new BackendException("timeout", BackendException.READ_FAILED));
        when(contentStore.recentPosts("bob", WINDOW)).thenReturn(ok(post("b1", "bob", 1, 1)));

        FeedPage page = ranker.rank("u", 10);

        assertTrue(page.partial());
        assertEquals(List.of("b1"), page.postIds());
    }

    @Test
    @DisplayName("실패 허용치 초과 시 남은 followee는 조회하지 않음")
    void testStopsAfterFailureTolerance() {
        FeedRanker strict = newRanker(1);
        when(socialGraph.following("u")).thenReturn(Set.of("a", "b", "c", "d"));
        when(contentStore.recentPosts("a", WINDOW)).thenReturn(AccessResult.backendError("p1", "down"));
        when(contentStore.recentPosts("b", WINDOW)).thenReturn(AccessResult.backendError("p1", "down"));

        FeedPage page = strict.rank("u", 10);

        assertTrue(page.partial());
        assertTrue(page.postIds().isEmpty());
        assertEquals(List.of("a", "b", "c", "d"), page.failedFollowees());
        verify(contentStore, never()).recentPosts(eq("c"), anyInt());
        verify(contentStore, never()).recentPosts(eq("d"), anyInt());
    }

    @Test
    @DisplayName("소셜 그래프 장애는 빈 partial 페이지")
    void testSocialGraphFailure() {
        when(socialGraph.following("u"))
                .thenThrow(new BackendException("graph down", BackendException.READ_FAILED));

        FeedPage page = ranker.rank("u", 10);

        assertTrue(page.partial());
        assertTrue(page.postIds().isEmpty());
        verifyNoInteractions(contentStore);
    }

    @Test
    @DisplayName("팔로우가 없으면 빈 완전한 페이지")
    void testNoFollowees() {
        when(socialGraph.following("u")).thenReturn(Set.of());

        FeedPage page = ranker.rank("u", 10);

        assertFalse(page.partial());
        assertTrue(page.postIds().isEmpty());
        assertTrue(page.canServe(100));
    }

    @Test
    @DisplayName("잘못된 인자 거부")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ranker.rank("u", 0));
        assertThrows(IllegalArgumentException.class, () -> newRanker(-1));
    }

    private static AccessResult<List<PostCandidate>> ok(PostCandidate... posts) {
        return AccessResult.ok(List.of(posts), "p1");
    }

    private static PostCandidate post(String id, String author, long hoursAgo, long likes) {
        return new PostCandidate(id, author, NOW.minus(Duration.ofHours(hoursAgo)), new Engagement(likes, 0, 0));
    }
}
