package com.shardfeed.feed.service.feed;

import com.shardfeed.feed.cache.LruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 피드 조회 (요청 사용자 단위 LRU 캐시 + FeedRanker)
 *
 * - 완전한(partial=false) 페이지만 캐시
 * - 캐시 무효화는 호출자 책임 (팔로우 변경, 새 게시물 등)
 */
public final class FeedService {
    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final FeedRanker ranker;
    private final LruCache<String, FeedPage> feedCache;
    private final int defaultPageSize;

    public FeedService(FeedRanker ranker, LruCache<String, FeedPage> feedCache, int defaultPageSize) {
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("defaultPageSize must be > 0, got: " + defaultPageSize);
        }
        this.ranker = ranker;
        this.feedCache = feedCache;
        this.defaultPageSize = defaultPageSize;
    }

    public FeedPage getFeed(String userId) {
        return getFeed(userId, defaultPageSize);
    }

    public FeedPage getFeed(String userId, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0, got: " + pageSize);
        }

        FeedPage cached = feedCache.get(userId);
        if (cached != null && cached.canServe(pageSize)) {
            return cached.truncate(pageSize);
        }

        FeedPage page = ranker.rank(userId, Math.max(pageSize, defaultPageSize));
        if (page.partial()) {
            log.debug("Not caching partial feed: user={} failed={}", userId, page.failedFollowees());
        } else {
            feedCache.put(userId, page);
        }
        return page.truncate(pageSize);
    }

    public boolean invalidate(String userId) {
        return feedCache.invalidate(userId);
    }
}
