package com.shardfeed.feed.repository;

import com.shardfeed.feed.core.codec.PostTimelineCodec;
import com.shardfeed.feed.core.exception.CodecException;
import com.shardfeed.feed.service.feed.PostCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * DataAccessLayer 위의 게시물 타임라인 저장소
 *
 * - 작성자별 최근 게시물을 레코드 1개로 저장 (shardKey = authorId, key = "timeline")
 * - 같은 작성자의 데이터는 항상 같은 파티션
 */
public final class ShardedContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ShardedContentStore.class);

    static final String TIMELINE_KEY = "timeline";

    private static final Comparator<PostCandidate> NEWEST_FIRST =
            Comparator.comparing(PostCandidate::timestamp).reversed()
                      .thenComparing(PostCandidate::postId);

    private final DataAccessLayer dataAccessLayer;

    public ShardedContentStore(DataAccessLayer dataAccessLayer) {
        this.dataAccessLayer = dataAccessLayer;
    }

    @Override
    public AccessResult<List<PostCandidate>> recentPosts(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }

        AccessResult<byte[]> raw = dataAccessLayer.readThrough(userId, TIMELINE_KEY);
        switch (raw.status()) {
            case OK:
                break;
            case NOT_FOUND:
                return AccessResult.ok(List.of(), raw.partitionId());
            case UNAVAILABLE:
                return AccessResult.unavailable(raw.routeStatus(), raw.partitionId());
            default:
                return AccessResult.backendError(raw.partitionId(), raw.detail());
        }

        List<PostCandidate> posts;
        try {
            posts = new ArrayList<>(PostTimelineCodec.decode(raw.value()));
        } catch (CodecException e) {
            log.error("Corrupt timeline record: user={} partition={} code={}",
                      userId, raw.partitionId(), e.getErrorCode(), e);
            return AccessResult.backendError(raw.partitionId(), e.getMessage());
        }

        posts.sort(NEWEST_FIRST);
        List<PostCandidate> window = posts.size() > limit ? posts.subList(0, limit) : posts;
        return AccessResult.ok(List.copyOf(window), raw.partitionId());
    }

    /**
     * 작성자 타임라인 저장 (전체 교체)
     */
    public AccessResult<Void> storeRecentPosts(String userId, List<PostCandidate> posts) {
        for (PostCandidate post : posts) {
            if (!userId.equals(post.authorId())) {
                throw new IllegalArgumentException(
                    String.format("Post %s belongs to %s, not %s", post.postId(), post.authorId(), userId));
            }
        }

        List<PostCandidate> sorted = new ArrayList<>(posts);
        sorted.sort(NEWEST_FIRST);

        AccessResult<Void> result = dataAccessLayer.write(userId, TIMELINE_KEY, PostTimelineCodec.encode(sorted));
        if (!result.isSuccess()) {
            log.warn("Timeline write failed: user={} status={} detail={}",
                     userId, result.status(), result.detail());
        }
        return result;
    }
}
