package com.shardfeed.feed.service.feed;

import java.time.Instant;
import java.util.Objects;

/**
 * 랭킹 입력용 게시물 (읽기 전용 복사본)
 */
public record PostCandidate(
    String postId,
    String authorId,
    Instant timestamp,
    Engagement engagement
) {
    public PostCandidate {
        Objects.requireNonNull(postId, "postId");
        Objects.requireNonNull(authorId, "authorId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(engagement, "engagement");
    }
}
