package com.shardfeed.feed.service.feed;

/**
 * 랭킹 호출 1회 안에서만 쓰는 점수 결과
 */
public record ScoredPost(double score, PostCandidate post) {

    public String postId() {
        return post.postId();
    }
}
