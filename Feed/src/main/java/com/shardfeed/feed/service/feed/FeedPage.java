package com.shardfeed.feed.service.feed;

import java.time.Instant;
import java.util.List;

/**
 * 랭킹 결과 페이지
 *
 * @param userId 요청 사용자
 * @param postIds 순위순 게시물 id
 * @param partial 일부 followee 조회 실패 시 true
 * @param failedFollowees 조회 실패(또는 tolerance 초과로 건너뛴) followee
 * @param candidateCount 자르기 전 전체 후보 수
 * @param generatedAt 랭킹 기준 시각
 */
public record FeedPage(
    String userId,
    List<String> postIds,
    boolean partial,
    List<String> failedFollowees,
    int candidateCount,
    Instant generatedAt
) {
    public FeedPage {
        postIds = List.copyOf(postIds);
        failedFollowees = List.copyOf(failedFollowees);
    }

    public static FeedPage failed(String userId, Instant now) {
        return new FeedPage(userId, List.of(), true, List.of(), 0, now);
    }

    /**
     * pageSize만큼 이 페이지로 응답 가능한지
     * (잘린 페이지는 더 큰 요청에 응답 불가)
     */
    public boolean canServe(int pageSize) {
        return pageSize <= postIds.size() || postIds.size() == candidateCount;
    }

    public FeedPage truncate(int pageSize) {
        if (pageSize >= postIds.size()) {
            return this;
        }
        return new FeedPage(userId, postIds.subList(0, pageSize), partial, failedFollowees,
                            candidateCount, generatedAt);
    }
}
