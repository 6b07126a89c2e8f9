package com.shardfeed.feed.repository;

import com.shardfeed.feed.service.feed.PostCandidate;

import java.util.List;

/**
 * 게시물 저장소 (외부 협력자, 읽기 전용으로 사용)
 */
public interface ContentStore {

    /**
     * userId의 최근 게시물 (최신순, 최대 limit개)
     *
     * 게시물이 없으면 OK + 빈 리스트
     */
    AccessResult<List<PostCandidate>> recentPosts(String userId, int limit);
}
