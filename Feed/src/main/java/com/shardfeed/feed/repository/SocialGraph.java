package com.shardfeed.feed.repository;

import java.util.Set;

/**
 * 소셜 그래프 (외부 협력자, 읽기 전용으로 사용)
 */
public interface SocialGraph {

    /**
     * userId가 팔로우하는 사용자 목록
     *
     * @throws com.shardfeed.feed.core.exception.BackendException if the graph store is unreachable
     */
    Set<String> following(String userId);
}
