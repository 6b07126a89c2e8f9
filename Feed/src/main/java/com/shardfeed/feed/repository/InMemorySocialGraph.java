package com.shardfeed.feed.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 기반 팔로우 그래프
 *
 * - following: userId → 팔로우 대상
 * - followers: userId → 팔로워
 */
@Singleton
public final class InMemorySocialGraph implements SocialGraph {
    private static final Logger log = LoggerFactory.getLogger(InMemorySocialGraph.class);

    private final Map<String, Set<String>> following = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> followers = new ConcurrentHashMap<>();

    public void follow(String followerId, String followeeId) {
        if (followerId.equals(followeeId)) {
            throw new IllegalArgumentException("User cannot follow itself: " + followerId);
        }
        following.computeIfAbsent(followerId, k -> ConcurrentHashMap.newKeySet()).add(followeeId);
        followers.computeIfAbsent(followeeId, k -> ConcurrentHashMap.newKeySet()).add(followerId);
        log.debug("Follow: {} -> {}", followerId, followeeId);
    }

    public void unfollow(String followerId, String followeeId) {
        Set<String> userFollowing = following.get(followerId);
        if (userFollowing != null) {
            userFollowing.remove(followeeId);
        }
        Set<String> userFollowers = followers.get(followeeId);
        if (userFollowers != null) {
            userFollowers.remove(followerId);
        }
        log.debug("Unfollow: {} -> {}", followerId, followeeId);
    }

    @Override
    public Set<String> following(String userId) {
        return new TreeSet<>(following.getOrDefault(userId, Set.of()));
    }

    public Set<String> followers(String userId) {
        return new TreeSet<>(followers.getOrDefault(userId, Set.of()));
    }
}
