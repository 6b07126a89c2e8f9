package com.shardfeed.feed.alert;

/**
 * 지원하는 알림 채널 (닫힌 집합)
 */
public enum ChannelKind {
    LOG,
    EMAIL,
    CHAT
}
