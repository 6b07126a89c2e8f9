package com.shardfeed.feed.core.exception;

/**
 * 설정 오류 (용량 0 이하, 가상 노드 0개 등)
 *
 * 생성 시점에 즉시 던지며 복구하지 않는다.
 */
public final class ConfigurationException extends FeedCoreException {
    public static final int INVALID_VALUE = 2001;
    public static final int DUPLICATE_SHARD = 2002;

    public ConfigurationException(String message) {
        super(message, INVALID_VALUE);
    }

    public ConfigurationException(String message, int code) {
        super(message, code);
    }

    /**
     * 양수 검증 헬퍼
     */
    public static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be > 0, got: " + value);
        }
        return value;
    }
}
