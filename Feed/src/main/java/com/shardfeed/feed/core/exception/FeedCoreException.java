package com.shardfeed.feed.core.exception;

public abstract class FeedCoreException extends RuntimeException {
    private final int errorCode;

    protected FeedCoreException(String message, int errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FeedCoreException(String message, int errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() { return errorCode; }

    // 재시도 가능 여부 (하위 클래스에서 오버라이드)
    public boolean isRetryable() { return false; }
}
