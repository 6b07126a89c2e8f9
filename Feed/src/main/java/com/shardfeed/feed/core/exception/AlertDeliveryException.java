package com.shardfeed.feed.core.exception;

/**
 * 알림 전송 실패 (메일/채팅 transport 오류)
 */
public final class AlertDeliveryException extends FeedCoreException {
    public static final int DELIVERY_FAILED = 4001;

    public AlertDeliveryException(String message) {
        super(message, DELIVERY_FAILED);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, DELIVERY_FAILED, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
