package com.shardfeed.feed.core.exception;

/**
 * 스토리지 백엔드 read/write 실패
 *
 * DataAccessLayer에서 잡아서 BACKEND_ERROR 결과로 변환한다 (캐시에 저장 금지).
 */
public class BackendException extends FeedCoreException {
    public static final int READ_FAILED = 3001;
    public static final int WRITE_FAILED = 3002;
    public static final int CONNECTION_CLOSED = 3003;

    public BackendException(String message, int code) {
        super(message, code);
    }

    public BackendException(String message, int code, Throwable cause) {
        super(message, code, cause);
    }

    @Override
    public boolean isRetryable() {
        return getErrorCode() != CONNECTION_CLOSED;
    }
}
