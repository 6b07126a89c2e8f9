package com.shardfeed.feed.core.exception;

public final class CodecException extends FeedCoreException {
    public static final int DECODE_ERROR = 1001; // 레코드 디코딩 실패
    public static final int UNSUPPORTED_VERSION = 1002;
    public static final int INVALID_LENGTH = 1003;

    public CodecException(String message, int code) {
        super(message, code);
    }

    public CodecException(String message, int code, Throwable cause) {
        super(message, code, cause);
    }
}
