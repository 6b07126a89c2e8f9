package com.shardfeed.feed.alert;

/**
 * 알림 전달 capability
 *
 * deliver는 실패 시 예외를 던질 수 있다. 격리는 AlertDispatcher 책임.
 */
public interface AlertChannel {

    ChannelKind kind();

    void deliver(Alert alert);
}
