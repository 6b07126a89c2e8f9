package com.shardfeed.feed.alert;

import com.shardfeed.feed.core.exception.AlertDeliveryException;

/**
 * 외부 transport (SMTP, 채팅 webhook 등)
 */
public interface AlertSender {

    /**
     * @param destination 메일 주소 또는 채팅방 이름
     * @throws AlertDeliveryException transport 실패
     */
    void send(ChannelKind kind, String destination, String subject, String body);
}
