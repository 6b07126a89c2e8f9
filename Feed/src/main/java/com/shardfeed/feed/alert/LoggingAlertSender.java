package com.shardfeed.feed.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;

/**
 * 로컬 실행용 sender: 실제 전송 대신 로그만 남김
 */
@Singleton
public final class LoggingAlertSender implements AlertSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSender.class);

    @Override
    public void send(ChannelKind kind, String destination, String subject, String body) {
        log.info("Alert handed off: kind={} destination={} subject={} body={}", kind, destination, subject, body);
    }
}
