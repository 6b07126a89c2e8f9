package com.shardfeed.feed.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LogAlertChannel implements AlertChannel {
    private static final Logger log = LoggerFactory.getLogger("ALERT");

    @Override
    public ChannelKind kind() {
        return ChannelKind.LOG;
    }

    @Override
    public void deliver(Alert alert) {
        switch (alert.severity()) {
            case CRITICAL -> log.error("{} {}", alert.subject(), alert.message());
            case WARNING -> log.warn("{} {}", alert.subject(), alert.message());
            default -> log.info("{} {}", alert.subject(), alert.message());
        }
    }
}
