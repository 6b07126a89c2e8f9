package com.shardfeed.feed.alert;

import java.time.Instant;
import java.util.Objects;

/**
 * 운영 알림
 *
 * @param source 알림을 만든 주체 (e.g. "pool-health:p1")
 */
public record Alert(Severity severity, String source, String message, Instant raisedAt) {

    public Alert {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(raisedAt, "raisedAt");
    }

    public String subject() {
        return "[" + severity + "] " + source;
    }
}
