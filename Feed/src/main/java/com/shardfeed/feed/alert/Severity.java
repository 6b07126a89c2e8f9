package com.shardfeed.feed.alert;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
