package com.shardfeed.feed.service.feed;

public record Engagement(long likes, long shares, long comments) {
    public static final Engagement NONE = new Engagement(0, 0, 0);

    public Engagement {
        if (likes < 0 || shares < 0 || comments < 0) {
            throw new IllegalArgumentException(
                String.format("Engagement counts must be >= 0: likes=%d shares=%d comments=%d",
                              likes, shares, comments));
        }
    }
}
