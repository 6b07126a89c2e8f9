package com.shardfeed.feed.scheduler;

public interface Cancellable {

    /**
     * 이후 tick 중단 (실행 중인 tick은 끝까지 실행)
     */
    void cancel();

    boolean isCancelled();
}
