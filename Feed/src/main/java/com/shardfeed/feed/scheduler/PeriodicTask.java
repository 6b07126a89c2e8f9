package com.shardfeed.feed.scheduler;

/**
 * 주기 작업. 로직은 onTick에만 두고 스케줄링은 TickScheduler가 담당
 */
public interface PeriodicTask {

    String name();

    void onTick();
}
