package com.streamrelay.streamrelay.service.egress;

/**
 * Runs orchestration work (participant lookups and platform calls) off the webhook thread.
 */
public interface EgressTaskScheduler {

    void schedule(Runnable task, long delayMillis);
}
