package com.leaguebot.api.scheduling;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

final class TimedJobHandle {
    private final String jobId;
    private final Instant scheduledAt;
    private final TimedJob job;
    private volatile ScheduledFuture<?> future;
    private volatile boolean fired;

    TimedJobHandle(String jobId, Instant scheduledAt, TimedJob job) {
        this.jobId = jobId;
        this.scheduledAt = scheduledAt;
        this.job = job;
    }

    String getJobId() { return jobId; }
    Instant getScheduledAt() { return scheduledAt; }
    TimedJob getJob() { return job; }
    ScheduledFuture<?> getFuture() { return future; }
    void setFuture(ScheduledFuture<?> future) { this.future = future; }
    boolean isFired() { return fired; }
    void markFired() { this.fired = true; }

    // a fired job is left running; stop only disarms timers that have not gone off
    void stop() {
        ScheduledFuture<?> f = future;
        if (!fired && f != null && !f.isDone()) {
            f.cancel(false);
        }
    }
}
