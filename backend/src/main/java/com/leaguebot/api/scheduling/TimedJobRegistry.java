package com.leaguebot.api.scheduling;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Keyed registry of one-shot timers on top of Spring's {@link TaskScheduler}.
 * <p>
 * The registry knows nothing about schedules, statuses or persistence: it arms a timer for a job id,
 * runs the job once when the timer fires and forgets the entry afterwards. Stopping timers is
 * best-effort; {@link #cancel(String)} and {@link #stopAll()} log failures instead of throwing.
 * A firing time in the past runs the job as soon as a scheduler thread is free.
 */
@Component
public class TimedJobRegistry {
    private static final Logger log = LoggerFactory.getLogger(TimedJobRegistry.class);

    private final TaskScheduler taskScheduler;
    private final Map<String, TimedJobHandle> jobs = new ConcurrentHashMap<>();

    public TimedJobRegistry(@Qualifier("trackerProcessingTaskScheduler") TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /**
     * Arms a one-shot timer for {@code jobId}.
     *
     * @throws IllegalStateException if a job with the same id is already registered
     */
    public void schedule(String jobId, Instant firingTime, TimedJob job) {
        TimedJobHandle handle = new TimedJobHandle(jobId, firingTime, job);
        if (jobs.putIfAbsent(jobId, handle) != null) {
            throw new IllegalStateException("Timed job already registered: " + jobId);
        }
        try {
            ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(handle), firingTime);
            handle.setFuture(future);
        } catch (RuntimeException e) {
            jobs.remove(jobId, handle);
            throw e;
        }
        log.info("[TimedJobs][Schedule] jobId={} firingTime={}", jobId, firingTime);
    }

    /**
     * Disarms and forgets {@code jobId}. Unknown ids are ignored; stop failures are logged only.
     */
    public void cancel(String jobId) {
        TimedJobHandle handle = jobs.get(jobId);
        if (handle == null) {
            log.debug("[TimedJobs][Cancel] jobId={} not registered", jobId);
            return;
        }
        release(handle);
        log.info("[TimedJobs][Cancel] jobId={}", jobId);
    }

    /**
     * Disarms every registered job. A failure on one job does not stop the others.
     */
    @PreDestroy
    public void stopAll() {
        List<TimedJobHandle> snapshot = new ArrayList<>(jobs.values());
        for (TimedJobHandle handle : snapshot) {
            release(handle);
            log.info("[TimedJobs][Stop] jobId={}", handle.getJobId());
        }
        log.info("[TimedJobs][StopAll] stopped={} remaining={}", snapshot.size(), jobs.size());
    }

    public List<String> listIds() {
        return List.copyOf(jobs.keySet());
    }

    public boolean isScheduled(String jobId) {
        return jobs.containsKey(jobId);
    }

    public int size() {
        return jobs.size();
    }

    private void release(TimedJobHandle handle) {
        try {
            handle.stop();
        } catch (RuntimeException e) {
            log.error("[TimedJobs] Error stopping job {}: {}", handle.getJobId(), e.getMessage(), e);
        } finally {
            jobs.remove(handle.getJobId(), handle);
        }
    }

    private void fire(TimedJobHandle handle) {
        handle.markFired();
        long t0 = System.currentTimeMillis();
        log.info("[TimedJobs][Fire] jobId={} scheduledAt={}", handle.getJobId(), handle.getScheduledAt());
        try {
            handle.getJob().execute();
            log.info("[TimedJobs][Done] jobId={} durationMs={}", handle.getJobId(), System.currentTimeMillis() - t0);
        } catch (RuntimeException e) {
            log.error("[TimedJobs] Error executing job {}: {}", handle.getJobId(), e.getMessage(), e);
            throw e;
        } finally {
            jobs.remove(handle.getJobId(), handle);
        }
    }
}
