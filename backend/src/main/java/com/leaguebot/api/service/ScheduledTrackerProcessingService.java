package com.leaguebot.api.service;

import com.leaguebot.api.dto.BatchProcessingResult;
import com.leaguebot.api.exception.ResourceNotFoundException;
import com.leaguebot.api.exception.ScheduleStateException;
import com.leaguebot.api.exception.SchedulerNotReadyException;
import com.leaguebot.api.model.ScheduledProcessingStatus;
import com.leaguebot.api.model.ScheduledTrackerProcessing;
import com.leaguebot.api.repository.GuildRepository;
import com.leaguebot.api.repository.ScheduledTrackerProcessingRepository;
import com.leaguebot.api.scheduling.ScheduledProcessingExecutor;
import com.leaguebot.api.scheduling.ScheduledProcessingJob;
import com.leaguebot.api.scheduling.TimedJobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Schedules guild-wide tracker refreshes for a future instant.
 * <p>
 * Each schedule is stored as a {@code PENDING} row and armed in the {@link TimedJobRegistry} under
 * {@code "scheduled-processing-" + id}. When the timer fires the guild's trackers are handed to
 * {@link TrackerBatchProcessor} and the row moves to {@code COMPLETED} or {@code FAILED}. The
 * registry is in-memory only, so pending rows are re-armed once at startup before the web
 * server takes requests; rows whose time passed while the process was down fire right away.
 * <p>
 * Terminal writes only apply to rows that are still {@code PENDING}, which settles a cancel that
 * races a firing timer in favour of whichever write lands first.
 */
@Service
public class ScheduledTrackerProcessingService implements ScheduledProcessingExecutor, SmartInitializingSingleton {
    private static final Logger log = LoggerFactory.getLogger(ScheduledTrackerProcessingService.class);

    private final ScheduledTrackerProcessingRepository scheduleRepository;
    private final GuildRepository guildRepository;
    private final TrackerBatchProcessor batchProcessor;
    private final TimedJobRegistry jobRegistry;

    private final AtomicBoolean recoveryStarted = new AtomicBoolean(false);
    private volatile boolean recovered = false;

    public ScheduledTrackerProcessingService(ScheduledTrackerProcessingRepository scheduleRepository,
                                             GuildRepository guildRepository,
                                             TrackerBatchProcessor batchProcessor,
                                             TimedJobRegistry jobRegistry) {
        this.scheduleRepository = scheduleRepository;
        this.guildRepository = guildRepository;
        this.batchProcessor = batchProcessor;
        this.jobRegistry = jobRegistry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        loadPendingOnStartup();
    }

    /**
     * Creates a {@code PENDING} schedule and arms its timer.
     *
     * @throws IllegalArgumentException if {@code scheduledAt} is not strictly in the future or a required field is blank
     * @throws ResourceNotFoundException if the guild does not exist
     * @throws SchedulerNotReadyException if pending schedules have not been reloaded yet
     */
    public ScheduledTrackerProcessing createSchedule(String guildId, Instant scheduledAt, String createdBy, Map<String, Object> metadata) {
        if (!recovered) {
            throw new SchedulerNotReadyException("Scheduled processing is not ready: pending schedules are still being restored");
        }
        if (guildId == null || guildId.isBlank()) throw new IllegalArgumentException("guildId is required");
        if (createdBy == null || createdBy.isBlank()) throw new IllegalArgumentException("createdBy is required");
        if (scheduledAt == null) throw new IllegalArgumentException("scheduledAt is required");
        if (!scheduledAt.isAfter(Instant.now())) {
            throw new IllegalArgumentException("Scheduled date must be in the future");
        }
        if (!guildRepository.existsById(guildId)) {
            throw new ResourceNotFoundException("Guild " + guildId + " not found");
        }

        ScheduledTrackerProcessing schedule = scheduleRepository.save(
                new ScheduledTrackerProcessing(guildId, scheduledAt, createdBy, metadata));
        try {
            arm(schedule);
        } catch (RuntimeException e) {
            log.error("[ScheduledProcessing][Create] Could not arm timer for schedule {}: {}", schedule.getId(), e.getMessage(), e);
            scheduleRepository.markTerminal(schedule.getId(), ScheduledProcessingStatus.FAILED, Instant.now(),
                    "Could not schedule timer: " + e.getMessage());
            throw e;
        }

        log.info("[ScheduledProcessing][Create] id={} guildId={} scheduledAt={} createdBy={}",
                schedule.getId(), guildId, scheduledAt, createdBy);
        return schedule;
    }

    public ScheduledTrackerProcessing getSchedule(String id) {
        return scheduleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule " + id + " not found"));
    }

    /**
     * Schedules of a guild ordered by firing time. An explicit {@code status} wins over
     * {@code includeCompleted}; {@code includeCompleted == false} hides completed rows.
     */
    public List<ScheduledTrackerProcessing> getSchedulesForGuild(String guildId, ScheduledProcessingStatus status, Boolean includeCompleted) {
        if (status != null) {
            return scheduleRepository.findByGuildIdAndStatusOrderByScheduledAtAsc(guildId, status);
        }
        if (Boolean.FALSE.equals(includeCompleted)) {
            return scheduleRepository.findByGuildIdAndStatusNotOrderByScheduledAtAsc(guildId, ScheduledProcessingStatus.COMPLETED);
        }
        return scheduleRepository.findByGuildIdOrderByScheduledAtAsc(guildId);
    }

    /**
     * Cancels a {@code PENDING} schedule.
     *
     * @throws ResourceNotFoundException if there is no such schedule
     * @throws ScheduleStateException if the schedule already reached a terminal status
     */
    public ScheduledTrackerProcessing cancelSchedule(String id) {
        ScheduledTrackerProcessing schedule = getSchedule(id);
        if (schedule.getStatus() != ScheduledProcessingStatus.PENDING) {
            throw new ScheduleStateException(id, schedule.getStatus(),
                    "Cannot cancel schedule with status " + schedule.getStatus());
        }

        releaseJob(ScheduledProcessingJob.jobIdFor(id));

        int updated = scheduleRepository.markTerminal(id, ScheduledProcessingStatus.CANCELLED, null, null);
        if (updated == 0) {
            ScheduledTrackerProcessing current = getSchedule(id);
            throw new ScheduleStateException(id, current.getStatus(),
                    "Schedule " + id + " moved to " + current.getStatus() + " before it could be cancelled");
        }

        schedule.setStatus(ScheduledProcessingStatus.CANCELLED);
        schedule.setUpdatedAt(Instant.now());
        log.info("[ScheduledProcessing][Cancel] id={} guildId={}", id, schedule.getGuildId());
        return schedule;
    }

    /**
     * Re-arms every {@code PENDING} schedule. Runs once per process; later calls are ignored.
     */
    public void loadPendingOnStartup() {
        if (!recoveryStarted.compareAndSet(false, true)) {
            log.warn("[ScheduledProcessing][Recovery] pending schedules already loaded, ignoring");
            return;
        }
        List<ScheduledTrackerProcessing> pending = scheduleRepository.findPending();
        Instant now = Instant.now();
        int armed = 0;
        int overdue = 0;
        for (ScheduledTrackerProcessing schedule : pending) {
            String jobId = ScheduledProcessingJob.jobIdFor(schedule.getId());
            if (jobRegistry.isScheduled(jobId)) {
                continue;
            }
            try {
                arm(schedule);
                armed++;
                if (!schedule.getScheduledAt().isAfter(now)) {
                    overdue++;
                    log.info("[ScheduledProcessing][Recovery] id={} was due at {}, firing now", schedule.getId(), schedule.getScheduledAt());
                }
            } catch (RuntimeException e) {
                log.error("[ScheduledProcessing][Recovery] Could not re-arm schedule {}: {}", schedule.getId(), e.getMessage(), e);
            }
        }
        recovered = true;
        log.info("[ScheduledProcessing][Recovery] pending={} armed={} overdue={}", pending.size(), armed, overdue);
    }

    boolean isReady() {
        return recovered;
    }

    @Override
    public void executeSchedule(String scheduleId, String guildId) {
        String jobId = ScheduledProcessingJob.jobIdFor(scheduleId);

        ScheduledTrackerProcessing current;
        try {
            current = scheduleRepository.findById(scheduleId).orElse(null);
        } catch (RuntimeException e) {
            // the timer is already gone; the row stays PENDING until the next restart re-arms it
            log.error("[ScheduledProcessing][Execute] id={} could not be loaded, left PENDING: {}", scheduleId, e.getMessage(), e);
            releaseJob(jobId);
            throw e;
        }
        if (current == null || current.getStatus() != ScheduledProcessingStatus.PENDING) {
            log.warn("[ScheduledProcessing][Execute] id={} is {}, skipping", scheduleId,
                    current == null ? "gone" : current.getStatus());
            releaseJob(jobId);
            return;
        }

        log.info("[ScheduledProcessing][Execute] id={} guildId={}", scheduleId, guildId);
        BatchProcessingResult result;
        try {
            result = batchProcessor.processPendingForGuild(guildId);
        } catch (RuntimeException e) {
            recordFailure(scheduleId, e);
            releaseJob(jobId);
            throw e;
        }

        int updated = scheduleRepository.markTerminal(scheduleId, ScheduledProcessingStatus.COMPLETED, Instant.now(), null);
        releaseJob(jobId);
        if (updated == 0) {
            log.warn("[ScheduledProcessing][Execute] id={} was no longer PENDING when the batch finished, processed={}, status not changed",
                    scheduleId, result.getProcessedCount());
            return;
        }
        log.info("[ScheduledProcessing][Completed] id={} guildId={} processed={}", scheduleId, guildId, result.getProcessedCount());
    }

    private void arm(ScheduledTrackerProcessing schedule) {
        ScheduledProcessingJob job = new ScheduledProcessingJob(schedule.getId(), schedule.getGuildId(), this);
        jobRegistry.schedule(job.getJobId(), schedule.getScheduledAt(), job);
    }

    private void recordFailure(String scheduleId, RuntimeException error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("[ScheduledProcessing][Failed] id={}: {}", scheduleId, message);
        try {
            int updated = scheduleRepository.markTerminal(scheduleId, ScheduledProcessingStatus.FAILED, Instant.now(), message);
            if (updated == 0) {
                log.warn("[ScheduledProcessing][Failed] id={} is no longer PENDING, status not changed", scheduleId);
            }
        } catch (RuntimeException dbError) {
            log.error("[ScheduledProcessing][Failed] Could not record FAILED for {}: {}", scheduleId, dbError.getMessage());
            error.addSuppressed(dbError);
        }
    }

    // timer cleanup never fails the caller
    private void releaseJob(String jobId) {
        try {
            jobRegistry.cancel(jobId);
        } catch (RuntimeException e) {
            log.error("[ScheduledProcessing] Error releasing timed job {}: {}", jobId, e.getMessage());
        }
    }
}
