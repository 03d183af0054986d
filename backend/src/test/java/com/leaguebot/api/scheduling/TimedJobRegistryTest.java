package com.leaguebot.api.scheduling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TimedJobRegistryTest {

    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private TimedJobRegistry registry;
    private ThreadPoolTaskScheduler realScheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        registry = new TimedJobRegistry(taskScheduler);
    }

    @AfterEach
    void tearDown() {
        if (realScheduler != null) realScheduler.shutdown();
    }

    @Test
    void scheduleRegistersOneEntryAtTheRequestedTime() {
        Instant at = Instant.now().plusSeconds(3600);
        registry.schedule("job-1", at, () -> {});

        assertThat(registry.listIds()).containsExactly("job-1");
        assertThat(registry.isScheduled("job-1")).isTrue();
        verify(taskScheduler).schedule(any(Runnable.class), eq(at));
    }

    @Test
    void duplicateJobIdIsRejectedAndFirstEntryKept() {
        Instant at = Instant.now().plusSeconds(60);
        registry.schedule("job-1", at, () -> {});

        assertThatThrownBy(() -> registry.schedule("job-1", at.plusSeconds(5), () -> {}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("job-1");
        assertThat(registry.size()).isEqualTo(1);
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void schedulerRejectionLeavesNoEntryBehind() {
        doThrow(new IllegalStateException("scheduler shut down"))
                .when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        assertThatThrownBy(() -> registry.schedule("job-1", Instant.now().plusSeconds(60), () -> {}))
                .hasMessage("scheduler shut down");
        assertThat(registry.size()).isZero();
    }

    @Test
    void cancelDisarmsTimerAndRemovesEntry() {
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> {});

        registry.cancel("job-1");

        verify(future).cancel(false);
        assertThat(registry.isScheduled("job-1")).isFalse();
    }

    @Test
    void cancelUnknownIdIsNoOp() {
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> {});

        assertThatCode(() -> registry.cancel("missing")).doesNotThrowAnyException();
        assertThat(registry.listIds()).containsExactly("job-1");
        verify(future, never()).cancel(anyBoolean());
    }

    @Test
    void cancelTwiceBehavesLikeCancelOnce() {
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> {});

        registry.cancel("job-1");
        registry.cancel("job-1");

        verify(future, times(1)).cancel(false);
        assertThat(registry.size()).isZero();
    }

    @Test
    void cancelSwallowsStopFailureAndStillRemovesEntry() {
        when(future.cancel(false)).thenThrow(new RuntimeException("boom"));
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> {});

        assertThatCode(() -> registry.cancel("job-1")).doesNotThrowAnyException();
        assertThat(registry.isScheduled("job-1")).isFalse();
    }

    @Test
    void stopAllContinuesPastAFailingEntry() {
        ScheduledFuture<?> failing = mock(ScheduledFuture.class);
        ScheduledFuture<?> healthy = mock(ScheduledFuture.class);
        when(failing.cancel(false)).thenThrow(new RuntimeException("boom"));
        doReturn(failing).doReturn(healthy).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        registry.schedule("job-a", Instant.now().plusSeconds(60), () -> {});
        registry.schedule("job-b", Instant.now().plusSeconds(60), () -> {});

        assertThatCode(() -> registry.stopAll()).doesNotThrowAnyException();
        verify(failing).cancel(false);
        verify(healthy).cancel(false);
        assertThat(registry.listIds()).isEmpty();
    }

    @Test
    void listIdsIsASnapshot() {
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> {});
        var ids = registry.listIds();

        registry.schedule("job-2", Instant.now().plusSeconds(60), () -> {});

        assertThat(ids).containsExactly("job-1");
        assertThatThrownBy(() -> ids.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void firingRunsJobOnceAndForgetsEntry() {
        AtomicInteger runs = new AtomicInteger();
        registry.schedule("job-1", Instant.now().plusSeconds(60), runs::incrementAndGet);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Instant.class));

        task.getValue().run();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(registry.isScheduled("job-1")).isFalse();
    }

    @Test
    void firingJobThatThrowsRethrowsAndForgetsEntry() {
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> { throw new IllegalStateException("batch failed"); });
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Instant.class));

        assertThatThrownBy(() -> task.getValue().run()).hasMessage("batch failed");
        assertThat(registry.size()).isZero();
    }

    @Test
    void jobCancellingItselfWhileRunningDoesNotInterruptIt() {
        registry.schedule("job-1", Instant.now().plusSeconds(60), () -> registry.cancel("job-1"));
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Instant.class));

        task.getValue().run();

        verify(future, never()).cancel(anyBoolean());
        assertThat(registry.size()).isZero();
    }

    @Test
    void pastFiringTimeRunsPromptlyOnRealScheduler() throws Exception {
        realScheduler = new ThreadPoolTaskScheduler();
        realScheduler.setPoolSize(1);
        realScheduler.setThreadNamePrefix("test-sched-");
        realScheduler.initialize();
        TimedJobRegistry live = new TimedJobRegistry(realScheduler);
        CountDownLatch fired = new CountDownLatch(1);

        live.schedule("overdue", Instant.now().minusSeconds(3600), fired::countDown);

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        long deadline = System.currentTimeMillis() + 5000;
        while (live.size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(live.size()).isZero();
    }
}
