package com.example.loqueue.queue;

import com.example.loqueue.model.QueuedJob;
import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClaimLoopTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration POLL = Duration.ofMillis(100);

    @Mock
    private QueueStore store;
    @Mock
    private TaskScheduler scheduler;
    @Mock
    private ScheduledFuture<?> future;

    private final PayloadCodec codec = new PayloadCodec(new ObjectMapper());
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<Throwable> reported = new CopyOnWriteArrayList<>();
    private PseudoTransactionManager txManager;

    @BeforeEach
    void setUp() {
        txManager = new PseudoTransactionManager();
        lenient().when(scheduler.getClock()).thenReturn(clock);
    }

    private ClaimLoop loop(JobProcessor processor) {
        return new ClaimLoop("emails", processor, (queue, error) -> reported.add(error), store, codec,
                new TransactionTemplate(txManager), scheduler, clock, POLL);
    }

    private static QueuedJob oneShot(long id, boolean deleteOnAcknowledged) {
        QueuedJob job = new QueuedJob("emails", "{\"n\":1}", null, deleteOnAcknowledged, NOW.minusSeconds(1));
        job.setId(id);
        return job;
    }

    private static QueuedJob recurring(long id, int everySecs, Instant lastRun) {
        QueuedJob job = new QueuedJob("emails", "\"tick\"", everySecs, true, lastRun);
        job.setId(id);
        return job;
    }

    @Test
    void idleWhenNothingIsDue() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.empty());

        ClaimOutcome outcome = loop(job -> {
            throw new AssertionError("processor must not run");
        }).runOnce();

        assertThat(outcome).isEqualTo(ClaimOutcome.IDLE);
        assertThat(txManager.commits).hasValue(1);
    }

    @Test
    void oneShotJobIsDeletedAfterProcessing() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(1L, true)));
        AtomicReference<Integer> seen = new AtomicReference<>();

        ClaimOutcome outcome = loop(job -> {
            seen.set(job.data().get("n").asInt());
            return "ignored";
        }).runOnce();

        assertThat(outcome).isEqualTo(ClaimOutcome.PROCESSED);
        assertThat(seen).hasValue(1);
        verify(store).deleteJob(1L);
        verify(store, never()).recordResult(anyLong(), anyString(), any());
        verify(store, never()).reschedule(anyLong(), any());
    }

    @Test
    void oneShotKeepingResultRecordsReturnValueThenDeletes() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(2L, false)));

        loop(job -> Map.of("echo", job.data().get("n").asInt())).runOnce();

        verify(store).recordResult(2L, "{\"echo\":1}", NOW);
        verify(store).deleteJob(2L);
    }

    @Test
    void recurringJobOnScheduleRestartsFromClaimTime() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(recurring(3L, 5, NOW.minusSeconds(6))));

        loop(job -> null).runOnce();

        verify(store).reschedule(3L, NOW);
        verify(store, never()).deleteJob(anyLong());
    }

    @Test
    void recurringJobFarBehindCatchesUpOneInterval() {
        Instant lastRun = NOW.minusSeconds(60);
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(recurring(4L, 5, lastRun)));

        loop(job -> null).runOnce();

        verify(store).reschedule(4L, lastRun.plusSeconds(5));
    }

    @Test
    void processorFailureRollsBackWithoutWrites() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(5L, false)));

        assertThatThrownBy(() -> loop(job -> {
            throw new IOException("smtp down");
        }).runOnce())
                .isInstanceOf(JobProcessingException.class)
                .hasMessageContaining("job 5")
                .hasRootCauseInstanceOf(IOException.class);

        assertThat(txManager.rollbacks).hasValue(1);
        assertThat(txManager.commits).hasValue(0);
        verify(store, never()).deleteJob(anyLong());
        verify(store, never()).recordResult(anyLong(), anyString(), any());
    }

    @Test
    void removeInsideProcessorIsNotRepeated() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(6L, true)));

        loop(job -> {
            job.remove();
            return null;
        }).runOnce();

        verify(store, times(1)).deleteJob(6L);
    }

    @Test
    void removedRecurringJobIsNotRescheduled() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(recurring(7L, 5, NOW.minusSeconds(6))));

        loop(job -> {
            job.remove();
            return null;
        }).runOnce();

        verify(store).deleteJob(7L);
        verify(store, never()).reschedule(anyLong(), any());
    }

    @Test
    void nextIterationIsImmediateAfterWorkAndDelayedWhenIdle() {
        when(store.claimNext("emails", NOW))
                .thenReturn(Optional.of(oneShot(8L, true)))
                .thenReturn(Optional.empty());
        ClaimLoop loop = loop(job -> null);

        loop.start();
        loop.iterate();
        loop.iterate();

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(scheduler, times(3)).schedule(any(Runnable.class), at.capture());
        assertThat(at.getAllValues()).containsExactly(NOW, NOW, NOW.plus(POLL));
    }

    @Test
    void failedIterationIsReportedAndRetriedAfterPollInterval() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(9L, true)));
        ClaimLoop loop = loop(job -> {
            throw new IllegalStateException("boom");
        });

        loop.iterate();

        assertThat(reported).singleElement().isInstanceOf(JobProcessingException.class);
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(POLL)));
    }

    @Test
    void errorThrownByProcessorIsReportedAndRetried() {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(11L, true)));
        ClaimLoop loop = loop(job -> {
            throw new AssertionError("callback bug");
        });

        loop.iterate();

        assertThat(reported).singleElement()
                .isInstanceOf(JobProcessingException.class)
                .satisfies(e -> assertThat(e.getCause()).isInstanceOf(AssertionError.class));
        assertThat(txManager.rollbacks).hasValue(1);
        assertThat(loop.isCancelled()).isFalse();
        verify(store, never()).deleteJob(anyLong());
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(POLL)));
    }

    @Test
    void errorOutsideProcessorIsReportedAndRetried() {
        when(store.claimNext("emails", NOW)).thenThrow(new NoClassDefFoundError("org/h2/Driver"));
        ClaimLoop loop = loop(job -> null);

        loop.iterate();

        assertThat(reported).singleElement().isInstanceOf(NoClassDefFoundError.class);
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(POLL)));
    }

    @Test
    void virtualMachineErrorStopsTheLoop() throws Exception {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(12L, true)));
        ClaimLoop loop = loop(job -> {
            throw new OutOfMemoryError("heap");
        });

        assertThatThrownBy(loop::iterate).isInstanceOf(OutOfMemoryError.class);

        assertThat(reported).isEmpty();
        assertThat(loop.isCancelled()).isTrue();
        assertThat(loop.awaitStopped(Duration.ZERO)).isTrue();
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void throwingErrorHandlerDoesNotKillTheLoop() {
        when(store.claimNext("emails", NOW)).thenThrow(new IllegalStateException("db gone"));
        ClaimLoop loop = new ClaimLoop("emails", job -> null, (queue, error) -> {
            throw new IllegalStateException("handler broke");
        }, store, codec, new TransactionTemplate(txManager), scheduler, clock, POLL);

        loop.iterate();

        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(POLL)));
    }

    @Test
    void cancelBeforeNextIterationStopsTheLoop() throws Exception {
        doReturn(future).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        when(future.cancel(false)).thenReturn(true);
        ClaimLoop loop = loop(job -> null);

        loop.start();
        loop.cancel();

        assertThat(loop.isCancelled()).isTrue();
        assertThat(loop.awaitStopped(Duration.ZERO)).isTrue();
    }

    @Test
    void cancelAfterIterationScheduledNextStopsTheLoop() throws Exception {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.empty());
        doReturn(future).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        ClaimLoop loop = loop(job -> null);

        loop.iterate();
        loop.cancel();

        verify(future).cancel(false);
        assertThat(loop.awaitStopped(Duration.ZERO)).isTrue();
    }

    @Test
    void cancelWhileNextIterationIsAlreadyRunningStillStops() throws Exception {
        doReturn(future).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        when(future.cancel(false)).thenReturn(false);
        ClaimLoop loop = loop(job -> null);

        loop.start();
        loop.cancel();
        loop.iterate();

        assertThat(loop.awaitStopped(Duration.ZERO)).isTrue();
        verify(store, never()).claimNext(anyString(), any());
    }

    @Test
    void cancelDuringProcessingLetsJobFinishThenStops() throws Exception {
        when(store.claimNext("emails", NOW)).thenReturn(Optional.of(oneShot(10L, true)));
        AtomicReference<ClaimLoop> self = new AtomicReference<>();
        ClaimLoop loop = loop(job -> {
            self.get().cancel();
            return null;
        });
        self.set(loop);

        loop.iterate();

        verify(store).deleteJob(10L);
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertThat(loop.awaitStopped(Duration.ZERO)).isTrue();
    }

    @Test
    void rejectedSchedulingStopsTheLoop() throws Exception {
        doThrow(new TaskRejectedException("pool shut down"))
                .when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        ClaimLoop loop = loop(job -> null);

        loop.start();

        assertThat(loop.isCancelled()).isTrue();
        assertThat(loop.awaitStopped(Duration.ZERO)).isTrue();
    }
}
