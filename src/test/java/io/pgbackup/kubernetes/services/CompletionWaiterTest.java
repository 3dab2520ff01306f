package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.pgbackup.kubernetes.TestUtils;
import io.pgbackup.kubernetes.models.JobHandle;
import io.pgbackup.kubernetes.models.JobPhase;
import io.pgbackup.kubernetes.models.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompletionWaiterTest {
    private static final JobHandle HANDLE = JobHandle.builder().name("pg-s3-backup-abc").namespace("test").build();

    @Mock
    private ClusterJobClient client;

    private TestUtils.MutableClock clock;
    private List<Duration> sleeps;
    private CompletionWaiter waiter;

    @BeforeEach
    void setUp() {
        clock = TestUtils.MutableClock.startingNow();
        sleeps = new ArrayList<>();
        waiter = new CompletionWaiter(client, Duration.ofSeconds(5), clock, (duration, cancellation) -> {
            sleeps.add(duration);
            clock.advance(duration);
            return cancellation.isCancelled();
        });
    }

    @Test
    void completes() throws Exception {
        when(client.getStatus(HANDLE)).thenReturn(
            JobState.of(JobPhase.PENDING),
            JobState.of(JobPhase.RUNNING),
            JobState.of(JobPhase.RUNNING),
            JobState.succeeded(0)
        );

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(10), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.COMPLETED));
        assertThat(result.getLastState().getPhase(), is(JobPhase.SUCCEEDED));
        assertThat(result.getPolls(), is(4));
        assertThat(result.getElapsed(), is(Duration.ofSeconds(15)));
        assertThat(sleeps, everyItem(is(Duration.ofSeconds(5))));
    }

    @Test
    void failedIsTerminal() throws Exception {
        when(client.getStatus(HANDLE)).thenReturn(JobState.of(JobPhase.RUNNING), JobState.failed(2, "Error"));

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(10), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.COMPLETED));
        assertThat(result.getLastState().getExitCode(), is(2));
    }

    @Test
    void timesOutWhileRunning() throws Exception {
        when(client.getStatus(HANDLE)).thenReturn(JobState.of(JobPhase.RUNNING));

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(30), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.TIMED_OUT));
        assertThat(result.getLastState().getPhase(), is(JobPhase.RUNNING));
        assertThat(result.getElapsed(), is(Duration.ofMinutes(30)));
        // 30 minutes at 5 seconds: one poll at start plus one after every sleep
        assertThat(result.getPolls(), is(361));
    }

    @Test
    void lastSleepIsCutToTheDeadline() throws Exception {
        when(client.getStatus(HANDLE)).thenReturn(JobState.of(JobPhase.PENDING));

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofSeconds(12), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.TIMED_OUT));
        assertThat(sleeps, contains(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(2)));
    }

    @Test
    void vanishedJob() throws Exception {
        when(client.getStatus(HANDLE)).thenReturn(JobState.of(JobPhase.RUNNING), JobState.notFound());

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(10), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.VANISHED));
        verify(client, times(2)).getStatus(HANDLE);
    }

    @Test
    void statusErrorsKeepPolling() throws Exception {
        when(client.getStatus(HANDLE))
            .thenThrow(new KubernetesClientException("connection reset"))
            .thenReturn(JobState.succeeded(0));

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(10), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.COMPLETED));
    }

    @Test
    void unexpectedStatusErrorsKeepPolling() throws Exception {
        when(client.getStatus(HANDLE))
            .thenThrow(new IllegalStateException("unexpected job status"))
            .thenReturn(JobState.of(JobPhase.RUNNING), JobState.failed(1, "Error"));

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(10), new CancellationToken());

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.COMPLETED));
        assertThat(result.getLastState().getPhase(), is(JobPhase.FAILED));
        assertThat(result.getPolls(), is(2));
    }

    @Test
    void interruptKeepsLastState() {
        when(client.getStatus(HANDLE)).thenReturn(JobState.of(JobPhase.RUNNING));
        CompletionWaiter interrupted = new CompletionWaiter(client, Duration.ofSeconds(5), clock, (duration, cancellation) -> {
            throw new InterruptedException();
        });

        CompletionWaiter.Result result;
        try {
            result = interrupted.await(HANDLE, Duration.ofMinutes(10), new CancellationToken());
        } finally {
            assertThat(Thread.interrupted(), is(true));
        }

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.CANCELLED));
        assertThat(result.getLastState().getPhase(), is(JobPhase.RUNNING));
        assertThat(result.getPolls(), is(1));
    }

    @Test
    void cancelledBeforeFirstPoll() throws Exception {
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();

        CompletionWaiter.Result result = waiter.await(HANDLE, Duration.ofMinutes(10), cancellation);

        assertThat(result.getTermination(), is(CompletionWaiter.Termination.CANCELLED));
        verifyNoInteractions(client);
    }

    @Test
    void pollIntervalHasAFloor() {
        assertThat(new CompletionWaiter(client, Duration.ZERO).getPollInterval(), is(CompletionWaiter.MIN_POLL_INTERVAL));
        assertThat(new CompletionWaiter(client, null).getPollInterval(), is(CompletionWaiter.MIN_POLL_INTERVAL));
        assertThat(new CompletionWaiter(client, Duration.ofSeconds(2)).getPollInterval(), is(Duration.ofSeconds(2)));
    }

    @Test
    void cancellationWakesTheWait() throws Exception {
        CountDownLatch polled = new CountDownLatch(1);
        when(client.getStatus(HANDLE)).thenAnswer(invocation -> {
            polled.countDown();
            return JobState.of(JobPhase.RUNNING);
        });

        CompletionWaiter realWaiter = new CompletionWaiter(client, Duration.ofMinutes(1));
        CancellationToken cancellation = new CancellationToken();
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<CompletionWaiter.Result> future = executor.submit(() -> realWaiter.await(HANDLE, Duration.ofHours(1), cancellation));

            assertThat(polled.await(5, TimeUnit.SECONDS), is(true));
            cancellation.cancel();

            CompletionWaiter.Result result = future.get(5, TimeUnit.SECONDS);
            assertThat(result.getTermination(), is(CompletionWaiter.Termination.CANCELLED));
            verify(client, times(1)).getStatus(HANDLE);
        } finally {
            executor.shutdownNow();
        }
    }
}
