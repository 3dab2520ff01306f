package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.pgbackup.kubernetes.models.JobHandle;
import io.pgbackup.kubernetes.models.JobPhase;
import io.pgbackup.kubernetes.models.JobState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls the status of a submitted job until it completes, the deadline passes or the caller cancels.
 * <p>
 * The job moves through {@code SUBMITTED -> PENDING -> RUNNING -> SUCCEEDED | FAILED}. A deadline
 * reached from any non terminal phase ends the wait as {@link Termination#TIMED_OUT}, a job that
 * disappears before completing ends it as {@link Termination#VANISHED}. Between two polls the
 * thread blocks on the cancellation token, so a cancellation is seen immediately.
 */
@Slf4j
public class CompletionWaiter {
    public static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    public enum Termination {
        COMPLETED,
        TIMED_OUT,
        CANCELLED,
        VANISHED
    }

    @FunctionalInterface
    public interface Sleeper {
        /**
         * @return {@code true} if the wait was cancelled while sleeping
         */
        boolean sleep(Duration duration, CancellationToken cancellation) throws InterruptedException;
    }

    @Builder
    @Getter
    @ToString
    public static class Result {
        private final Termination termination;

        /**
         * The last state read from the cluster, {@link JobPhase#SUBMITTED} if none could be read.
         */
        private final JobState lastState;

        private final int polls;

        private final Duration elapsed;
    }

    private final ClusterJobClient client;
    @Getter
    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    public CompletionWaiter(ClusterJobClient client) {
        this(client, DEFAULT_POLL_INTERVAL);
    }

    public CompletionWaiter(ClusterJobClient client, Duration pollInterval) {
        this(client, pollInterval, Clock.systemUTC(), (duration, cancellation) -> cancellation.await(duration));
    }

    public CompletionWaiter(ClusterJobClient client, Duration pollInterval, Clock clock, Sleeper sleeper) {
        this.client = client;
        this.pollInterval = pollInterval == null || pollInterval.compareTo(MIN_POLL_INTERVAL) < 0 ? MIN_POLL_INTERVAL : pollInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * An interrupt ends the wait as {@link Termination#CANCELLED} and leaves the interrupt flag set.
     */
    public Result await(JobHandle handle, Duration timeout, CancellationToken cancellation) {
        Instant start = clock.instant();
        Instant deadline = start.plus(timeout);
        JobState last = JobState.of(JobPhase.SUBMITTED);
        int polls = 0;

        log.debug("Waiting up to {} for job '{}' polling every {}", timeout, handle.getName(), pollInterval);

        while (true) {
            if (cancellation.isCancelled()) {
                return result(Termination.CANCELLED, last, polls, start);
            }

            try {
                JobState state = client.getStatus(handle);
                polls++;

                if (state.getPhase() != last.getPhase()) {
                    log.info("Job '{}' is {} (was {})", handle.getName(), state.getPhase(), last.getPhase());
                }

                if (state.getPhase() == JobPhase.NOT_FOUND) {
                    log.warn("Job '{}' disappeared while {}", handle.getName(), last.getPhase());
                    return result(Termination.VANISHED, state, polls, start);
                }

                last = state;

                if (state.isTerminal()) {
                    return result(Termination.COMPLETED, state, polls, start);
                }
            } catch (KubernetesClientException e) {
                log.warn("Unable to read the status of job '{}', retrying on next poll: {}", handle.getName(), KubernetesErrors.describe(e));
            } catch (RuntimeException e) {
                log.warn("Unexpected status of job '{}', retrying on next poll", handle.getName(), e);
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                log.warn("Job '{}' did not complete within {}, last seen {}", handle.getName(), timeout, last.getPhase());
                return result(Termination.TIMED_OUT, last, polls, start);
            }

            try {
                if (sleeper.sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval, cancellation)) {
                    return result(Termination.CANCELLED, last, polls, start);
                }
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for job '{}', last seen {}", handle.getName(), last.getPhase());
                Thread.currentThread().interrupt();

                return result(Termination.CANCELLED, last, polls, start);
            }
        }
    }

    private Result result(Termination termination, JobState state, int polls, Instant start) {
        return Result.builder()
            .termination(termination)
            .lastState(state)
            .polls(polls)
            .elapsed(Duration.between(start, clock.instant()))
            .build();
    }
}
