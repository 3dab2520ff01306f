package io.pgbackup.kubernetes.services;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import io.pgbackup.kubernetes.exceptions.BackupJobException;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Bounded exponential retries of {@link BackupJobException#isRetryable() retryable} failures.
 */
@Slf4j
@Builder
@Getter
public class RetryService {
    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration initialInterval = Duration.ofMillis(500);

    @Builder.Default
    private final Duration maxInterval = Duration.ofSeconds(10);

    @FunctionalInterface
    public interface CheckedSupplier<T> {
        T get() throws BackupJobException;
    }

    public static RetryService ofDefaults() {
        return RetryService.builder().build();
    }

    /**
     * Runs {@code call}, retrying it while it fails with a retryable {@link BackupJobException}.
     *
     * @param where a short description used in logs
     * @return the first successful result
     * @throws BackupJobException the non-retryable failure, or the last retryable one once attempts are exhausted
     */
    public <T> T run(String where, CheckedSupplier<T> call) throws BackupJobException {
        Retryer<T> retryer = RetryerBuilder.<T>newBuilder()
            .retryIfException(t -> t instanceof BackupJobException && ((BackupJobException) t).isRetryable())
            .withWaitStrategy(WaitStrategies.exponentialWait(
                // exponentialWait sleeps multiplier * 2^attempt
                Math.max(1L, initialInterval.toMillis() / 2),
                maxInterval.toMillis(),
                TimeUnit.MILLISECONDS
            ))
            .withStopStrategy(StopStrategies.stopAfterAttempt(maxAttempts))
            .withRetryListener(new RetryListener() {
                @Override
                public <V> void onRetry(Attempt<V> attempt) {
                    if (attempt.hasException()) {
                        log.debug("Attempt {}/{} of '{}' failed: {}", attempt.getAttemptNumber(), maxAttempts, where, attempt.getExceptionCause().getMessage());
                    }
                }
            })
            .build();

        try {
            return retryer.call(call::get);
        } catch (RetryException e) {
            Throwable last = e.getLastFailedAttempt().getExceptionCause();
            log.warn("Giving up on '{}' after {} attempts", where, e.getNumberOfFailedAttempts());
            throw unwrap(last);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static BackupJobException unwrap(Throwable throwable) {
        if (throwable instanceof BackupJobException) {
            return (BackupJobException) throwable;
        }

        if (throwable instanceof RuntimeException) {
            throw (RuntimeException) throwable;
        }

        if (throwable instanceof Error) {
            throw (Error) throwable;
        }

        throw new IllegalStateException(throwable);
    }
}
