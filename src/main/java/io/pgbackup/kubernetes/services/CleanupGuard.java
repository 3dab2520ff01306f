package io.pgbackup.kubernetes.services;

import io.pgbackup.kubernetes.models.CleanupWarning;
import io.pgbackup.kubernetes.models.JobHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns a submitted job and deletes it exactly once, whatever the way the run ends.
 * <p>
 * {@link #close()} never throws: a failed deletion is logged and kept as a {@link CleanupWarning}.
 */
@Slf4j
public class CleanupGuard implements AutoCloseable {
    private final ClusterJobClient client;
    @Getter
    private final JobHandle handle;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile CleanupWarning warning;

    private CleanupGuard(ClusterJobClient client, JobHandle handle) {
        this.client = client;
        this.handle = handle;
    }

    public static CleanupGuard of(ClusterJobClient client, JobHandle handle) {
        return new CleanupGuard(client, handle);
    }

    public boolean isReleased() {
        return released.get();
    }

    public Optional<CleanupWarning> getWarning() {
        return Optional.ofNullable(warning);
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }

        // an interrupted thread can't do I/O, the job must be deleted anyway
        boolean interrupted = Thread.interrupted();

        try {
            client.delete(handle);
        } catch (RuntimeException e) {
            log.warn("Unable to delete job '{}' in namespace '{}', it must be removed manually", handle.getName(), handle.getNamespace(), e);

            warning = CleanupWarning.builder()
                .jobName(handle.getName())
                .namespace(handle.getNamespace())
                .message(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                .build();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
