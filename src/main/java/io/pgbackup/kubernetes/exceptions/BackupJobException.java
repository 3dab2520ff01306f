package io.pgbackup.kubernetes.exceptions;

import lombok.Getter;

/**
 * Root of the failures raised while preparing or submitting a backup job.
 * <p>
 * Retryable failures are transient conditions (network, API server, secret backend); callers
 * may retry them with a bounded backoff. Everything else must be surfaced as-is.
 */
@Getter
public abstract class BackupJobException extends Exception {
    private final boolean retryable;

    protected BackupJobException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected BackupJobException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
