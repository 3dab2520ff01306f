package io.pgbackup.kubernetes.exceptions;

/**
 * The cluster refused the job: authorization, quota, admission or a malformed manifest.
 */
public class SubmissionException extends BackupJobException {
    public SubmissionException(String message, Throwable cause) {
        super(message, false, cause);
    }

    protected SubmissionException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
    }
}
