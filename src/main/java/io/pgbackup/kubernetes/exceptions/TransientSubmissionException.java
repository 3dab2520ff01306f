package io.pgbackup.kubernetes.exceptions;

/**
 * The API server could not be reached or was temporarily unable to accept the job.
 */
public class TransientSubmissionException extends SubmissionException {
    public TransientSubmissionException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
