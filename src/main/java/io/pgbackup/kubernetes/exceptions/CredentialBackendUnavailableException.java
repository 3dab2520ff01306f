package io.pgbackup.kubernetes.exceptions;

public class CredentialBackendUnavailableException extends BackupJobException {
    public CredentialBackendUnavailableException(String message, Throwable cause) {
        super(message, true, cause);
    }

    public CredentialBackendUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
    }
}
