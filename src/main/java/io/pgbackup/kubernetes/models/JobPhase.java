package io.pgbackup.kubernetes.models;

public enum JobPhase {
    SUBMITTED,
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    NOT_FOUND;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
