package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * The terminal result of one backup run, handed back to the invoking workflow engine.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class JobOutcome {
    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        SUBMISSION_ERROR,
        CANCELLED
    }

    @Schema(
        title = "The classification of the run"
    )
    private final Status status;

    @Schema(
        title = "Exit code of the backup container",
        description = "Only set when the container terminated."
    )
    private final Integer exitCode;

    @Schema(
        title = "Why the run did not succeed"
    )
    private final String reason;

    @Schema(
        title = "The job name"
    )
    private final String jobName;

    @Schema(
        title = "The job namespace"
    )
    private final String namespace;

    @Schema(
        title = "The destination bucket"
    )
    private final String bucket;

    @Schema(
        title = "The destination prefix"
    )
    private final String prefix;

    @Schema(
        title = "Captured container logs",
        description = "Best effort, empty when the logs could not be retrieved."
    )
    @Singular
    @ToString.Exclude
    private final List<String> logs;

    @Schema(
        title = "Set when the job could not be deleted"
    )
    private final CleanupWarning cleanupWarning;

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    /**
     * @return {@code true} when the backup container itself reported the failure, as opposed to
     * the job infrastructure
     */
    public boolean isContainerFailure() {
        return status == Status.FAILED && exitCode != null && exitCode != 0;
    }

    public Optional<CleanupWarning> cleanupWarning() {
        return Optional.ofNullable(cleanupWarning);
    }

    public String getLogText() {
        return String.join("\n", logs);
    }
}
