package io.pgbackup.kubernetes.models;

import io.fabric8.kubernetes.api.model.ContainerStateTerminated;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobCondition;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * A point in time observation of a job, as returned by a cluster job client.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class JobState {
    private static final String PHASE_PENDING = "Pending";

    private final JobPhase phase;

    /**
     * Exit code of the backup container, when it terminated.
     */
    private final Integer exitCode;

    private final String reason;

    public static JobState of(JobPhase phase) {
        return JobState.builder().phase(phase).build();
    }

    public static JobState notFound() {
        return of(JobPhase.NOT_FOUND);
    }

    public static JobState succeeded(Integer exitCode) {
        return JobState.builder().phase(JobPhase.SUCCEEDED).exitCode(exitCode).build();
    }

    public static JobState failed(Integer exitCode, String reason) {
        return JobState.builder().phase(JobPhase.FAILED).exitCode(exitCode).reason(reason).build();
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    /**
     * Derives the state of a job from its status and, when known, its pod.
     *
     * @param job the job, {@code null} if the cluster no longer knows it
     * @param pod the pod created for the job, may be {@code null}
     * @param container the name of the backup container in the pod
     */
    public static JobState from(Job job, Pod pod, String container) {
        if (job == null) {
            return notFound();
        }

        JobStatus status = job.getStatus();
        if (status == null) {
            return of(JobPhase.PENDING);
        }

        Optional<ContainerStateTerminated> terminated = terminated(pod, container);
        Integer exitCode = terminated.map(ContainerStateTerminated::getExitCode).orElse(null);

        if (positive(status.getSucceeded()) || hasCondition(status, "Complete")) {
            return succeeded(exitCode == null ? 0 : exitCode);
        }

        Optional<JobCondition> failed = condition(status, "Failed");
        if (positive(status.getFailed()) || failed.isPresent()) {
            String reason = failed
                .map(c -> c.getMessage() != null ? c.getReason() + ": " + c.getMessage() : c.getReason())
                .or(() -> terminated.map(ContainerStateTerminated::getReason))
                .orElse(null);

            return failed(exitCode, reason);
        }

        // a finished pod stays RUNNING until the job controller records the completion
        if (terminated.isPresent() || started(pod)) {
            return of(JobPhase.RUNNING);
        }

        if (pod == null && positive(status.getActive()) && positive(status.getReady())) {
            return of(JobPhase.RUNNING);
        }

        return of(JobPhase.PENDING);
    }

    private static boolean started(Pod pod) {
        if (pod == null || pod.getStatus() == null || pod.getStatus().getPhase() == null) {
            return false;
        }

        return !PHASE_PENDING.equals(pod.getStatus().getPhase());
    }

    private static Optional<ContainerStateTerminated> terminated(Pod pod, String container) {
        if (pod == null || pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null) {
            return Optional.empty();
        }

        List<ContainerStatus> statuses = pod.getStatus().getContainerStatuses();

        return statuses
            .stream()
            .filter(containerStatus -> container == null || container.equals(containerStatus.getName()))
            .filter(containerStatus -> containerStatus.getState() != null && containerStatus.getState().getTerminated() != null)
            .map(containerStatus -> containerStatus.getState().getTerminated())
            .findFirst();
    }

    private static boolean hasCondition(JobStatus status, String type) {
        return condition(status, type).isPresent();
    }

    private static Optional<JobCondition> condition(JobStatus status, String type) {
        if (status.getConditions() == null) {
            return Optional.empty();
        }

        return status.getConditions()
            .stream()
            .filter(c -> type.equals(c.getType()) && "True".equals(c.getStatus()))
            .findFirst();
    }

    private static boolean positive(Integer value) {
        return value != null && value > 0;
    }
}
