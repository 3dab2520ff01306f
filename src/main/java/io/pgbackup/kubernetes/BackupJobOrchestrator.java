package io.pgbackup.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.pgbackup.kubernetes.exceptions.BackupJobException;
import io.pgbackup.kubernetes.exceptions.CredentialBackendUnavailableException;
import io.pgbackup.kubernetes.exceptions.CredentialNotFoundException;
import io.pgbackup.kubernetes.exceptions.InvalidConfigurationException;
import io.pgbackup.kubernetes.exceptions.SubmissionException;
import io.pgbackup.kubernetes.models.BackupJobConfig;
import io.pgbackup.kubernetes.models.BackupJobSpec;
import io.pgbackup.kubernetes.models.Connection;
import io.pgbackup.kubernetes.models.JobHandle;
import io.pgbackup.kubernetes.models.JobOutcome;
import io.pgbackup.kubernetes.models.JobPhase;
import io.pgbackup.kubernetes.models.JobState;
import io.pgbackup.kubernetes.models.ResolvedCredentials;
import io.pgbackup.kubernetes.services.CancellationToken;
import io.pgbackup.kubernetes.services.CleanupGuard;
import io.pgbackup.kubernetes.services.ClientService;
import io.pgbackup.kubernetes.services.ClusterJobClient;
import io.pgbackup.kubernetes.services.CompletionWaiter;
import io.pgbackup.kubernetes.services.CredentialResolver;
import io.pgbackup.kubernetes.services.JobSpecBuilder;
import io.pgbackup.kubernetes.services.KubernetesJobClient;
import io.pgbackup.kubernetes.services.KubernetesSecretCredentialResolver;
import io.pgbackup.kubernetes.services.RetryService;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Runs one PostgreSQL to S3 backup as a Kubernetes job and reports how it ended.
 * <p>
 * A run resolves the credentials, builds the job, submits it, waits for its completion, captures
 * its logs and deletes it. Once submitted, the job is deleted on every path out of
 * {@link #run(BackupJobConfig, CancellationToken)}, including timeouts and cancellations.
 * The backup itself is never retried here, retrying is up to the caller.
 */
@Slf4j
@Builder
public class BackupJobOrchestrator {
    static final String REASON_INCONSISTENT = "inconsistent status";

    @NonNull
    private final ClusterJobClient jobClient;

    @NonNull
    private final CredentialResolver credentialResolver;

    @NonNull
    private final CompletionWaiter completionWaiter;

    @Builder.Default
    private final JobSpecBuilder specBuilder = new JobSpecBuilder();

    @Builder.Default
    private final RetryService retryService = RetryService.ofDefaults();

    /**
     * @param connection explicit connection parameters, {@code null} to auto-configure from the environment
     */
    public static BackupJobOrchestrator of(Connection connection) {
        return of(ClientService.of(connection));
    }

    public static BackupJobOrchestrator of(KubernetesClient client) {
        return of(client, CompletionWaiter.DEFAULT_POLL_INTERVAL);
    }

    public static BackupJobOrchestrator of(KubernetesClient client, Duration pollInterval) {
        KubernetesJobClient jobClient = new KubernetesJobClient(client);

        return BackupJobOrchestrator.builder()
            .jobClient(jobClient)
            .credentialResolver(new KubernetesSecretCredentialResolver(client))
            .completionWaiter(new CompletionWaiter(jobClient, pollInterval))
            .build();
    }

    public JobOutcome run(BackupJobConfig config) throws BackupJobException {
        return run(config, new CancellationToken());
    }

    /**
     * @throws InvalidConfigurationException if the configuration is malformed, nothing was submitted
     * @throws CredentialNotFoundException if a referenced secret is missing, nothing was submitted
     * @throws CredentialBackendUnavailableException if the secrets could not be checked, nothing was submitted
     */
    public JobOutcome run(BackupJobConfig config, CancellationToken cancellation) throws BackupJobException {
        specBuilder.validate(config);

        ResolvedCredentials credentials = retryService.run(
            "resolve credentials",
            () -> credentialResolver.resolve(config.getNamespace(), config.getCredentials().byEnvironmentVariable())
        );

        BackupJobSpec spec = specBuilder.build(config, credentials);

        log.info(
            "Starting PostgreSQL backup of '{}' to S3: {}/{} with job '{}'",
            config.getDatabase().getDbname(),
            config.getStorage().getBucket(),
            config.getStorage().getPrefix(),
            spec.getJobName()
        );

        JobHandle handle;
        try {
            handle = retryService.run("submit job '" + spec.getJobName() + "'", () -> jobClient.submit(spec));
        } catch (SubmissionException e) {
            return submissionFailed(config, spec, e);
        }

        CleanupGuard guard = CleanupGuard.of(jobClient, handle);
        JobOutcome outcome;

        try {
            outcome = supervise(config, handle, cancellation);
        } finally {
            guard.close();
        }

        if (guard.getWarning().isPresent()) {
            outcome = outcome.toBuilder()
                .cleanupWarning(guard.getWarning().get())
                .build();
        }

        report(outcome);

        return outcome;
    }

    private JobOutcome supervise(BackupJobConfig config, JobHandle handle, CancellationToken cancellation) {
        CompletionWaiter.Result result = completionWaiter.await(handle, config.getTimeout(), cancellation);

        List<String> logs = fetchLogs(handle);

        return classify(config, handle, result, logs);
    }

    private List<String> fetchLogs(JobHandle handle) {
        try {
            List<String> logs = jobClient.streamLogs(handle);
            logs.forEach(line -> log.info("[{}] {}", handle.getName(), line));

            return logs;
        } catch (RuntimeException e) {
            log.warn("Unable to retrieve the logs of job '{}'", handle.getName(), e);
            return List.of();
        }
    }

    static JobOutcome classify(BackupJobConfig config, JobHandle handle, CompletionWaiter.Result result, List<String> logs) {
        JobOutcome.JobOutcomeBuilder builder = JobOutcome.builder()
            .jobName(handle.getName())
            .namespace(handle.getNamespace())
            .bucket(config.getStorage().getBucket())
            .prefix(config.getStorage().getPrefix())
            .logs(logs);

        JobState state = result.getLastState();

        switch (result.getTermination()) {
            case COMPLETED:
                if (state.getPhase() == JobPhase.SUCCEEDED) {
                    return builder
                        .status(JobOutcome.Status.SUCCEEDED)
                        .exitCode(state.getExitCode())
                        .build();
                }

                return failed(builder, state);
            case TIMED_OUT:
                return builder
                    .status(JobOutcome.Status.TIMED_OUT)
                    .reason("Job did not complete within " + config.getTimeout() + ", last seen " + state.getPhase())
                    .build();
            case VANISHED:
                return builder
                    .status(JobOutcome.Status.SUBMISSION_ERROR)
                    .reason("Job disappeared from the cluster before completing")
                    .build();
            case CANCELLED:
                return builder
                    .status(JobOutcome.Status.CANCELLED)
                    .reason("Run cancelled while the job was " + state.getPhase())
                    .build();
            default:
                throw new IllegalStateException("Unknown termination " + result.getTermination());
        }
    }

    private static JobOutcome failed(JobOutcome.JobOutcomeBuilder builder, JobState state) {
        Integer exitCode = state.getExitCode();
        builder.status(JobOutcome.Status.FAILED).exitCode(exitCode);

        if (exitCode == null) {
            return builder
                .reason(state.getReason() != null ? state.getReason() : "Job failed without a container exit code")
                .build();
        }

        if (exitCode == 0) {
            return builder
                .reason(REASON_INCONSISTENT)
                .build();
        }

        return builder
            .reason("container exit " + exitCode)
            .build();
    }

    private JobOutcome submissionFailed(BackupJobConfig config, BackupJobSpec spec, SubmissionException e) {
        log.error("Unable to submit job '{}': {}", spec.getJobName(), e.getMessage());

        JobOutcome.JobOutcomeBuilder builder = JobOutcome.builder()
            .status(JobOutcome.Status.SUBMISSION_ERROR)
            .reason(e.getMessage())
            .jobName(spec.getJobName())
            .namespace(spec.getNamespace())
            .bucket(config.getStorage().getBucket())
            .prefix(config.getStorage().getPrefix());

        // a transient failure may hide a job the API server created anyway
        if (e.isRetryable()) {
            CleanupGuard guard = CleanupGuard.of(jobClient, JobHandle.of(spec));
            guard.close();
            guard.getWarning().ifPresent(builder::cleanupWarning);
        }

        return builder.build();
    }

    private static void report(JobOutcome outcome) {
        if (outcome.isSuccess()) {
            log.info("Backup job '{}' succeeded", outcome.getJobName());
        } else {
            log.error("Backup job '{}' ended {}: {}", outcome.getJobName(), outcome.getStatus(), outcome.getReason());
        }

        outcome.cleanupWarning().ifPresent(warning ->
            log.warn("Job '{}' in namespace '{}' was not deleted: {}", warning.getJobName(), warning.getNamespace(), warning.getMessage())
        );
    }
}
