package io.pgbackup.kubernetes.services;

import io.pgbackup.kubernetes.exceptions.SubmissionException;
import io.pgbackup.kubernetes.exceptions.TransientSubmissionException;
import io.pgbackup.kubernetes.models.BackupJobSpec;
import io.pgbackup.kubernetes.models.JobHandle;
import io.pgbackup.kubernetes.models.JobState;

import java.util.List;

/**
 * The four cluster calls a backup run needs. Each maps to one API request.
 */
public interface ClusterJobClient {
    /**
     * @throws TransientSubmissionException when the API server is unreachable or temporarily unable to serve, retryable
     * @throws SubmissionException when the job is rejected (authorization, quota, admission, malformed manifest)
     */
    JobHandle submit(BackupJobSpec spec) throws SubmissionException;

    /**
     * @return the current state, {@link io.pgbackup.kubernetes.models.JobPhase#NOT_FOUND} if the job is gone
     * @throws io.fabric8.kubernetes.client.KubernetesClientException when the state could not be read
     */
    JobState getStatus(JobHandle handle);

    /**
     * Best effort: returns an empty list when the pod or its logs are not available.
     */
    List<String> streamLogs(JobHandle handle);

    /**
     * Deletes the job and its pod. Deleting a job that does not exist is a success.
     *
     * @throws io.fabric8.kubernetes.client.KubernetesClientException when the deletion failed
     */
    void delete(JobHandle handle);
}
