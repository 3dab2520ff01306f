package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.dsl.ScalableResource;
import io.pgbackup.kubernetes.exceptions.SubmissionException;
import io.pgbackup.kubernetes.exceptions.TransientSubmissionException;
import io.pgbackup.kubernetes.models.BackupJobSpec;
import io.pgbackup.kubernetes.models.JobHandle;
import io.pgbackup.kubernetes.models.JobState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ClusterJobClient} backed by the batch/v1 API through the fabric8 client.
 */
@Slf4j
public class KubernetesJobClient implements ClusterJobClient {
    static final String LABEL_CONTROLLER_UID = "controller-uid";
    static final String LABEL_JOB_NAME = "job-name";

    private final KubernetesClient client;
    private final Clock clock;

    public KubernetesJobClient(KubernetesClient client) {
        this(client, Clock.systemUTC());
    }

    public KubernetesJobClient(KubernetesClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public JobHandle submit(BackupJobSpec spec) throws SubmissionException {
        Job created;

        try {
            created = client.batch()
                .v1()
                .jobs()
                .inNamespace(spec.getNamespace())
                .resource(spec.getJob())
                .create();
        } catch (KubernetesClientException e) {
            if (KubernetesErrors.isConflict(e)) {
                created = adopt(spec, e);
            } else if (KubernetesErrors.isTransient(e)) {
                throw new TransientSubmissionException("Unable to submit job '" + spec.getJobName() + "': " + KubernetesErrors.describe(e), e);
            } else {
                throw new SubmissionException("Job '" + spec.getJobName() + "' rejected: " + KubernetesErrors.describe(e), e);
            }
        }

        JobHandle handle = JobHandle.builder()
            .name(created.getMetadata().getName())
            .namespace(spec.getNamespace())
            .uid(created.getMetadata().getUid())
            .runId(spec.getRunId())
            .containerName(spec.getContainerName())
            .submittedAt(clock.instant())
            .build();

        log.info("Job '{}' is created in namespace '{}'", handle.getName(), handle.getNamespace());

        return handle;
    }

    /**
     * A previous attempt of this very run may have reached the API server before failing on our side.
     */
    private Job adopt(BackupJobSpec spec, KubernetesClientException conflict) throws SubmissionException {
        Job existing = jobRef(spec.getNamespace(), spec.getJobName()).get();

        if (existing != null &&
            existing.getMetadata().getLabels() != null &&
            spec.getRunId().equals(existing.getMetadata().getLabels().get(JobSpecBuilder.LABEL_RUN_ID))
        ) {
            log.info("Job '{}' already exists for this run, adopting it", spec.getJobName());
            return existing;
        }

        throw new SubmissionException("Job '" + spec.getJobName() + "' already exists: " + KubernetesErrors.describe(conflict), conflict);
    }

    @Override
    public JobState getStatus(JobHandle handle) {
        Job job = jobRef(handle.getNamespace(), handle.getName()).get();

        if (job == null) {
            return JobState.notFound();
        }

        Pod pod = findPod(handle, job).orElse(null);

        return JobState.from(job, pod, handle.getContainerName());
    }

    @Override
    public List<String> streamLogs(JobHandle handle) {
        Job job;
        Optional<Pod> pod;

        try {
            job = jobRef(handle.getNamespace(), handle.getName()).get();
            pod = findPod(handle, job);
        } catch (KubernetesClientException e) {
            log.warn("Unable to find the pod of job '{}': {}", handle.getName(), KubernetesErrors.describe(e));
            return List.of();
        }

        if (pod.isEmpty()) {
            log.debug("No pod found for job '{}', no logs to fetch", handle.getName());
            return List.of();
        }

        PodResource podResource = podRef(handle.getNamespace(), pod.get());

        try {
            String logs = handle.getContainerName() != null ?
                podResource.inContainer(handle.getContainerName()).getLog() :
                podResource.getLog();

            if (logs == null || logs.isEmpty()) {
                return List.of();
            }

            return logs.lines().collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            log.warn("Unable to fetch logs of pod '{}': {}", pod.get().getMetadata().getName(), KubernetesErrors.describe(e));
            return List.of();
        }
    }

    @Override
    public void delete(JobHandle handle) {
        try {
            List<?> deleted = jobRef(handle.getNamespace(), handle.getName())
                .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                .delete();

            if (deleted == null || deleted.isEmpty()) {
                log.debug("Job '{}' was already deleted", handle.getName());
            } else {
                log.info("Job '{}' is deleted", handle.getName());
            }
        } catch (KubernetesClientException e) {
            if (KubernetesErrors.isNotFound(e)) {
                log.debug("Job '{}' was already deleted", handle.getName());
                return;
            }

            throw e;
        }
    }

    private Optional<Pod> findPod(JobHandle handle, Job job) {
        String uid = job != null && job.getMetadata() != null ? job.getMetadata().getUid() : handle.getUid();

        var pods = client.pods().inNamespace(handle.getNamespace());
        List<Pod> items = uid != null ?
            pods.withLabel(LABEL_CONTROLLER_UID, uid).list().getItems() :
            pods.withLabel(LABEL_JOB_NAME, handle.getName()).list().getItems();

        // backoffLimit is 0, still keep the latest pod if the cluster created more than one
        return items
            .stream()
            .filter(Objects::nonNull)
            .max(Comparator.comparing(KubernetesJobClient::creation));
    }

    private static Instant creation(Pod pod) {
        String timestamp = pod.getMetadata() != null ? pod.getMetadata().getCreationTimestamp() : null;
        return timestamp != null ? Instant.parse(timestamp) : Instant.EPOCH;
    }

    private ScalableResource<Job> jobRef(String namespace, String name) {
        return client.batch()
            .v1()
            .jobs()
            .inNamespace(namespace)
            .withName(name);
    }

    private PodResource podRef(String namespace, Pod pod) {
        return client.pods()
            .inNamespace(namespace)
            .withName(pod.getMetadata().getName());
    }
}
