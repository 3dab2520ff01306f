package io.pgbackup.kubernetes.models;

import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * The job manifest of one run. Built once, never changed: {@link #getJob()} hands out copies.
 */
@Builder
@ToString
public class BackupJobSpec {
    @Getter
    private final String jobName;

    @Getter
    private final String namespace;

    @Getter
    private final String runId;

    @Getter
    private final String containerName;

    @Getter
    private final Instant builtAt;

    @ToString.Exclude
    private final Job job;

    public Job getJob() {
        return new JobBuilder(job).build();
    }
}
