package io.pgbackup.kubernetes.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Builder
@Getter
@ToString
@EqualsAndHashCode
public class JobHandle {
    private final String name;

    private final String namespace;

    /**
     * Server assigned uid, {@code null} when the job was never observed on the cluster.
     */
    private final String uid;

    private final String runId;

    private final String containerName;

    private final Instant submittedAt;

    public static JobHandle of(BackupJobSpec spec) {
        return JobHandle.builder()
            .name(spec.getJobName())
            .namespace(spec.getNamespace())
            .runId(spec.getRunId())
            .containerName(spec.getContainerName())
            .build();
    }
}
