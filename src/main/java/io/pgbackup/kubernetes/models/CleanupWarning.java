package io.pgbackup.kubernetes.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A job that could not be deleted and needs manual remediation.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class CleanupWarning {
    private final String jobName;

    private final String namespace;

    private final String message;
}
