package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;
import org.hibernate.validator.constraints.time.DurationMin;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to run one PostgreSQL to S3 backup job.
 * <p>
 * Sensitive values are never part of this record: {@link #getCredentials()} only holds secret
 * references that the cluster binds when the pod starts.
 */
@Builder(toBuilder = true)
@Getter
@ToString
@Jacksonized
@Schema(
    title = "Configuration of a PostgreSQL to S3 backup job."
)
public class BackupJobConfig {
    public static final String DEFAULT_IMAGE = "regv2.gsingh.io/personal/pg-s3-backup:latest";

    @Schema(
        title = "The namespace where the job will be created"
    )
    @NotBlank
    @Builder.Default
    private final String namespace = "default";

    @Schema(
        title = "The backup image"
    )
    @NotBlank
    @Builder.Default
    private final String image = DEFAULT_IMAGE;

    @Schema(
        title = "The image pull policy"
    )
    @NotNull
    @Pattern(regexp = "Always|IfNotPresent|Never")
    @Builder.Default
    private final String imagePullPolicy = "Always";

    @Schema(
        title = "The container entrypoint"
    )
    @NotEmpty
    @Builder.Default
    private final List<String> command = List.of("/app/pg_s3_backup");

    @Schema(
        title = "Additional arguments appended after the generated ones"
    )
    @Singular
    private final List<String> extraArgs;

    @Schema(
        title = "Prefix of the generated job name",
        description = "A timestamp and a random suffix are appended to make every run unique."
    )
    @NotBlank
    @Size(max = 40)
    @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?")
    @Builder.Default
    private final String jobNamePrefix = "pg-s3-backup";

    @Schema(
        title = "The service account the pod runs as",
        description = "When empty, the namespace default service account is used."
    )
    private final String serviceAccountName;

    @Schema(
        title = "Additional labels for the job and its pod"
    )
    @Singular
    private final Map<String, String> labels;

    @NotNull
    @Valid
    private final Database database;

    @NotNull
    @Valid
    private final ObjectStorage storage;

    @NotNull
    @Valid
    @Builder.Default
    private final Credentials credentials = Credentials.builder().build();

    @Valid
    private final Resources resources;

    @Schema(
        title = "Gzip the dump before the upload"
    )
    @Builder.Default
    private final boolean compress = false;

    @Schema(
        title = "Keep the local dump file after the upload"
    )
    @Builder.Default
    private final boolean keepLocal = false;

    @Schema(
        title = "The maximum duration to wait for the job completion."
    )
    @NotNull
    @DurationMin(nanos = 1)
    @Builder.Default
    private final Duration timeout = Duration.ofMinutes(10);

    @Schema(
        title = "Seconds the cluster keeps the finished job before garbage collecting it",
        description = "Only a safety net, the job is always deleted at the end of the run."
    )
    @PositiveOrZero
    @Builder.Default
    private final Integer ttlSecondsAfterFinished = 300;
}
