package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@ToString
@Jacksonized
public class ObjectStorage {
    @Schema(
        title = "S3 bucket to upload the backup to"
    )
    @NotBlank
    private final String bucket;

    @Schema(
        title = "S3 prefix of the uploaded backup"
    )
    @NotNull
    @Builder.Default
    private final String prefix = "";

    @Schema(
        title = "AWS region"
    )
    @NotBlank
    @Builder.Default
    private final String region = "us-east-1";

    @Schema(
        title = "AWS profile used by the upload"
    )
    @NotBlank
    @Builder.Default
    private final String profile = "default";

    @Schema(
        title = "Custom endpoint URL",
        description = "For S3-compatible services (MinIO, Ceph, ...)."
    )
    private final String endpointUrl;
}
