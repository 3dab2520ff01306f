package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Compute resources of the backup container, as Kubernetes quantities (`500m`, `1Gi`, ...).
 */
@Builder
@Getter
@ToString
@Jacksonized
public class Resources {
    @Schema(
        title = "Resource requests",
        description = "Keyed by resource name, e.g. `cpu` or `memory`."
    )
    @Singular
    private final Map<String, String> requests;

    @Schema(
        title = "Resource limits",
        description = "Keyed by resource name, e.g. `cpu` or `memory`."
    )
    @Singular
    private final Map<String, String> limits;
}
