package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Points at one key of a named secret. Only the coordinates are ever held, never the value.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
@Jacksonized
public class SecretRef {
    @Schema(
        title = "Name of the secret holding the value"
    )
    @NotBlank
    private final String name;

    @Schema(
        title = "Key of the value inside the secret"
    )
    @NotBlank
    private final String key;

    public static SecretRef of(String name, String key) {
        return SecretRef.builder().name(name).key(key).build();
    }
}
