package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

@Builder
@Getter
@ToString
@Jacksonized
public class Credentials {
    public static final String DEFAULT_SECRET_NAME = "pg-backup-secrets";

    public static final String PASSWORD_ENV = "PGPASSWORD";
    public static final String ACCESS_KEY_ENV = "AWS_ACCESS_KEY_ID";
    public static final String SECRET_KEY_ENV = "AWS_SECRET_ACCESS_KEY";

    @Schema(
        title = "The PostgreSQL password",
        description = "Exposed to the container as `PGPASSWORD`."
    )
    @NotNull
    @Valid
    @Builder.Default
    private final SecretRef databasePassword = SecretRef.of(DEFAULT_SECRET_NAME, "pg-password");

    @Schema(
        title = "The object storage access key",
        description = "Exposed to the container as `AWS_ACCESS_KEY_ID`."
    )
    @NotNull
    @Valid
    @Builder.Default
    private final SecretRef accessKey = SecretRef.of(DEFAULT_SECRET_NAME, "aws-access-key");

    @Schema(
        title = "The object storage secret key",
        description = "Exposed to the container as `AWS_SECRET_ACCESS_KEY`."
    )
    @NotNull
    @Valid
    @Builder.Default
    private final SecretRef secretKey = SecretRef.of(DEFAULT_SECRET_NAME, "aws-secret-key");

    /**
     * @return the secret references keyed by the environment variable the container reads them from
     */
    public Map<String, SecretRef> byEnvironmentVariable() {
        Map<String, SecretRef> refs = new LinkedHashMap<>();
        refs.put(PASSWORD_ENV, databasePassword);
        refs.put(ACCESS_KEY_ENV, accessKey);
        refs.put(SECRET_KEY_ENV, secretKey);
        return refs;
    }
}
