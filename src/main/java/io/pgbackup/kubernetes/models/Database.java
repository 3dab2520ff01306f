package io.pgbackup.kubernetes.models;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@ToString
@Jacksonized
public class Database {
    @Schema(
        title = "Hostname of the PostgreSQL server"
    )
    @NotBlank
    @Builder.Default
    private final String host = "localhost";

    @Schema(
        title = "Port of the PostgreSQL server"
    )
    @Min(1)
    @Max(65535)
    @Builder.Default
    private final int port = 5432;

    @Schema(
        title = "Name of the database to back up"
    )
    @NotBlank
    @Builder.Default
    private final String dbname = "postgres";

    @Schema(
        title = "Username to connect to the database"
    )
    @NotBlank
    @Builder.Default
    private final String user = "postgres";

    @Schema(
        title = "Back up all databases of the server instead of `dbname`"
    )
    @Builder.Default
    private final boolean backupAll = false;
}
