package io.pgbackup.kubernetes.services;

import io.pgbackup.kubernetes.exceptions.InvalidConfigurationException;
import io.pgbackup.kubernetes.models.BackupJobConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackupJobConfigLoaderTest {
    private static final String YAML = String.join("\n",
        "namespace: backups",
        "serviceAccountName: pg-backup",
        "timeout: PT30M",
        "labels:",
        "  team: data",
        "database:",
        "  host: db.internal",
        "  dbname: orders",
        "storage:",
        "  bucket: nightly",
        "  prefix: orders/",
        "credentials:",
        "  databasePassword:",
        "    name: orders-db",
        "    key: password",
        "resources:",
        "  requests:",
        "    memory: 256Mi",
        "  limits:",
        "    memory: 1Gi"
    );

    private final BackupJobConfigLoader loader = new BackupJobConfigLoader();

    @Test
    void load() throws Exception {
        BackupJobConfig config = loader.load(YAML, Map.of());

        assertThat(config.getNamespace(), is("backups"));
        assertThat(config.getServiceAccountName(), is("pg-backup"));
        assertThat(config.getTimeout(), is(Duration.ofMinutes(30)));
        assertThat(config.getLabels(), hasEntry("team", "data"));
        assertThat(config.getDatabase().getHost(), is("db.internal"));
        assertThat(config.getDatabase().getPort(), is(5432));
        assertThat(config.getDatabase().getUser(), is("postgres"));
        assertThat(config.getStorage().getRegion(), is("us-east-1"));
        assertThat(config.getCredentials().getDatabasePassword().getName(), is("orders-db"));
        assertThat(config.getCredentials().getAccessKey().getKey(), is("aws-access-key"));
        assertThat(config.getResources().getLimits(), hasEntry("memory", "1Gi"));
        assertThat(config.getImagePullPolicy(), is("Always"));
        assertThat(config.getTtlSecondsAfterFinished(), is(300));
    }

    @Test
    void variablesWin() throws Exception {
        BackupJobConfig config = loader.load(YAML, Map.of(
            "pg_backup_host", "replica.internal",
            "PG_BACKUP_BUCKET", "weekly",
            "pg_backup_aws_endpoint_url", "https://minio.local",
            "HOME", "/root"
        ));

        assertThat(config.getDatabase().getHost(), is("replica.internal"));
        assertThat(config.getDatabase().getDbname(), is("orders"));
        assertThat(config.getStorage().getBucket(), is("weekly"));
        assertThat(config.getStorage().getEndpointUrl(), is("https://minio.local"));
    }

    @Test
    void variablesAlone() throws Exception {
        BackupJobConfig config = loader.load("", Map.of(
            "pg_backup_host", "db",
            "pg_backup_user", "backup",
            "pg_backup_bucket", "b"
        ));

        assertThat(config.getDatabase().getHost(), is("db"));
        assertThat(config.getDatabase().getUser(), is("backup"));
        assertThat(config.getStorage().getBucket(), is("b"));
    }

    @Test
    void unknownProperty() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> loader.load("bukcet: typo", Map.of()));

        assertThat(e.getMessage(), containsString("bukcet"));
    }

    @Test
    void notAMapping() {
        assertThrows(InvalidConfigurationException.class, () -> loader.load("- a\n- b", Map.of()));
    }
}
