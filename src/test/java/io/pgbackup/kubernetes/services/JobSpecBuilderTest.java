package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.pgbackup.kubernetes.TestUtils;
import io.pgbackup.kubernetes.exceptions.InvalidConfigurationException;
import io.pgbackup.kubernetes.models.BackupJobConfig;
import io.pgbackup.kubernetes.models.BackupJobSpec;
import io.pgbackup.kubernetes.models.Database;
import io.pgbackup.kubernetes.models.ObjectStorage;
import io.pgbackup.kubernetes.models.Resources;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobSpecBuilderTest {
    private final JobSpecBuilder builder = new JobSpecBuilder(TestUtils.MutableClock.startingNow());

    @Test
    void build() throws Exception {
        BackupJobSpec spec = builder.build(TestUtils.config().build(), TestUtils.credentials());
        Job job = spec.getJob();

        assertThat(spec.getNamespace(), is("test"));
        assertThat(spec.getJobName(), startsWith("pg-s3-backup-"));
        assertThat(spec.getJobName().length(), lessThanOrEqualTo(63));
        assertThat(spec.getJobName(), matchesPattern("[a-z0-9]([-a-z0-9]*[a-z0-9])?"));
        assertThat(job.getMetadata().getName(), is(spec.getJobName()));
        assertThat(job.getMetadata().getLabels(), hasEntry(JobSpecBuilder.LABEL_RUN_ID, spec.getRunId()));
        assertThat(job.getMetadata().getAnnotations(), hasEntry(JobSpecBuilder.ANNOTATION_DELETE_ON_COMPLETION, "true"));
        assertThat(job.getSpec().getBackoffLimit(), is(0));
        assertThat(job.getSpec().getTtlSecondsAfterFinished(), is(300));
        assertThat(job.getSpec().getTemplate().getSpec().getRestartPolicy(), is("Never"));

        Container container = job.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getName(), is(JobSpecBuilder.CONTAINER_NAME));
        assertThat(container.getImage(), is(BackupJobConfig.DEFAULT_IMAGE));
        assertThat(container.getImagePullPolicy(), is("Always"));
        assertThat(container.getCommand(), contains("/app/pg_s3_backup"));
        assertThat(container.getArgs(), contains(
            "--host", "db.example.com",
            "--port", "5432",
            "--dbname", "mydb",
            "--user", "backup",
            "--bucket", "my-backups",
            "--aws-profile", "default",
            "--aws-region", "eu-west-1",
            "--prefix", "production/"
        ));
    }

    @Test
    void secretsAreBoundByReference() throws Exception {
        Job job = builder.build(TestUtils.config().build(), TestUtils.credentials()).getJob();
        List<EnvVar> env = job.getSpec().getTemplate().getSpec().getContainers().get(0).getEnv();

        assertThat(env.stream().map(EnvVar::getName).collect(Collectors.toList()), containsInAnyOrder("PGPASSWORD", "AWS_ACCESS_KEY_ID", "AWS_SECRET_ACCESS_KEY"));
        env.forEach(envVar -> {
            assertThat(envVar.getValue(), nullValue());
            assertThat(envVar.getValueFrom().getSecretKeyRef().getName(), is("pg-backup-secrets"));
        });

        EnvVar password = env.stream().filter(e -> e.getName().equals("PGPASSWORD")).findFirst().orElseThrow();
        assertThat(password.getValueFrom().getSecretKeyRef().getKey(), is("pg-password"));
    }

    @Test
    void optionalArguments() throws Exception {
        BackupJobConfig config = TestUtils.config()
            .database(Database.builder().host("db").user("u").backupAll(true).build())
            .storage(ObjectStorage.builder().bucket("b").endpointUrl("https://minio.local:9000").build())
            .compress(true)
            .keepLocal(true)
            .extraArg("--verbose")
            .build();

        List<String> args = JobSpecBuilder.arguments(config);

        assertThat(args, hasItems("--all", "--compress", "--keep-local"));
        assertThat(args, not(hasItem("--prefix")));
        assertThat(args.get(args.indexOf("--aws-endpoint-url") + 1), is("https://minio.local:9000"));
        assertThat(args.get(args.size() - 1), is("--verbose"));
    }

    @Test
    void namesNeverCollide() throws Exception {
        // the clock never moves: uniqueness can't rely on the timestamp alone
        BackupJobConfig config = TestUtils.config().build();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            names.add(builder.build(config, TestUtils.credentials()).getJobName());
        }

        assertThat(names.size(), is(1000));
    }

    @Test
    void specIsNotMutable() throws Exception {
        BackupJobSpec spec = builder.build(TestUtils.config().build(), TestUtils.credentials());

        spec.getJob().getMetadata().setName("changed");
        spec.getJob().getSpec().getTemplate().getSpec().getContainers().get(0).setImage("evil");

        assertThat(spec.getJob().getMetadata().getName(), is(spec.getJobName()));
        assertThat(spec.getJob().getSpec().getTemplate().getSpec().getContainers().get(0).getImage(), is(BackupJobConfig.DEFAULT_IMAGE));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " "})
    void blankHost(String host) {
        BackupJobConfig config = TestUtils.config()
            .database(Database.builder().host(host).build())
            .build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> builder.build(config, TestUtils.credentials()));
        assertThat(e.getViolations(), hasItem(startsWith("database.host")));
        assertThat(e.isRetryable(), is(false));
    }

    @Test
    void blankBucketAndUser() {
        BackupJobConfig config = TestUtils.config()
            .database(Database.builder().user("").build())
            .storage(ObjectStorage.builder().bucket("").build())
            .build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> builder.validate(config));
        assertThat(e.getViolations(), hasItems(startsWith("database.user"), startsWith("storage.bucket")));
    }

    @Test
    void missingSections() {
        BackupJobConfig config = BackupJobConfig.builder().build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> builder.validate(config));
        assertThat(e.getViolations(), hasItems(startsWith("database"), startsWith("storage")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"PT0S", "-PT5M"})
    void timeoutMustBePositive(String timeout) {
        BackupJobConfig config = TestUtils.config()
            .timeout(Duration.parse(timeout))
            .build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> builder.validate(config));
        assertThat(e.getViolations(), hasItem(startsWith("timeout")));
    }

    @Test
    void invalidPrefixAndPullPolicy() {
        BackupJobConfig config = TestUtils.config()
            .jobNamePrefix("Not_Valid")
            .imagePullPolicy("Sometimes")
            .build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> builder.validate(config));
        assertThat(e.getViolations(), hasItems(startsWith("jobNamePrefix"), startsWith("imagePullPolicy")));
    }

    @Test
    void resources() throws Exception {
        BackupJobConfig config = TestUtils.config()
            .resources(Resources.builder()
                .request("cpu", "250m")
                .request("memory", "256Mi")
                .limit("cpu", "1")
                .limit("memory", "1Gi")
                .build()
            )
            .timeout(Duration.ofMinutes(30))
            .build();

        Container container = builder.build(config, TestUtils.credentials()).getJob().getSpec().getTemplate().getSpec().getContainers().get(0);

        assertThat(container.getResources().getRequests(), hasEntry("cpu", new Quantity("250", "m")));
        assertThat(container.getResources().getLimits(), hasEntry("memory", new Quantity("1", "Gi")));
    }

    @Test
    void malformedResources() {
        BackupJobConfig config = TestUtils.config()
            .resources(Resources.builder()
                .request("memory", "lots")
                .request("cpu", "2")
                .limit("cpu", "500m")
                .build()
            )
            .build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> builder.validate(config));
        assertThat(e.getViolations(), hasItems(
            containsString("resources.requests.memory"),
            containsString("resources.requests.cpu: must be less than or equal to the limit")
        ));
    }
}
