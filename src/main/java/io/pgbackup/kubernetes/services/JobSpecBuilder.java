package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.pgbackup.kubernetes.exceptions.InvalidConfigurationException;
import io.pgbackup.kubernetes.models.BackupJobConfig;
import io.pgbackup.kubernetes.models.BackupJobSpec;
import io.pgbackup.kubernetes.models.Database;
import io.pgbackup.kubernetes.models.ObjectStorage;
import io.pgbackup.kubernetes.models.ResolvedCredentials;
import io.pgbackup.kubernetes.models.Resources;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the job manifest of a backup run. Pure: validates and assembles, never calls the cluster.
 */
@Slf4j
public class JobSpecBuilder {
    public static final String CONTAINER_NAME = "pg-s3-backup";

    public static final String LABEL_APP = "app";
    public static final String LABEL_RUN_ID = "pgbackup.io/run-id";
    public static final String ANNOTATION_DELETE_ON_COMPLETION = "pgbackup.io/delete-on-completion";

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;

    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory();

    private final Validator validator = VALIDATOR_FACTORY.getValidator();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public JobSpecBuilder() {
        this(Clock.systemUTC());
    }

    public JobSpecBuilder(Clock clock) {
        this.clock = clock;
    }

    public BackupJobSpec build(BackupJobConfig config, ResolvedCredentials credentials) throws InvalidConfigurationException {
        validate(config, credentials);

        Instant now = clock.instant();
        String jobName = jobName(config.getJobNamePrefix(), now);
        String runId = UUID.randomUUID().toString();

        Map<String, String> labels = new LinkedHashMap<>(config.getLabels());
        labels.put(LABEL_APP, CONTAINER_NAME);
        labels.put(LABEL_RUN_ID, runId);

        Job job = new JobBuilder()
            .withNewMetadata()
                .withName(jobName)
                .withNamespace(config.getNamespace())
                .withLabels(labels)
                .addToAnnotations(ANNOTATION_DELETE_ON_COMPLETION, "true")
            .endMetadata()
            .withNewSpec()
                // the cluster never retries, failures are surfaced to the caller
                .withBackoffLimit(0)
                .withTtlSecondsAfterFinished(config.getTtlSecondsAfterFinished())
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(labels)
                    .endMetadata()
                    .withNewSpec()
                        .withRestartPolicy("Never")
                        .withServiceAccountName(blankToNull(config.getServiceAccountName()))
                        .addNewContainer()
                            .withName(CONTAINER_NAME)
                            .withImage(config.getImage())
                            .withImagePullPolicy(config.getImagePullPolicy())
                            .withCommand(config.getCommand())
                            .withArgs(arguments(config))
                            .withEnv(environment(credentials))
                            .withResources(resources(config.getResources()))
                        .endContainer()
                    .endSpec()
                .endTemplate()
            .endSpec()
            .build();

        log.debug("Built job '{}' in namespace '{}' for run '{}'", jobName, config.getNamespace(), runId);

        return BackupJobSpec.builder()
            .jobName(jobName)
            .namespace(config.getNamespace())
            .runId(runId)
            .containerName(CONTAINER_NAME)
            .builtAt(now)
            .job(job)
            .build();
    }

    /**
     * Arguments of the backup binary. Secrets are never part of them, they come from the environment.
     */
    public static List<String> arguments(BackupJobConfig config) {
        Database database = config.getDatabase();
        ObjectStorage storage = config.getStorage();

        List<String> args = new ArrayList<>(List.of(
            "--host", database.getHost(),
            "--port", String.valueOf(database.getPort()),
            "--dbname", database.getDbname(),
            "--user", database.getUser(),
            "--bucket", storage.getBucket(),
            "--aws-profile", storage.getProfile(),
            "--aws-region", storage.getRegion()
        ));

        if (database.isBackupAll()) {
            args.add("--all");
        }

        if (!storage.getPrefix().isEmpty()) {
            args.add("--prefix");
            args.add(storage.getPrefix());
        }

        if (blankToNull(storage.getEndpointUrl()) != null) {
            args.add("--aws-endpoint-url");
            args.add(storage.getEndpointUrl());
        }

        if (config.isCompress()) {
            args.add("--compress");
        }

        if (config.isKeepLocal()) {
            args.add("--keep-local");
        }

        args.addAll(config.getExtraArgs());

        return args;
    }

    /**
     * Checks a configuration without building anything.
     *
     * @throws InvalidConfigurationException listing every violation found
     */
    public void validate(BackupJobConfig config) throws InvalidConfigurationException {
        List<String> violations = violations(config);

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }

    private void validate(BackupJobConfig config, ResolvedCredentials credentials) throws InvalidConfigurationException {
        List<String> violations = violations(config);

        if (credentials == null) {
            violations.add("credentials: must not be null");
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }

    private List<String> violations(BackupJobConfig config) {
        List<String> violations = new ArrayList<>();

        if (config == null) {
            violations.add("configuration is missing");
            return violations;
        }

        validator.validate(config)
            .stream()
            .map(JobSpecBuilder::describe)
            .sorted()
            .forEach(violations::add);

        if (config.getResources() != null) {
            violations.addAll(validateResources(config.getResources()));
        }

        return violations;
    }

    private static List<String> validateResources(Resources resources) {
        List<String> violations = new ArrayList<>();
        Map<String, BigDecimal> requests = quantities("resources.requests", resources.getRequests(), violations);
        Map<String, BigDecimal> limits = quantities("resources.limits", resources.getLimits(), violations);

        requests.forEach((name, request) -> {
            BigDecimal limit = limits.get(name);
            if (limit != null && request.compareTo(limit) > 0) {
                violations.add("resources.requests." + name + ": must be less than or equal to the limit");
            }
        });

        return violations;
    }

    private static Map<String, BigDecimal> quantities(String path, Map<String, String> values, List<String> violations) {
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();

        values.forEach((name, value) -> {
            if (name == null || name.isBlank()) {
                violations.add(path + ": resource name must not be blank");
                return;
            }

            try {
                BigDecimal amount = Quantity.parse(value).getNumericalAmount();
                if (amount.signum() < 0) {
                    violations.add(path + "." + name + ": must not be negative");
                } else {
                    amounts.put(name, amount);
                }
            } catch (IllegalArgumentException | ArithmeticException | NullPointerException e) {
                violations.add(path + "." + name + ": '" + value + "' is not a valid quantity");
            }
        });

        return amounts;
    }

    private static ResourceRequirements resources(Resources resources) {
        if (resources == null) {
            return null;
        }

        return new ResourceRequirementsBuilder()
            .withRequests(toQuantities(resources.getRequests()))
            .withLimits(toQuantities(resources.getLimits()))
            .build();
    }

    private static Map<String, Quantity> toQuantities(Map<String, String> values) {
        Map<String, Quantity> quantities = new LinkedHashMap<>();
        values.forEach((name, value) -> quantities.put(name, Quantity.parse(value)));
        return quantities;
    }

    private static List<EnvVar> environment(ResolvedCredentials credentials) {
        return credentials.toEnvVars();
    }

    private String jobName(String prefix, Instant now) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }

        return prefix + "-" + Long.toString(now.toEpochMilli(), 36) + "-" + suffix;
    }

    private static String describe(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
