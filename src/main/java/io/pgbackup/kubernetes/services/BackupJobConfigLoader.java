package io.pgbackup.kubernetes.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pgbackup.kubernetes.exceptions.InvalidConfigurationException;
import io.pgbackup.kubernetes.models.BackupJobConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link BackupJobConfig} from YAML and overlays the operator variables on top of it.
 * <p>
 * Variables win over the document, the document wins over the defaults. Variable names are
 * case-insensitive so that {@code PG_BACKUP_HOST} in the environment matches {@code pg_backup_host}.
 */
@Slf4j
public class BackupJobConfigLoader {
    public static final Map<String, String> VARIABLES;

    static {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("pg_backup_host", "database.host");
        variables.put("pg_backup_dbname", "database.dbname");
        variables.put("pg_backup_user", "database.user");
        variables.put("pg_backup_bucket", "storage.bucket");
        variables.put("pg_backup_prefix", "storage.prefix");
        variables.put("pg_backup_aws_region", "storage.region");
        variables.put("pg_backup_aws_endpoint_url", "storage.endpointUrl");
        VARIABLES = Collections.unmodifiableMap(variables);
    }

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
        .registerModule(new JavaTimeModule());

    /**
     * Loads a file, with the process environment as variables.
     */
    public BackupJobConfig load(Path file) throws IOException, InvalidConfigurationException {
        return load(Files.readString(file), System.getenv());
    }

    public BackupJobConfig load(String yaml, Map<String, String> variables) throws InvalidConfigurationException {
        ObjectNode root;

        try {
            JsonNode node = yaml == null || yaml.isBlank() ? null : MAPPER.readTree(yaml);
            if (node != null && !node.isNull() && !node.isObject()) {
                throw new InvalidConfigurationException(List.of("configuration must be a mapping"));
            }

            root = node == null || node.isNull() ? JsonNodeFactory.instance.objectNode() : (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("unreadable YAML: " + e.getOriginalMessage(), e);
        }

        overlay(root, variables);

        try {
            return MAPPER.treeToValue(root, BackupJobConfig.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException(e.getOriginalMessage(), e);
        }
    }

    private static void overlay(ObjectNode root, Map<String, String> variables) {
        if (variables == null) {
            return;
        }

        variables.forEach((name, value) -> {
            if (name == null || value == null) {
                return;
            }

            String path = VARIABLES.get(name.toLowerCase(Locale.ROOT));
            if (path == null) {
                return;
            }

            String[] parts = path.split("\\.");
            ObjectNode parent = root;
            for (int i = 0; i < parts.length - 1; i++) {
                JsonNode child = parent.get(parts[i]);
                parent = child instanceof ObjectNode ? (ObjectNode) child : parent.putObject(parts[i]);
            }

            parent.put(parts[parts.length - 1], value);
            log.debug("Variable '{}' overrides '{}'", name, path);
        });
    }
}
