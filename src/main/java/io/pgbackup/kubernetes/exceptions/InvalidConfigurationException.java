package io.pgbackup.kubernetes.exceptions;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidConfigurationException extends BackupJobException {
    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid backup job configuration: " + String.join(", ", violations), false);
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigurationException(String violation, Throwable cause) {
        super("Invalid backup job configuration: " + violation, false, cause);
        this.violations = List.of(violation);
    }
}
