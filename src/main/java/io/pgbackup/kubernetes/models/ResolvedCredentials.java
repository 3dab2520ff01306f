package io.pgbackup.kubernetes.models;

import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Secret references checked by a credential resolver, keyed by the environment variable that
 * receives them. Turned into {@code valueFrom.secretKeyRef} bindings, never into literal values.
 */
@ToString
@EqualsAndHashCode
public class ResolvedCredentials {
    private final Map<String, SecretRef> references;

    public ResolvedCredentials(Map<String, SecretRef> references) {
        this.references = Collections.unmodifiableMap(new LinkedHashMap<>(references));
    }

    public Map<String, SecretRef> getReferences() {
        return references;
    }

    public List<EnvVar> toEnvVars() {
        return references.entrySet()
            .stream()
            .map(e -> new EnvVarBuilder()
                .withName(e.getKey())
                .withNewValueFrom()
                    .withNewSecretKeyRef()
                        .withName(e.getValue().getName())
                        .withKey(e.getValue().getKey())
                        .withOptional(false)
                    .endSecretKeyRef()
                .endValueFrom()
                .build()
            )
            .collect(Collectors.toList());
    }
}
