package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonDeletingOperation;
import io.pgbackup.kubernetes.exceptions.CredentialBackendUnavailableException;
import io.pgbackup.kubernetes.exceptions.CredentialNotFoundException;
import io.pgbackup.kubernetes.models.ResolvedCredentials;
import io.pgbackup.kubernetes.models.SecretRef;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves credentials against Kubernetes secrets living in the namespace of the job.
 * <p>
 * Only the key names of a secret are inspected, the values stay on the cluster.
 */
@Slf4j
public class KubernetesSecretCredentialResolver implements CredentialResolver {
    private final KubernetesClient client;

    public KubernetesSecretCredentialResolver(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public ResolvedCredentials resolve(String namespace, Map<String, SecretRef> references) throws CredentialNotFoundException, CredentialBackendUnavailableException {
        Map<String, Set<String>> keysBySecret = new HashMap<>();

        for (Map.Entry<String, SecretRef> entry : references.entrySet()) {
            SecretRef ref = entry.getValue();

            if (!keysBySecret.containsKey(ref.getName())) {
                keysBySecret.put(ref.getName(), keys(namespace, ref.getName()));
            }

            Set<String> keys = keysBySecret.get(ref.getName());
            if (keys == null || !keys.contains(ref.getKey())) {
                throw new CredentialNotFoundException(namespace, ref.getName(), ref.getKey());
            }

            log.debug("Resolved '{}' from secret '{}' key '{}'", entry.getKey(), ref.getName(), ref.getKey());
        }

        return new ResolvedCredentials(references);
    }

    /**
     * Creates the secret or replaces its content, outside any backup run.
     *
     * @param values plain values keyed by secret key
     */
    public void createOrReplace(String namespace, String name, Map<String, String> values) throws CredentialBackendUnavailableException {
        Secret secret = new SecretBuilder()
            .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
            .endMetadata()
            .withType("Opaque")
            .withStringData(values)
            .build();

        try {
            client.secrets()
                .inNamespace(namespace)
                .resource(secret)
                .createOr(NonDeletingOperation::update);
        } catch (KubernetesClientException e) {
            throw new CredentialBackendUnavailableException("Unable to write secret '" + name + "' in namespace '" + namespace + "'", e);
        }

        log.info("Secret '{}' written in namespace '{}' with keys {}", name, namespace, values.keySet());
    }

    private Set<String> keys(String namespace, String name) throws CredentialBackendUnavailableException {
        Secret secret;

        try {
            secret = client.secrets()
                .inNamespace(namespace)
                .withName(name)
                .get();
        } catch (KubernetesClientException e) {
            if (KubernetesErrors.isNotFound(e)) {
                return null;
            }

            throw new CredentialBackendUnavailableException(
                "Unable to read secret '" + name + "' in namespace '" + namespace + "'",
                KubernetesErrors.isTransient(e),
                e
            );
        }

        if (secret == null) {
            return null;
        }

        Set<String> keys = new HashSet<>();
        if (secret.getData() != null) {
            keys.addAll(secret.getData().keySet());
        }
        if (secret.getStringData() != null) {
            keys.addAll(secret.getStringData().keySet());
        }

        return keys;
    }
}
