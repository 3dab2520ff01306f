package io.pgbackup.kubernetes.services;

import io.pgbackup.kubernetes.exceptions.CredentialBackendUnavailableException;
import io.pgbackup.kubernetes.exceptions.CredentialNotFoundException;
import io.pgbackup.kubernetes.models.ResolvedCredentials;
import io.pgbackup.kubernetes.models.SecretRef;

import java.util.Map;

/**
 * Turns named secrets into references the cluster binds when the pod starts.
 * <p>
 * Implementations must never copy a secret value into the returned references.
 */
public interface CredentialResolver {
    /**
     * @param namespace the namespace the job runs in
     * @param references the secrets to resolve, keyed by the environment variable that will receive them
     * @throws CredentialNotFoundException if a secret or one of its keys does not exist
     * @throws CredentialBackendUnavailableException if the secret store could not be reached, retryable
     */
    ResolvedCredentials resolve(String namespace, Map<String, SecretRef> references) throws CredentialNotFoundException, CredentialBackendUnavailableException;
}
