package io.pgbackup.kubernetes.exceptions;

import lombok.Getter;

@Getter
public class CredentialNotFoundException extends BackupJobException {
    private final String secretName;
    private final String key;

    public CredentialNotFoundException(String namespace, String secretName, String key) {
        super("Credential '" + key + "' not found in secret '" + secretName + "' of namespace '" + namespace + "'", false);
        this.secretName = secretName;
        this.key = key;
    }
}
