package io.pgbackup.kubernetes.models;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

@Builder
@Getter
@ToString
@Jacksonized
public class Connection {
    @Schema(
        title = "Trust all certificates"
    )
    private final Boolean trustCerts;

    @Schema(
        title = "Disable hostname verification"
    )
    private final Boolean disableHostnameVerification;

    @Schema(
        title = "The URL to the Kubernetes API"
    )
    @Builder.Default
    private final String masterUrl = "https://kubernetes.default.svc";

    @Schema(
        title = "The namespace used"
    )
    private final String namespace;

    @Schema(
        title = "CA certificate as file path"
    )
    private final String caCertFile;

    @Schema(
        title = "CA certificate as data"
    )
    @ToString.Exclude
    private final String caCertData;

    @Schema(
        title = "Client certificate as a file path"
    )
    private final String clientCertFile;

    @Schema(
        title = "Client certificate as data"
    )
    @ToString.Exclude
    private final String clientCertData;

    @Schema(
        title = "Client key as a file path"
    )
    private final String clientKeyFile;

    @Schema(
        title = "Client key as data"
    )
    @ToString.Exclude
    private final String clientKeyData;

    @Schema(
        title = "Client key encryption algorithm",
        description = "default is RSA"
    )
    @Builder.Default
    private final String clientKeyAlgo = "RSA";

    @Schema(
        title = "Oauth token"
    )
    @ToString.Exclude
    private final String oauthToken;

    @Schema(
        title = "Username"
    )
    private final String username;

    @Schema(
        title = "Password"
    )
    @ToString.Exclude
    private final String password;

    @Schema(
        title = "Timeout of a single API call",
        description = "Applies to submissions, status polls and deletions, independently of the job timeout."
    )
    @Builder.Default
    private final Duration requestTimeout = Duration.ofSeconds(30);

    @Schema(
        title = "Timeout to open a connection to the API server"
    )
    @Builder.Default
    private final Duration connectionTimeout = Duration.ofSeconds(10);

    public Config toConfig() {
        ConfigBuilder builder = new ConfigBuilder(Config.empty());

        if (trustCerts != null) {
            builder.withTrustCerts(trustCerts);
        }

        if (disableHostnameVerification != null) {
            builder.withDisableHostnameVerification(disableHostnameVerification);
        }

        if (masterUrl != null) {
            builder.withMasterUrl(masterUrl);
        }

        if (namespace != null) {
            builder.withNamespace(namespace);
        }

        if (caCertFile != null) {
            builder.withCaCertFile(caCertFile);
        }

        if (caCertData != null) {
            builder.withCaCertData(normalizeBase64(caCertData));
        }

        if (clientCertFile != null) {
            builder.withClientCertFile(clientCertFile);
        }

        if (clientCertData != null) {
            builder.withClientCertData(normalizeBase64(clientCertData));
        }

        if (clientKeyFile != null) {
            builder.withClientKeyFile(clientKeyFile);
        }

        if (clientKeyData != null) {
            builder.withClientKeyData(normalizeBase64(clientKeyData));
        }

        if (clientKeyAlgo != null) {
            builder.withClientKeyAlgo(clientKeyAlgo);
        }

        if (oauthToken != null) {
            builder.withOauthToken(oauthToken);
        }

        if (username != null) {
            builder.withUsername(username);
        }

        if (password != null) {
            builder.withPassword(password);
        }

        if (requestTimeout != null) {
            builder.withRequestTimeout((int) requestTimeout.toMillis());
        }

        if (connectionTimeout != null) {
            builder.withConnectionTimeout((int) connectionTimeout.toMillis());
        }

        return builder.build();
    }

    private static String normalizeBase64(String value) {
        return value.replaceAll("\\s", "");
    }
}
