package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.pgbackup.kubernetes.models.Connection;

abstract public class ClientService {
    /**
     * Creates a {@link KubernetesClient} configured from the environment, loading in order:
     * 1. System properties
     * 2. Environment variables
     * 3. Kube config file
     * 4. Service account token and a mounted CA certificate
     *
     * @return {@link KubernetesClient} configured from the cluster configuration
     */
    public static KubernetesClient of() {
        return new KubernetesClientBuilder().build();
    }

    /**
     * Creates a {@link KubernetesClient} from a {@link Config}.
     *
     * @param config The {@link Config} to configure the client from.
     * @return {@link KubernetesClient} configured from the provided {@link Config}
     */
    public static KubernetesClient of(Config config) {
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    /**
     * @param connection explicit connection parameters, {@code null} to auto-configure
     */
    public static KubernetesClient of(Connection connection) {
        return connection != null ? of(connection.toConfig()) : of();
    }
}
