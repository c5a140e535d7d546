/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.syncagent.agent.resource.kubernetes.SecretOperator;
import io.syncagent.operator.common.InvalidConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Holds the Kubernetes client for the remote cluster.
 */
public class RemoteClientSupplier {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClientSupplier.class);

    /**
     * Key of the kubeconfig in the Secret
     */
    public static final String KUBECONFIG_KEY = "kubeconfig";

    private final KubernetesClient remoteClient;

    /**
     * Constructor.
     *
     * @param remoteClient  Kubernetes client for the remote cluster.
     */
    public RemoteClientSupplier(KubernetesClient remoteClient) {
        this.remoteClient = remoteClient;
    }

    /**
     * Static factory method to build RemoteClientSupplier from the kubeconfig stored in a Secret.
     *
     * @param namespace             Namespace where the kubeconfig secret resides.
     * @param secretName            Name of the kubeconfig secret.
     * @param operationTimeoutMs    Timeout applied to the requests of the remote client.
     * @param secretOperator        SecretOperator capable of retrieving the kubeconfig secret.
     *
     * @return A RemoteClientSupplier with initialized KubernetesClient for the remote cluster.
     */
    public static RemoteClientSupplier buildFromSecret(String namespace, String secretName, long operationTimeoutMs, SecretOperator secretOperator) {
        Secret kubeconfigSecret = secretOperator.get(namespace, secretName);

        if (kubeconfigSecret == null || kubeconfigSecret.getData() == null || !kubeconfigSecret.getData().containsKey(KUBECONFIG_KEY)) {
            throw new InvalidConfigurationException("Secret " + namespace + "/" + secretName + " with the kubeconfig of the remote cluster is missing or has no " + KUBECONFIG_KEY + " key");
        }

        String kubeconfig = new String(Base64.getDecoder().decode(kubeconfigSecret.getData().get(KUBECONFIG_KEY)), StandardCharsets.UTF_8);
        Config config = buildConfig(kubeconfig, operationTimeoutMs);

        LOGGER.info("Creating Kubernetes client for the remote cluster {}", config.getMasterUrl());
        return new RemoteClientSupplier(new KubernetesClientBuilder().withConfig(config).build());
    }

    /**
     * Builds the client configuration from the kubeconfig
     *
     * @param kubeconfig            The kubeconfig
     * @param operationTimeoutMs    Timeout applied to the requests
     *
     * @return  The client configuration
     */
    /* test */ static Config buildConfig(String kubeconfig, long operationTimeoutMs) {
        Config config;

        try {
            config = Config.fromKubeconfig(kubeconfig);
        } catch (RuntimeException e) {
            throw new InvalidConfigurationException("Failed to parse the kubeconfig of the remote cluster", e);
        }

        config.setRequestTimeout((int) Math.min(operationTimeoutMs, Integer.MAX_VALUE));
        return config;
    }

    /**
     * Get the Kubernetes client for the remote cluster.
     *
     * @return KubernetesClient for the remote cluster.
     */
    public KubernetesClient getRemoteClient() {
        return remoteClient;
    }
}
