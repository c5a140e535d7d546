/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent;

import io.syncagent.agent.claim.ClaimReconciler;
import io.syncagent.agent.resource.ResourceType;
import io.syncagent.operator.common.InvalidConfigurationException;
import io.syncagent.operator.common.WaitTiers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the agent, read from the environment variables
 */
public class AgentConfig {
    /**
     * Namespace with the Secret holding the kubeconfig of the remote cluster
     */
    public static final String SYNC_AGENT_NAMESPACE = "SYNC_AGENT_NAMESPACE";

    /**
     * Name of the Secret holding the kubeconfig of the remote cluster
     */
    public static final String SYNC_AGENT_REMOTE_KUBECONFIG_SECRET = "SYNC_AGENT_REMOTE_KUBECONFIG_SECRET";

    /**
     * Comma separated list of the claim kinds in the group/version/Kind format
     */
    public static final String SYNC_AGENT_CLAIM_TYPES = "SYNC_AGENT_CLAIM_TYPES";

    /**
     * Finalizer set on the local claims
     */
    public static final String SYNC_AGENT_FINALIZER = "SYNC_AGENT_FINALIZER";

    /**
     * Requeue delay for transient states, in milliseconds
     */
    public static final String SYNC_AGENT_TINY_WAIT_MS = "SYNC_AGENT_TINY_WAIT_MS";

    /**
     * Requeue delay after failures, in milliseconds
     */
    public static final String SYNC_AGENT_SHORT_WAIT_MS = "SYNC_AGENT_SHORT_WAIT_MS";

    /**
     * Requeue delay after successful reconciliation, in milliseconds
     */
    public static final String SYNC_AGENT_LONG_WAIT_MS = "SYNC_AGENT_LONG_WAIT_MS";

    /**
     * Timeout of the Kubernetes API calls, in milliseconds
     */
    public static final String SYNC_AGENT_OPERATION_TIMEOUT_MS = "SYNC_AGENT_OPERATION_TIMEOUT_MS";

    /* test */ static final String DEFAULT_NAMESPACE = "default";
    /* test */ static final long DEFAULT_OPERATION_TIMEOUT_MS = 120_000L;

    private final String namespace;
    private final String remoteKubeconfigSecret;
    private final List<ResourceType> claimTypes;
    private final String finalizer;
    private final WaitTiers waits;
    private final long operationTimeoutMs;

    /**
     * Constructor
     *
     * @param namespace                 Namespace with the kubeconfig Secret
     * @param remoteKubeconfigSecret    Name of the kubeconfig Secret
     * @param claimTypes                Claim kinds which should be synchronized
     * @param finalizer                 Finalizer set on the local claims
     * @param waits                     Requeue delays
     * @param operationTimeoutMs        Timeout of the Kubernetes API calls
     */
    public AgentConfig(String namespace, String remoteKubeconfigSecret, List<ResourceType> claimTypes, String finalizer, WaitTiers waits, long operationTimeoutMs) {
        this.namespace = namespace;
        this.remoteKubeconfigSecret = remoteKubeconfigSecret;
        this.claimTypes = claimTypes;
        this.finalizer = finalizer;
        this.waits = waits;
        this.operationTimeoutMs = operationTimeoutMs;
    }

    /**
     * Loads the configuration from a map of environment variables
     *
     * @param map   Map with the environment variables
     *
     * @return  The agent configuration
     */
    public static AgentConfig buildFromMap(Map<String, String> map) {
        String namespace = valueOrDefault(map, SYNC_AGENT_NAMESPACE, DEFAULT_NAMESPACE);

        String secret = map.get(SYNC_AGENT_REMOTE_KUBECONFIG_SECRET);
        if (secret == null || secret.isBlank()) {
            throw new InvalidConfigurationException(SYNC_AGENT_REMOTE_KUBECONFIG_SECRET + " has to be set");
        }

        WaitTiers waits = new WaitTiers(
                parseDuration(map, SYNC_AGENT_TINY_WAIT_MS, WaitTiers.DEFAULT_TINY_WAIT),
                parseDuration(map, SYNC_AGENT_SHORT_WAIT_MS, WaitTiers.DEFAULT_SHORT_WAIT),
                parseDuration(map, SYNC_AGENT_LONG_WAIT_MS, WaitTiers.DEFAULT_LONG_WAIT));

        long timeout = parseDuration(map, SYNC_AGENT_OPERATION_TIMEOUT_MS, Duration.ofMillis(DEFAULT_OPERATION_TIMEOUT_MS)).toMillis();
        if (timeout <= 0) {
            throw new InvalidConfigurationException(SYNC_AGENT_OPERATION_TIMEOUT_MS + " has to be positive");
        }

        return new AgentConfig(
                namespace,
                secret.trim(),
                parseClaimTypes(map.get(SYNC_AGENT_CLAIM_TYPES)),
                valueOrDefault(map, SYNC_AGENT_FINALIZER, ClaimReconciler.DEFAULT_FINALIZER),
                waits,
                timeout);
    }

    /**
     * Parses the list of claim kinds
     *
     * @param value     Comma separated list of claim kinds
     *
     * @return  List of the claim kinds
     */
    /* test */ static List<ResourceType> parseClaimTypes(String value) {
        List<ResourceType> types = new ArrayList<>();

        if (value != null && !value.isBlank()) {
            for (String type : value.split(",")) {
                if (!type.isBlank()) {
                    ResourceType parsed = ResourceType.parse(type);

                    if (types.contains(parsed)) {
                        throw new InvalidConfigurationException("Claim type " + parsed + " is configured more than once");
                    }

                    types.add(parsed);
                }
            }
        }

        return types;
    }

    private static String valueOrDefault(Map<String, String> map, String key, String defaultValue) {
        String value = map.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static Duration parseDuration(Map<String, String> map, String key, Duration defaultValue) {
        String value = map.get(key);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse " + key + ". The value " + value + " is not a number", e);
        }
    }

    /**
     * @return  Namespace with the kubeconfig Secret
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * @return  Name of the kubeconfig Secret
     */
    public String getRemoteKubeconfigSecret() {
        return remoteKubeconfigSecret;
    }

    /**
     * @return  Claim kinds which should be synchronized
     */
    public List<ResourceType> getClaimTypes() {
        return claimTypes;
    }

    /**
     * @return  Finalizer set on the local claims
     */
    public String getFinalizer() {
        return finalizer;
    }

    /**
     * @return  Requeue delays
     */
    public WaitTiers getWaits() {
        return waits;
    }

    /**
     * @return  Timeout of the Kubernetes API calls in milliseconds
     */
    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    @Override
    public String toString() {
        return "AgentConfig(" +
                "namespace=" + namespace +
                ",remoteKubeconfigSecret=" + remoteKubeconfigSecret +
                ",claimTypes=" + claimTypes +
                ",finalizer=" + finalizer +
                ",waits=" + waits +
                ",operationTimeoutMs=" + operationTimeoutMs +
                ")";
    }
}
