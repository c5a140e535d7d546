/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent;

import io.syncagent.agent.resource.ResourceType;
import io.syncagent.operator.common.InvalidConfigurationException;
import io.syncagent.operator.common.WaitTiers;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AgentConfigTest {
    private static Map<String, String> minimalEnv() {
        Map<String, String> env = new HashMap<>();
        env.put(AgentConfig.SYNC_AGENT_REMOTE_KUBECONFIG_SECRET, "remote-kubeconfig");
        return env;
    }

    @Test
    public void testDefaults() {
        AgentConfig config = AgentConfig.buildFromMap(minimalEnv());

        assertThat(config.getNamespace(), is("default"));
        assertThat(config.getRemoteKubeconfigSecret(), is("remote-kubeconfig"));
        assertThat(config.getClaimTypes(), is(List.of()));
        assertThat(config.getFinalizer(), is("agent.syncagent.io/sync"));
        assertThat(config.getWaits(), is(WaitTiers.DEFAULT));
        assertThat(config.getOperationTimeoutMs(), is(120_000L));
    }

    @Test
    public void testCustomValues() {
        Map<String, String> env = minimalEnv();
        env.put(AgentConfig.SYNC_AGENT_NAMESPACE, "sync-system");
        env.put(AgentConfig.SYNC_AGENT_CLAIM_TYPES, "database.example.org/v1alpha1/PostgreSQLInstance, cache.example.org/v1/RedisInstance");
        env.put(AgentConfig.SYNC_AGENT_FINALIZER, "example.org/finalizer");
        env.put(AgentConfig.SYNC_AGENT_TINY_WAIT_MS, "1000");
        env.put(AgentConfig.SYNC_AGENT_SHORT_WAIT_MS, "10000");
        env.put(AgentConfig.SYNC_AGENT_LONG_WAIT_MS, "300000");
        env.put(AgentConfig.SYNC_AGENT_OPERATION_TIMEOUT_MS, "5000");

        AgentConfig config = AgentConfig.buildFromMap(env);

        assertThat(config.getNamespace(), is("sync-system"));
        assertThat(config.getClaimTypes(), is(List.of(
                new ResourceType("database.example.org", "v1alpha1", "PostgreSQLInstance"),
                new ResourceType("cache.example.org", "v1", "RedisInstance"))));
        assertThat(config.getFinalizer(), is("example.org/finalizer"));
        assertThat(config.getWaits(), is(new WaitTiers(Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofMinutes(5))));
        assertThat(config.getOperationTimeoutMs(), is(5000L));
    }

    @Test
    public void testMissingSecret() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> AgentConfig.buildFromMap(Map.of()));

        assertThat(e.getMessage(), containsString(AgentConfig.SYNC_AGENT_REMOTE_KUBECONFIG_SECRET));
    }

    @Test
    public void testInvalidNumber() {
        Map<String, String> env = minimalEnv();
        env.put(AgentConfig.SYNC_AGENT_SHORT_WAIT_MS, "thirty seconds");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> AgentConfig.buildFromMap(env));

        assertThat(e.getMessage(), containsString(AgentConfig.SYNC_AGENT_SHORT_WAIT_MS));
    }

    @Test
    public void testInvalidWaitOrder() {
        Map<String, String> env = minimalEnv();
        env.put(AgentConfig.SYNC_AGENT_TINY_WAIT_MS, "60000");

        assertThrows(InvalidConfigurationException.class, () -> AgentConfig.buildFromMap(env));
    }

    @Test
    public void testInvalidTimeout() {
        Map<String, String> env = minimalEnv();
        env.put(AgentConfig.SYNC_AGENT_OPERATION_TIMEOUT_MS, "0");

        assertThrows(InvalidConfigurationException.class, () -> AgentConfig.buildFromMap(env));
    }

    @Test
    public void testClaimTypes() {
        assertThat(AgentConfig.parseClaimTypes(null), is(List.of()));
        assertThat(AgentConfig.parseClaimTypes(" , "), is(List.of()));
        assertThrows(InvalidConfigurationException.class, () -> AgentConfig.parseClaimTypes("example.org/v1/Claim,example.org/v1/Claim"));
        assertThrows(InvalidConfigurationException.class, () -> AgentConfig.parseClaimTypes("Claim"));
    }
}
