/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.syncagent.agent.resource.ResourceType;
import io.syncagent.api.model.apiextensions.CompositeResourceDefinition;
import io.syncagent.api.model.apiextensions.Composition;
import io.syncagent.operator.common.InvalidConfigurationException;
import io.syncagent.operator.common.MicrometerMetricsProvider;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static io.syncagent.agent.util.AgentTestFixtures.CLOCK;
import static io.syncagent.agent.util.AgentTestFixtures.kubeconfig;
import static io.syncagent.agent.util.AgentTestFixtures.kubeconfigSecret;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(VertxExtension.class)
public class SyncAgentTest {
    @Test
    public void testReconcilersAreCreated(Vertx vertx) {
        AgentConfig config = AgentConfig.buildFromMap(Map.of(
                AgentConfig.SYNC_AGENT_REMOTE_KUBECONFIG_SECRET, "remote-kubeconfig",
                AgentConfig.SYNC_AGENT_CLAIM_TYPES, "database.example.org/v1alpha1/PostgreSQLInstance,cache.example.org/v1/RedisInstance"));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        SyncAgent agent = SyncAgent.create(config, vertx, mock(KubernetesClient.class), new RemoteClientSupplier(mock(KubernetesClient.class)), new MicrometerMetricsProvider(registry), CLOCK);

        assertThat(agent.getClaimReconcilers().size(), is(2));
        assertThat(agent.getClaimReconciler(ResourceType.parse("cache.example.org/v1/RedisInstance")), is(notNullValue()));
        assertThat(agent.getClaimReconciler(ResourceType.parse("cache.example.org/v1/MemcachedInstance")), is(nullValue()));

        assertThat(agent.getCompositionReconciler().crdName(), is(Composition.CRD_NAME));
        assertThat(agent.getCompositionReconciler().kind(), is("Composition"));
        assertThat(agent.getDefinitionReconciler().crdName(), is(CompositeResourceDefinition.CRD_NAME));

        // Metrics are registered for every reconciler
        assertThat(registry.get("sync_agent.reconciliations").tag("kind", "PostgreSQLInstance").counter(), is(notNullValue()));
        assertThat(registry.get("sync_agent.reconciliations").tag("kind", "CompositeResourceDefinition").counter(), is(notNullValue()));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testRemoteClientFromConfiguredSecret(Vertx vertx) {
        AgentConfig config = AgentConfig.buildFromMap(Map.of(
                AgentConfig.SYNC_AGENT_NAMESPACE, "sync-system",
                AgentConfig.SYNC_AGENT_REMOTE_KUBECONFIG_SECRET, "remote-kubeconfig",
                AgentConfig.SYNC_AGENT_CLAIM_TYPES, "database.example.org/v1alpha1/PostgreSQLInstance"));

        KubernetesClient localClient = mock(KubernetesClient.class);
        MixedOperation<Secret, SecretList, Resource<Secret>> secrets = mock(MixedOperation.class);
        NonNamespaceOperation<Secret, SecretList, Resource<Secret>> namespacedSecrets = mock(NonNamespaceOperation.class);
        Resource<Secret> secret = mock(Resource.class);
        when(localClient.secrets()).thenReturn(secrets);
        when(secrets.inNamespace("sync-system")).thenReturn(namespacedSecrets);
        when(namespacedSecrets.withName("remote-kubeconfig")).thenReturn(secret);
        when(secret.get()).thenReturn(kubeconfigSecret("sync-system", "remote-kubeconfig", kubeconfig("https://remote.example.com:6443")));

        SyncAgent agent = SyncAgent.create(config, vertx, localClient, new MicrometerMetricsProvider(new SimpleMeterRegistry()), CLOCK);

        assertThat(agent.getClaimReconcilers().size(), is(1));
        verify(namespacedSecrets, times(1)).withName("remote-kubeconfig");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testMissingRemoteKubeconfigSecret(Vertx vertx) {
        AgentConfig config = AgentConfig.buildFromMap(Map.of(
                AgentConfig.SYNC_AGENT_NAMESPACE, "sync-system",
                AgentConfig.SYNC_AGENT_REMOTE_KUBECONFIG_SECRET, "remote-kubeconfig"));

        KubernetesClient localClient = mock(KubernetesClient.class);
        MixedOperation<Secret, SecretList, Resource<Secret>> secrets = mock(MixedOperation.class);
        NonNamespaceOperation<Secret, SecretList, Resource<Secret>> namespacedSecrets = mock(NonNamespaceOperation.class);
        Resource<Secret> secret = mock(Resource.class);
        when(localClient.secrets()).thenReturn(secrets);
        when(secrets.inNamespace("sync-system")).thenReturn(namespacedSecrets);
        when(namespacedSecrets.withName("remote-kubeconfig")).thenReturn(secret);
        when(secret.get()).thenReturn(null);

        assertThrows(InvalidConfigurationException.class,
                () -> SyncAgent.create(config, vertx, localClient, new MicrometerMetricsProvider(new SimpleMeterRegistry()), CLOCK));
    }
}
