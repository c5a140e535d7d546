/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.syncagent.agent.apiextensions.ApiExtensionsKinds;
import io.syncagent.agent.apiextensions.ExtensionReconciler;
import io.syncagent.agent.apiextensions.InstanceSetStrategy;
import io.syncagent.agent.claim.ClaimReconciler;
import io.syncagent.agent.claim.DefaultPropagator;
import io.syncagent.agent.metrics.ReconcilerMetrics;
import io.syncagent.agent.resource.ApiFinalizer;
import io.syncagent.agent.resource.ResourceType;
import io.syncagent.agent.resource.kubernetes.CrdOperator;
import io.syncagent.agent.resource.kubernetes.CustomResourceDefinitionOperator;
import io.syncagent.agent.resource.kubernetes.GenericResourceOperator;
import io.syncagent.agent.resource.kubernetes.SecretOperator;
import io.syncagent.api.model.apiextensions.CompositeResourceDefinition;
import io.syncagent.api.model.apiextensions.CompositeResourceDefinitionList;
import io.syncagent.api.model.apiextensions.Composition;
import io.syncagent.api.model.apiextensions.CompositionList;
import io.syncagent.operator.common.MetricsProvider;
import io.syncagent.operator.common.ReconciliationLogger;
import io.vertx.core.Vertx;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds the reconcilers of the agent wired to the local and remote clusters. Scheduling of the reconciliations is
 * left to the controller runtime embedding the agent.
 */
public class SyncAgent {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(SyncAgent.class);

    private final List<ClaimReconciler> claimReconcilers;
    private final ExtensionReconciler<Composition, CompositionList> compositionReconciler;
    private final ExtensionReconciler<CompositeResourceDefinition, CompositeResourceDefinitionList> definitionReconciler;

    /**
     * Constructor
     *
     * @param claimReconcilers          Reconcilers of the claims
     * @param compositionReconciler     Reconciler of the Compositions
     * @param definitionReconciler      Reconciler of the CompositeResourceDefinitions
     */
    public SyncAgent(List<ClaimReconciler> claimReconcilers,
                     ExtensionReconciler<Composition, CompositionList> compositionReconciler,
                     ExtensionReconciler<CompositeResourceDefinition, CompositeResourceDefinitionList> definitionReconciler) {
        this.claimReconcilers = Collections.unmodifiableList(claimReconcilers);
        this.compositionReconciler = compositionReconciler;
        this.definitionReconciler = definitionReconciler;
    }

    /**
     * Creates the agent and its reconcilers. The client for the remote cluster is built from the kubeconfig Secret
     * configured in the agent configuration and uses the configured operation timeout.
     *
     * @param config            The agent configuration
     * @param vertx             Vert.x instance
     * @param localClient       Kubernetes client for the local cluster
     * @param metricsProvider   Metrics provider
     * @param clock             Clock used for the condition timestamps
     *
     * @return  The agent
     */
    public static SyncAgent create(AgentConfig config, Vertx vertx, KubernetesClient localClient, MetricsProvider metricsProvider, Clock clock) {
        RemoteClientSupplier remoteClientSupplier = RemoteClientSupplier.buildFromSecret(config.getNamespace(),
                config.getRemoteKubeconfigSecret(),
                config.getOperationTimeoutMs(),
                new SecretOperator(vertx, localClient));

        return create(config, vertx, localClient, remoteClientSupplier, metricsProvider, clock);
    }

    /**
     * Creates the agent and its reconcilers
     *
     * @param config                The agent configuration
     * @param vertx                 Vert.x instance
     * @param localClient           Kubernetes client for the local cluster
     * @param remoteClientSupplier  Supplier of the Kubernetes client for the remote cluster
     * @param metricsProvider       Metrics provider
     * @param clock                 Clock used for the condition timestamps
     *
     * @return  The agent
     */
    public static SyncAgent create(AgentConfig config, Vertx vertx, KubernetesClient localClient, RemoteClientSupplier remoteClientSupplier, MetricsProvider metricsProvider, Clock clock) {
        KubernetesClient remoteClient = remoteClientSupplier.getRemoteClient();
        List<ClaimReconciler> claimReconcilers = new ArrayList<>(config.getClaimTypes().size());

        for (ResourceType type : config.getClaimTypes()) {
            GenericResourceOperator localOperator = new GenericResourceOperator(vertx, localClient, type);
            GenericResourceOperator remoteOperator = new GenericResourceOperator(vertx, remoteClient, type);

            claimReconcilers.add(new ClaimReconciler(type, localOperator, remoteOperator, config.getWaits(), clock)
                    .withFinalizer(new ApiFinalizer<>(localOperator, config.getFinalizer()))
                    .withPropagator(new DefaultPropagator(remoteOperator))
                    .withMetrics(new ReconcilerMetrics(type.kind(), metricsProvider)));

            LOGGER.infoOp("Claims of type {} will be synchronized", type);
        }

        CustomResourceDefinitionOperator crdOperator = new CustomResourceDefinitionOperator(vertx, localClient);

        return new SyncAgent(claimReconcilers,
                extensionReconciler(Composition.CRD_NAME, ApiExtensionsKinds.COMPOSITIONS, config, vertx, crdOperator, localClient, remoteClient, metricsProvider),
                extensionReconciler(CompositeResourceDefinition.CRD_NAME, ApiExtensionsKinds.DEFINITIONS, config, vertx, crdOperator, localClient, remoteClient, metricsProvider));
    }

    private static <T extends HasMetadata, L extends KubernetesResourceList<T>> ExtensionReconciler<T, L> extensionReconciler(String crdName,
                                                                                                                          InstanceSetStrategy<T, L> strategy,
                                                                                                                          AgentConfig config,
                                                                                                                          Vertx vertx,
                                                                                                                          CustomResourceDefinitionOperator crdOperator,
                                                                                                                          KubernetesClient localClient,
                                                                                                                          KubernetesClient remoteClient,
                                                                                                                          MetricsProvider metricsProvider) {
        String kind = strategy.newInstance().getKind();

        return new ExtensionReconciler<>(crdName,
                crdOperator,
                new CrdOperator<>(vertx, localClient, strategy.instanceType(), strategy.listType(), kind),
                new CrdOperator<>(vertx, remoteClient, strategy.instanceType(), strategy.listType(), kind),
                strategy,
                config.getWaits())
                .withMetrics(new ReconcilerMetrics(kind, metricsProvider));
    }

    /**
     * @return  Reconcilers of the claims, one for each configured claim type
     */
    public List<ClaimReconciler> getClaimReconcilers() {
        return claimReconcilers;
    }

    /**
     * Finds the reconciler for the claim type
     *
     * @param type  Claim type
     *
     * @return  The reconciler or null if the claim type is not configured
     */
    public ClaimReconciler getClaimReconciler(ResourceType type) {
        return claimReconcilers.stream()
                .filter(reconciler -> reconciler.resourceType().equals(type))
                .findFirst()
                .orElse(null);
    }

    /**
     * @return  Reconciler of the Compositions
     */
    public ExtensionReconciler<Composition, CompositionList> getCompositionReconciler() {
        return compositionReconciler;
    }

    /**
     * @return  Reconciler of the CompositeResourceDefinitions
     */
    public ExtensionReconciler<CompositeResourceDefinition, CompositeResourceDefinitionList> getDefinitionReconciler() {
        return definitionReconciler;
    }
}
