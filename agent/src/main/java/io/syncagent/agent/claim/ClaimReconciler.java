/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.claim;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.syncagent.agent.metrics.ReconcilerMetrics;
import io.syncagent.agent.resource.AgentConditions;
import io.syncagent.agent.resource.ApiFinalizer;
import io.syncagent.agent.resource.Finalizer;
import io.syncagent.agent.resource.ResourceType;
import io.syncagent.agent.resource.UnstructuredStatus;
import io.syncagent.agent.resource.kubernetes.GenericResourceOperator;
import io.syncagent.api.model.common.Condition;
import io.syncagent.operator.common.MicrometerMetricsProvider;
import io.syncagent.operator.common.Reconciliation;
import io.syncagent.operator.common.ReconciliationException;
import io.syncagent.operator.common.ReconciliationLogger;
import io.syncagent.operator.common.RequeueResult;
import io.syncagent.operator.common.SyncException;
import io.syncagent.operator.common.WaitTiers;
import io.vertx.core.Future;

import java.time.Clock;

/**
 * Reconciles a claim in the local cluster with its counterpart in the remote cluster.
 *
 * <p>The local claim is protected by a finalizer and propagated to the remote cluster. When the local claim is being
 * deleted, the remote claim is deleted first and the finalizer is removed only once the remote claim is gone. The
 * result of every pass which gets past the fetch of the local claim is recorded in the AgentSynced condition of the
 * local claim.</p>
 *
 * <p>Only the failure of the fetch of the local claim and the failure of the status update are returned as errors.
 * All other failures are reported in the status and the reconciliation is requeued.</p>
 */
public class ClaimReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ClaimReconciler.class);

    /* test */ static final String GET_INSTANCE_FAILED = "get instance failed";
    /* test */ static final String DELETE_INSTANCE_FAILED = "delete instance failed";
    /* test */ static final String ADD_FINALIZER_FAILED = "add finalizer failed";
    /* test */ static final String REMOVE_FINALIZER_FAILED = "remove finalizer failed";
    /* test */ static final String UPDATE_STATUS_FAILED = "update status failed";
    /* test */ static final String PROPAGATION_FAILED = "propagation failed";
    /* test */ static final String DELETION_REQUESTED = "deletion is successfully requested";

    /**
     * Finalizer used when no other finalizer is configured
     */
    public static final String DEFAULT_FINALIZER = "agent.syncagent.io/sync";

    private final ResourceType resourceType;
    private final GenericResourceOperator localOperator;
    private final GenericResourceOperator remoteOperator;
    private final WaitTiers waits;
    private final Clock clock;

    private Finalizer<GenericKubernetesResource> finalizer;
    private Propagator<GenericKubernetesResource> propagator;
    private ReconcilerMetrics metrics;

    /**
     * Constructs the claim reconciler. Collaborators which are not configured fall back to their defaults on first use.
     *
     * @param resourceType      Group, version and kind of the claims
     * @param localOperator     Operator for the claims in the local cluster
     * @param remoteOperator    Operator for the claims in the remote cluster
     * @param waits             Requeue delays
     * @param clock             Clock used for the condition timestamps
     */
    public ClaimReconciler(ResourceType resourceType, GenericResourceOperator localOperator, GenericResourceOperator remoteOperator, WaitTiers waits, Clock clock) {
        this.resourceType = resourceType;
        this.localOperator = localOperator;
        this.remoteOperator = remoteOperator;
        this.waits = waits;
        this.clock = clock;
    }

    /**
     * Configures the finalizer
     *
     * @param finalizer     Finalizer protecting the local claims
     *
     * @return  This reconciler
     */
    public ClaimReconciler withFinalizer(Finalizer<GenericKubernetesResource> finalizer) {
        this.finalizer = finalizer;
        return this;
    }

    /**
     * Configures the propagator
     *
     * @param propagator    Propagator pushing the local claims to the remote cluster
     *
     * @return  This reconciler
     */
    public ClaimReconciler withPropagator(Propagator<GenericKubernetesResource> propagator) {
        this.propagator = propagator;
        return this;
    }

    /**
     * Configures the metrics
     *
     * @param metrics   Metrics of this reconciler
     *
     * @return  This reconciler
     */
    public ClaimReconciler withMetrics(ReconcilerMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * @return  Group, version and kind of the reconciled claims
     */
    public ResourceType resourceType() {
        return resourceType;
    }

    private Finalizer<GenericKubernetesResource> finalizer() {
        if (finalizer == null) {
            finalizer = new ApiFinalizer<>(localOperator, DEFAULT_FINALIZER);
        }

        return finalizer;
    }

    private Propagator<GenericKubernetesResource> propagator() {
        if (propagator == null) {
            propagator = new DefaultPropagator(remoteOperator);
        }

        return propagator;
    }

    /* test */ ReconcilerMetrics metrics() {
        if (metrics == null) {
            metrics = new ReconcilerMetrics(resourceType.kind(), new MicrometerMetricsProvider());
        }

        return metrics;
    }

    /**
     * Reconciles the claim identified by the reconciliation
     *
     * @param reconciliation    Reconciliation with the namespace and name of the claim
     *
     * @return  Future with the requeue result. The future fails with {@link ReconciliationException} when the
     *          reconciliation failed in a way which should be logged by the caller.
     */
    public Future<RequeueResult> reconcile(Reconciliation reconciliation) {
        return metrics().record(() -> doReconcile(reconciliation));
    }

    private Future<RequeueResult> doReconcile(Reconciliation reconciliation) {
        return localOperator.getAsync(reconciliation.namespace(), reconciliation.name())
                .recover(error -> Future.failedFuture(new ReconciliationException(waits.requeueShort(), SyncException.local(GET_INSTANCE_FAILED, error))))
                .compose(local -> {
                    if (local == null) {
                        LOGGER.debugCr(reconciliation, "{} not found, nothing to reconcile", resourceType.kind());
                        return Future.succeededFuture(RequeueResult.done());
                    }

                    return remoteOperator.getAsync(reconciliation.namespace(), reconciliation.name())
                            .compose(remote -> reconcileWithRemote(reconciliation, local, remote),
                                    error -> {
                                        LOGGER.warnCr(reconciliation, "Failed to get the remote {}", resourceType.kind(), error);
                                        return updateStatus(reconciliation, local, AgentConditions.agentSyncError(clock, SyncException.remote(GET_INSTANCE_FAILED, error)), waits.requeueShort());
                                    });
                });
    }

    private Future<RequeueResult> reconcileWithRemote(Reconciliation reconciliation, GenericKubernetesResource local, GenericKubernetesResource remote) {
        if (local.getMetadata().getDeletionTimestamp() != null) {
            return reconcileDeletion(reconciliation, local, remote);
        }

        return finalizer().addFinalizer(reconciliation, local)
                .compose(i -> propagate(reconciliation, local, remote),
                        error -> {
                            LOGGER.warnCr(reconciliation, "Failed to add the finalizer", error);
                            return updateStatus(reconciliation, local, AgentConditions.agentSyncError(clock, SyncException.local(ADD_FINALIZER_FAILED, error)), waits.requeueShort());
                        });
    }

    private Future<RequeueResult> propagate(Reconciliation reconciliation, GenericKubernetesResource local, GenericKubernetesResource remote) {
        GenericKubernetesResource target = remote != null ? remote : newRemote(local);

        return propagator().propagate(reconciliation, local, target)
                .compose(i -> {
                    LOGGER.debugCr(reconciliation, "{} propagated to the remote cluster", resourceType.kind());
                    return updateStatus(reconciliation, local, AgentConditions.agentSyncSuccess(clock), waits.requeueLong());
                }, error -> {
                    LOGGER.warnCr(reconciliation, "Failed to propagate {} to the remote cluster", resourceType.kind(), error);
                    return updateStatus(reconciliation, local, AgentConditions.agentSyncError(clock, SyncException.of(PROPAGATION_FAILED, error)), waits.requeueShort());
                });
    }

    private Future<RequeueResult> reconcileDeletion(Reconciliation reconciliation, GenericKubernetesResource local, GenericKubernetesResource remote) {
        if (remote == null) {
            LOGGER.debugCr(reconciliation, "Remote {} is gone, removing the finalizer", resourceType.kind());

            return finalizer().removeFinalizer(reconciliation, local)
                    .compose(i -> Future.succeededFuture(RequeueResult.done()),
                            error -> {
                                LOGGER.warnCr(reconciliation, "Failed to remove the finalizer", error);
                                return updateStatus(reconciliation, local, AgentConditions.agentSyncError(clock, SyncException.local(REMOVE_FINALIZER_FAILED, error)), waits.requeueShort());
                            });
        }

        LOGGER.debugCr(reconciliation, "Deleting the remote {}", resourceType.kind());

        return remoteOperator.deleteAsync(reconciliation, remote.getMetadata().getNamespace(), remote.getMetadata().getName())
                .compose(i -> updateStatus(reconciliation, local, AgentConditions.agentSyncSuccess(clock, DELETION_REQUESTED), waits.requeueTiny()),
                        error -> {
                            LOGGER.warnCr(reconciliation, "Failed to delete the remote {}", resourceType.kind(), error);
                            return updateStatus(reconciliation, local, AgentConditions.agentSyncError(clock, SyncException.remote(DELETE_INSTANCE_FAILED, error)), waits.requeueShort());
                        });
    }

    /**
     * Sets the condition on the local claim and updates its status
     */
    private Future<RequeueResult> updateStatus(Reconciliation reconciliation, GenericKubernetesResource local, Condition condition, RequeueResult result) {
        UnstructuredStatus.setCondition(local, condition);

        return localOperator.updateStatusAsync(reconciliation, local)
                .compose(i -> Future.succeededFuture(result),
                        error -> Future.failedFuture(new ReconciliationException(result, SyncException.local(UPDATE_STATUS_FAILED, error))));
    }

    /**
     * Creates the remote claim used for the propagation when it does not exist yet
     *
     * @param local     The local claim
     *
     * @return  New remote claim with the identity of the local claim
     */
    /* test */ static GenericKubernetesResource newRemote(GenericKubernetesResource local) {
        GenericKubernetesResource remote = new GenericKubernetesResource();
        remote.setApiVersion(local.getApiVersion());
        remote.setKind(local.getKind());
        remote.setMetadata(new ObjectMetaBuilder()
                .withName(local.getMetadata().getName())
                .withNamespace(local.getMetadata().getNamespace())
                .build());

        return remote;
    }
}
