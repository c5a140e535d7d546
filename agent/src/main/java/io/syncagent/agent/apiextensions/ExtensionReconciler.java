/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.apiextensions;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.syncagent.agent.metrics.ReconcilerMetrics;
import io.syncagent.agent.resource.Applicator;
import io.syncagent.agent.resource.OperatorApplicator;
import io.syncagent.agent.resource.ResourceMeta;
import io.syncagent.agent.resource.kubernetes.AbstractResourceOperator;
import io.syncagent.agent.resource.kubernetes.CustomResourceDefinitionOperator;
import io.syncagent.operator.common.MicrometerMetricsProvider;
import io.syncagent.operator.common.Reconciliation;
import io.syncagent.operator.common.ReconciliationException;
import io.syncagent.operator.common.ReconciliationLogger;
import io.syncagent.operator.common.RequeueResult;
import io.syncagent.operator.common.SyncException;
import io.syncagent.operator.common.WaitTiers;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mirrors the API extension resources of one kind from the remote cluster into the local cluster. Once the CRD of
 * the kind is established, the requested resource is applied from the remote cluster and all local resources which
 * do not exist in the remote cluster anymore are deleted.
 *
 * <p>Only the requested resource gets its content synchronized. The other resources are compared only by their names
 * and deleted when missing in the remote cluster.</p>
 *
 * @param <T>   Type of the resource
 * @param <L>   Type of the resource list
 */
public class ExtensionReconciler<T extends HasMetadata, L extends KubernetesResourceList<T>> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ExtensionReconciler.class);

    /* test */ static final String GET_CRD_FAILED = "get custom resource definition failed";
    /* test */ static final String GET_INSTANCE_FAILED = "get instance of %s failed";
    /* test */ static final String APPLY_INSTANCE_FAILED = "apply instance of %s failed";
    /* test */ static final String LIST_INSTANCES_FAILED = "list instances of %s failed";
    /* test */ static final String DELETE_INSTANCE_FAILED = "delete instance of %s failed";

    private final String crdName;
    private final String kind;
    private final CustomResourceDefinitionOperator crdOperator;
    private final AbstractResourceOperator<?, T, L> localOperator;
    private final AbstractResourceOperator<?, T, L> remoteOperator;
    private final InstanceSetStrategy<T, L> strategy;
    private final WaitTiers waits;

    private Applicator<T> applicator;
    private ReconcilerMetrics metrics;

    /**
     * Constructs the reconciler
     *
     * @param crdName           Name of the CRD of the synchronized kind
     * @param crdOperator       Operator for the CRDs in the local cluster
     * @param localOperator     Operator for the resources in the local cluster
     * @param remoteOperator    Operator for the resources in the remote cluster
     * @param strategy          Strategy of the synchronized kind
     * @param waits             Requeue delays
     */
    public ExtensionReconciler(String crdName,
                               CustomResourceDefinitionOperator crdOperator,
                               AbstractResourceOperator<?, T, L> localOperator,
                               AbstractResourceOperator<?, T, L> remoteOperator,
                               InstanceSetStrategy<T, L> strategy,
                               WaitTiers waits) {
        this.crdName = crdName;
        this.crdOperator = crdOperator;
        this.localOperator = localOperator;
        this.remoteOperator = remoteOperator;
        this.strategy = strategy;
        this.waits = waits;
        this.kind = strategy.newInstance().getKind();
    }

    /**
     * Configures the applicator used to apply the resources in the local cluster
     *
     * @param applicator    The applicator
     *
     * @return  This reconciler
     */
    public ExtensionReconciler<T, L> withApplicator(Applicator<T> applicator) {
        this.applicator = applicator;
        return this;
    }

    /**
     * Configures the metrics
     *
     * @param metrics   Metrics of this reconciler
     *
     * @return  This reconciler
     */
    public ExtensionReconciler<T, L> withMetrics(ReconcilerMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * @return  Name of the CRD of the synchronized kind
     */
    public String crdName() {
        return crdName;
    }

    /**
     * @return  Kind of the synchronized resources
     */
    public String kind() {
        return kind;
    }

    private Applicator<T> applicator() {
        if (applicator == null) {
            applicator = new OperatorApplicator<>(localOperator);
        }

        return applicator;
    }

    /* test */ ReconcilerMetrics metrics() {
        if (metrics == null) {
            metrics = new ReconcilerMetrics(kind, new MicrometerMetricsProvider());
        }

        return metrics;
    }

    /**
     * Reconciles the resource identified by the reconciliation
     *
     * @param reconciliation    Reconciliation with the namespace (null for cluster-scoped kinds) and name of the resource
     *
     * @return  Future with the requeue result. All failures are returned as failed future with
     *          {@link ReconciliationException}.
     */
    public Future<RequeueResult> reconcile(Reconciliation reconciliation) {
        return metrics().record(() -> doReconcile(reconciliation));
    }

    private Future<RequeueResult> doReconcile(Reconciliation reconciliation) {
        return crdOperator.getAsync(null, crdName)
                .recover(error -> failure(SyncException.local(GET_CRD_FAILED, error)))
                .compose(crd -> {
                    if (!CustomResourceDefinitionOperator.isEstablished(crd)) {
                        LOGGER.debugCr(reconciliation, "CustomResourceDefinition {} is not established yet", crdName);
                        return Future.succeededFuture(waits.requeueTiny());
                    }

                    return remoteOperator.getAsync(reconciliation.namespace(), reconciliation.name())
                            .recover(error -> failure(SyncException.remote(String.format(GET_INSTANCE_FAILED, crdName), error)))
                            .compose(instance -> apply(reconciliation, instance))
                            .compose(i -> collectGarbage(reconciliation))
                            .map(i -> waits.requeueLong());
                });
    }

    private Future<Void> apply(Reconciliation reconciliation, T instance) {
        if (instance == null) {
            LOGGER.debugCr(reconciliation, "{} does not exist in the remote cluster", kind);
            return Future.succeededFuture();
        }

        return applicator().apply(reconciliation, ResourceMeta.sanitizedCopy(instance))
                .recover(error -> failure(SyncException.local(String.format(APPLY_INSTANCE_FAILED, crdName), error)))
                .mapEmpty();
    }

    private Future<Void> collectGarbage(Reconciliation reconciliation) {
        return localOperator.listAsync(reconciliation.namespace())
                .recover(error -> failure(SyncException.local(String.format(LIST_INSTANCES_FAILED, crdName), error)))
                .compose(localList -> remoteOperator.listAsync(reconciliation.namespace())
                        .recover(error -> failure(SyncException.remote(String.format(LIST_INSTANCES_FAILED, crdName), error)))
                        .compose(remoteList -> deleteOrphans(reconciliation, orphans(items(localList), items(remoteList)))));
    }

    private Future<Void> deleteOrphans(Reconciliation reconciliation, List<T> orphans) {
        Future<Void> deletions = Future.succeededFuture();

        for (T orphan : orphans) {
            deletions = deletions.compose(i -> {
                LOGGER.infoCr(reconciliation, "Deleting {} {} which does not exist in the remote cluster", kind, orphan.getMetadata().getName());
                return localOperator.deleteAsync(reconciliation, orphan.getMetadata().getNamespace(), orphan.getMetadata().getName());
            });
        }

        return deletions.recover(error -> failure(SyncException.local(String.format(DELETE_INSTANCE_FAILED, crdName), error)));
    }

    private List<T> items(L list) {
        return strategy.getItems(list != null ? list : strategy.newList());
    }

    /**
     * Finds the local resources which do not exist in the remote cluster. The resources are matched by their names.
     *
     * @param localItems    Resources in the local cluster
     * @param remoteItems   Resources in the remote cluster
     *
     * @return  Local resources without a remote counterpart
     *
     * @param <T>   Type of the resource
     */
    /* test */ static <T extends HasMetadata> List<T> orphans(List<T> localItems, List<T> remoteItems) {
        Set<String> remoteNames = new HashSet<>(remoteItems.size());

        for (T remote : remoteItems) {
            remoteNames.add(remote.getMetadata().getName());
        }

        List<T> orphans = new ArrayList<>();

        for (T local : localItems) {
            if (!remoteNames.contains(local.getMetadata().getName())) {
                orphans.add(local);
            }
        }

        return orphans;
    }

    private <X> Future<X> failure(Throwable cause) {
        return Future.failedFuture(new ReconciliationException(waits.requeueShort(), cause));
    }
}
