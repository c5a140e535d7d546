/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.syncagent.agent.resource.kubernetes.AbstractResourceOperator;
import io.syncagent.operator.common.Reconciliation;
import io.syncagent.operator.common.ReconciliationLogger;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.List;

/**
 * Finalizer implementation which adds or removes a finalizer string in the metadata of the resource and updates it
 * through the Kubernetes API.
 *
 * @param <T>   Type of the resource
 */
public class ApiFinalizer<T extends HasMetadata> implements Finalizer<T> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ApiFinalizer.class);

    private final AbstractResourceOperator<?, T, ?> operator;
    private final String finalizer;

    /**
     * Constructor
     *
     * @param operator      Operator used to update the resources
     * @param finalizer     The finalizer string
     */
    public ApiFinalizer(AbstractResourceOperator<?, T, ?> operator, String finalizer) {
        this.operator = operator;
        this.finalizer = finalizer;
    }

    @Override
    public Future<Void> addFinalizer(Reconciliation reconciliation, T resource) {
        List<String> finalizers = resource.getMetadata().getFinalizers();

        if (finalizers != null && finalizers.contains(finalizer)) {
            return Future.succeededFuture();
        }

        List<String> updated = finalizers != null ? new ArrayList<>(finalizers) : new ArrayList<>();
        updated.add(finalizer);

        LOGGER.debugCr(reconciliation, "Adding finalizer {}", finalizer);
        return update(reconciliation, resource, updated);
    }

    @Override
    public Future<Void> removeFinalizer(Reconciliation reconciliation, T resource) {
        List<String> finalizers = resource.getMetadata().getFinalizers();

        if (finalizers == null || !finalizers.contains(finalizer)) {
            return Future.succeededFuture();
        }

        List<String> updated = new ArrayList<>(finalizers);
        updated.removeIf(finalizer::equals);

        LOGGER.debugCr(reconciliation, "Removing finalizer {}", finalizer);
        return update(reconciliation, resource, updated);
    }

    private Future<Void> update(Reconciliation reconciliation, T resource, List<String> finalizers) {
        List<String> original = resource.getMetadata().getFinalizers();
        resource.getMetadata().setFinalizers(finalizers);

        return operator.updateAsync(reconciliation, resource)
                .compose(updated -> {
                    // Later writes in the same reconciliation need the new resource version
                    if (updated != null && updated.getMetadata() != null) {
                        resource.getMetadata().setResourceVersion(updated.getMetadata().getResourceVersion());
                    }

                    return Future.<Void>succeededFuture();
                }, error -> {
                    resource.getMetadata().setFinalizers(original);
                    return Future.failedFuture(error);
                });
    }
}
