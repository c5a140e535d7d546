/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.claim;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.syncagent.agent.resource.ResourceMeta;
import io.syncagent.agent.resource.UnstructuredStatus;
import io.syncagent.agent.resource.kubernetes.GenericResourceOperator;
import io.syncagent.operator.common.Reconciliation;
import io.syncagent.operator.common.ReconciliationLogger;
import io.vertx.core.Future;

import java.util.HashMap;
import java.util.Map;

/**
 * Propagates a claim by creating or updating the remote claim with the spec, labels and annotations of the local
 * claim. The status of the remote claim (without its conditions) is copied back to the local claim so that it is
 * stored with the next status update of the local claim.
 */
public class DefaultPropagator implements Propagator<GenericKubernetesResource> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DefaultPropagator.class);

    private final GenericResourceOperator remoteOperator;

    /**
     * Constructor
     *
     * @param remoteOperator    Operator for the claims in the remote cluster
     */
    public DefaultPropagator(GenericResourceOperator remoteOperator) {
        this.remoteOperator = remoteOperator;
    }

    @Override
    public Future<Void> propagate(Reconciliation reconciliation, GenericKubernetesResource local, GenericKubernetesResource remote) {
        GenericKubernetesResource desired = desired(local, remote);

        return remoteOperator.createOrUpdate(reconciliation, desired)
                .compose(stored -> {
                    if (stored != null) {
                        UnstructuredStatus.copyStatusExceptConditions(stored, local);
                    } else {
                        LOGGER.debugCr(reconciliation, "No remote {} returned after the update", remoteOperator.kind());
                    }

                    return Future.succeededFuture();
                });
    }

    /**
     * Builds the remote claim which should be applied
     *
     * @param local     The local claim
     * @param remote    The current remote claim
     *
     * @return  The desired remote claim
     */
    /* test */ static GenericKubernetesResource desired(GenericKubernetesResource local, GenericKubernetesResource remote) {
        GenericKubernetesResource desired = ResourceMeta.sanitizedCopy(local);
        desired.getAdditionalProperties().remove(UnstructuredStatus.STATUS);

        if (remote != null && remote.getMetadata() != null) {
            desired.getMetadata().setResourceVersion(remote.getMetadata().getResourceVersion());
            desired.getMetadata().setLabels(merge(remote.getMetadata().getLabels(), local.getMetadata().getLabels()));
            desired.getMetadata().setAnnotations(merge(remote.getMetadata().getAnnotations(), local.getMetadata().getAnnotations()));
        }

        return desired;
    }

    private static Map<String, String> merge(Map<String, String> remote, Map<String, String> local) {
        if (remote == null && local == null) {
            return null;
        }

        Map<String, String> merged = new HashMap<>();

        if (remote != null) {
            merged.putAll(remote);
        }

        if (local != null) {
            merged.putAll(local);
        }

        return merged;
    }
}
