/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.claim;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.syncagent.operator.common.Reconciliation;
import io.vertx.core.Future;

/**
 * Pushes the desired state of the local resource to its remote counterpart
 *
 * @param <T>   Type of the resource
 */
@FunctionalInterface
public interface Propagator<T extends HasMetadata> {
    /**
     * Propagates the local resource to the remote cluster
     *
     * @param reconciliation    Reconciliation marker
     * @param local             The local resource
     * @param remote            The remote counterpart. When it does not exist yet, this is a new resource with only
     *                          the identity set.
     *
     * @return  Future which completes when the propagation is done
     */
    Future<Void> propagate(Reconciliation reconciliation, T local, T remote);
}
