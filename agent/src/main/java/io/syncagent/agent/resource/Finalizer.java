/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.syncagent.operator.common.Reconciliation;
import io.vertx.core.Future;

/**
 * Protects the local resources against deletion until their remote counterparts are gone
 *
 * @param <T>   Type of the resource
 */
public interface Finalizer<T extends HasMetadata> {
    /**
     * Makes sure the resource is protected against deletion. Calling it on already protected resource does nothing.
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          The resource
     *
     * @return  Future which completes when the resource is protected
     */
    Future<Void> addFinalizer(Reconciliation reconciliation, T resource);

    /**
     * Removes the deletion protection from the resource
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          The resource
     *
     * @return  Future which completes when the protection is removed
     */
    Future<Void> removeFinalizer(Reconciliation reconciliation, T resource);
}
