/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.syncagent.operator.common.Reconciliation;
import io.vertx.core.Future;

/**
 * Creates the resource or updates it when it already exists
 *
 * @param <T>   Type of the resource
 */
@FunctionalInterface
public interface Applicator<T extends HasMetadata> {
    /**
     * Applies the desired resource
     *
     * @param reconciliation    Reconciliation marker
     * @param desired           The desired resource
     *
     * @return  Future with the resource as stored after the apply
     */
    Future<T> apply(Reconciliation reconciliation, T desired);
}
