/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.syncagent.agent.resource.kubernetes.AbstractResourceOperator;
import io.syncagent.operator.common.Reconciliation;
import io.vertx.core.Future;

/**
 * Applicator using the create-or-update call of a resource operator
 *
 * @param <T>   Type of the resource
 */
public class OperatorApplicator<T extends HasMetadata> implements Applicator<T> {
    private final AbstractResourceOperator<?, T, ?> operator;

    /**
     * Constructor
     *
     * @param operator  Operator for the cluster where the resources should be applied
     */
    public OperatorApplicator(AbstractResourceOperator<?, T, ?> operator) {
        this.operator = operator;
    }

    @Override
    public Future<T> apply(Reconciliation reconciliation, T desired) {
        return operator.createOrUpdate(reconciliation, desired);
    }
}
