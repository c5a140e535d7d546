/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource.kubernetes;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Vertx;

/**
 * Operator for managing typed resources, such as the custom resources synchronized by the agent or the
 * CustomResourceDefinitions themselves.
 *
 * @param <C>   The type of client used to interact with kubernetes.
 * @param <T>   The resource type.
 * @param <L>   The list variant of the resource type.
 */
public class CrdOperator<C extends KubernetesClient, T extends HasMetadata, L extends KubernetesResourceList<T>> extends AbstractResourceOperator<C, T, L> {
    private final Class<T> cls;
    private final Class<L> listCls;

    /**
     * Constructor
     *
     * @param vertx         The Vertx instance
     * @param client        The Kubernetes client
     * @param cls           The class of the resource
     * @param listCls       The class of the resource list
     * @param kind          The kind of the resource
     */
    public CrdOperator(Vertx vertx, C client, Class<T> cls, Class<L> listCls, String kind) {
        super(vertx, client, kind);
        this.cls = cls;
        this.listCls = listCls;
    }

    @Override
    protected MixedOperation<T, L, Resource<T>> operation() {
        return client.resources(cls, listCls);
    }
}
