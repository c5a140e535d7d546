/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource.kubernetes;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.syncagent.agent.resource.ResourceType;
import io.vertx.core.Vertx;

/**
 * Operator for resources which have no Java model and are addressed by their group, version and kind only. This is
 * used for the claims, whose kinds are known only from the configuration.
 */
public class GenericResourceOperator extends AbstractResourceOperator<KubernetesClient, GenericKubernetesResource, GenericKubernetesResourceList> {
    private final ResourceType resourceType;
    private volatile MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation;

    /**
     * Constructor
     *
     * @param vertx         The Vertx instance
     * @param client        The Kubernetes client
     * @param resourceType  Group, version and kind of the resources
     */
    public GenericResourceOperator(Vertx vertx, KubernetesClient client, ResourceType resourceType) {
        super(vertx, client, resourceType.kind());
        this.resourceType = resourceType;
    }

    @Override
    protected MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation() {
        // The first call resolves the plural and the scope through the API discovery, so we keep the result
        if (operation == null) {
            operation = client.genericKubernetesResources(resourceType.apiVersion(), resourceType.kind());
        }

        return operation;
    }
}
