/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource.kubernetes;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonDeletingOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.syncagent.operator.common.Reconciliation;
import io.syncagent.operator.common.ReconciliationLogger;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Abstract resource operator wrapping the blocking calls of the Fabric8 Kubernetes client into Vert.x futures. The
 * same class is used for both the local and the remote cluster, only the client differs.
 *
 * <p>Getting a resource which does not exist completes the future with null. Deleting a resource which does not exist
 * completes the future successfully.</p>
 *
 * @param <C>   The type of client used to interact with kubernetes.
 * @param <T>   The Kubernetes resource type.
 * @param <L>   The list variant of the Kubernetes resource type.
 */
public abstract class AbstractResourceOperator<C extends KubernetesClient, T extends HasMetadata, L extends KubernetesResourceList<T>> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractResourceOperator.class);

    /**
     * Namespace value used to list resources in all namespaces
     */
    public static final String ANY_NAMESPACE = "*";

    protected final Vertx vertx;
    protected final C client;
    protected final String resourceKind;

    /**
     * Constructor.
     *
     * @param vertx         The vertx instance.
     * @param client        The kubernetes client.
     * @param resourceKind  The kind of Kubernetes resource (used for logging).
     */
    protected AbstractResourceOperator(Vertx vertx, C client, String resourceKind) {
        this.vertx = vertx;
        this.client = client;
        this.resourceKind = resourceKind;
    }

    /**
     * @return  The Fabric8 operation for the resource type
     */
    protected abstract MixedOperation<T, L, Resource<T>> operation();

    /**
     * @return  Kind of the managed resources
     */
    public String kind() {
        return resourceKind;
    }

    private Resource<T> resource(String namespace, String name) {
        return namespace == null ? operation().withName(name) : operation().inNamespace(namespace).withName(name);
    }

    private Resource<T> resource(T resource) {
        String namespace = resource.getMetadata().getNamespace();
        return namespace == null ? operation().resource(resource) : operation().inNamespace(namespace).resource(resource);
    }

    /**
     * Synchronously gets the resource with the given {@code name} in the given {@code namespace}.
     *
     * @param namespace The namespace or null for cluster-scoped resources.
     * @param name The name.
     *
     * @return The resource, or null if it doesn't exist.
     */
    public T get(String namespace, String name) {
        return resource(namespace, name).get();
    }

    /**
     * Asynchronously gets the resource with the given {@code name} in the given {@code namespace}.
     *
     * @param namespace The namespace or null for cluster-scoped resources.
     * @param name The name.
     *
     * @return A Future for the result, completed with null when the resource doesn't exist.
     */
    public Future<T> getAsync(String namespace, String name) {
        return vertx.executeBlocking(() -> get(namespace, name));
    }

    /**
     * Asynchronously lists the resources. Cluster-scoped resources (or all namespaces) are listed when the namespace is
     * null, all namespaces are listed when it is {@link #ANY_NAMESPACE}.
     *
     * @param namespace The namespace.
     *
     * @return A Future with the list of resources.
     */
    public Future<L> listAsync(String namespace) {
        return vertx.executeBlocking(() -> {
            if (ANY_NAMESPACE.equals(namespace)) {
                return operation().inAnyNamespace().list();
            } else if (namespace == null) {
                return operation().list();
            } else {
                return operation().inNamespace(namespace).list();
            }
        });
    }

    /**
     * Asynchronously deletes the resource with the given {@code name} in the given {@code namespace}. Deleting a
     * resource which does not exist is not an error.
     *
     * @param reconciliation The reconciliation
     * @param namespace Namespace of the resource which should be deleted or null for cluster-scoped resources
     * @param name Name of the resource which should be deleted
     *
     * @return A future which will be completed once the deletion was requested
     */
    public Future<Void> deleteAsync(Reconciliation reconciliation, String namespace, String name) {
        return vertx.<Void>executeBlocking(() -> {
            LOGGER.debugCr(reconciliation, "{} {}/{} is being deleted", resourceKind, namespace, name);
            resource(namespace, name).delete();
            return null;
        });
    }

    /**
     * Asynchronously updates the resource (without its status).
     *
     * @param reconciliation The reconciliation
     * @param resource The resource with the desired state
     *
     * @return A future with the updated resource
     */
    public Future<T> updateAsync(Reconciliation reconciliation, T resource) {
        return vertx.executeBlocking(() -> {
            LOGGER.debugCr(reconciliation, "{} {} is being updated", resourceKind, resource.getMetadata().getName());
            return resource(resource).update();
        });
    }

    /**
     * Asynchronously updates the status subresource of the resource.
     *
     * @param reconciliation The reconciliation
     * @param resource The resource with the new status
     *
     * @return A future with the updated resource
     */
    public Future<T> updateStatusAsync(Reconciliation reconciliation, T resource) {
        return vertx.executeBlocking(() -> {
            LOGGER.debugCr(reconciliation, "Status of {} {} is being updated", resourceKind, resource.getMetadata().getName());
            return resource(resource).updateStatus();
        });
    }

    /**
     * Asynchronously creates the resource or updates it when it already exists.
     *
     * @param reconciliation The reconciliation
     * @param desired The desired resource
     *
     * @return A future with the created or updated resource
     */
    public Future<T> createOrUpdate(Reconciliation reconciliation, T desired) {
        return vertx.executeBlocking(() -> {
            LOGGER.debugCr(reconciliation, "{} {} is being created or updated", resourceKind, desired.getMetadata().getName());
            return resource(desired).createOr(NonDeletingOperation::update);
        });
    }
}
