/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.apiextensions;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Describes one kind of resources synchronized by the {@link ExtensionReconciler}.
 *
 * @param <T>   Type of the resource
 * @param <L>   Type of the resource list
 */
public interface InstanceSetStrategy<T extends HasMetadata, L extends KubernetesResourceList<T>> {
    /**
     * @return  New empty list of the resources
     */
    L newList();

    /**
     * @param list  List of the resources
     *
     * @return  The resources in the list
     */
    List<T> getItems(L list);

    /**
     * @return  New empty resource
     */
    T newInstance();

    /**
     * @return  Class of the resource
     */
    @SuppressWarnings("unchecked")
    default Class<T> instanceType() {
        return (Class<T>) newInstance().getClass();
    }

    /**
     * @return  Class of the resource list
     */
    @SuppressWarnings("unchecked")
    default Class<L> listType() {
        return (Class<L>) newList().getClass();
    }

    /**
     * Creates the strategy from functions
     *
     * @param newList       Creates new empty list
     * @param getItems      Extracts the resources from a list
     * @param newInstance   Creates new empty resource
     *
     * @return  The strategy
     *
     * @param <T>   Type of the resource
     * @param <L>   Type of the resource list
     */
    static <T extends HasMetadata, L extends KubernetesResourceList<T>> InstanceSetStrategy<T, L> of(Supplier<L> newList, Function<L, List<T>> getItems, Supplier<T> newInstance) {
        return new InstanceSetStrategy<>() {
            @Override
            public L newList() {
                return newList.get();
            }

            @Override
            public List<T> getItems(L list) {
                return getItems.apply(list);
            }

            @Override
            public T newInstance() {
                return newInstance.get();
            }
        };
    }
}
