/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.apiextensions;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.syncagent.api.model.apiextensions.CompositeResourceDefinition;
import io.syncagent.api.model.apiextensions.CompositeResourceDefinitionList;
import io.syncagent.api.model.apiextensions.Composition;
import io.syncagent.api.model.apiextensions.CompositionList;

import java.util.List;

/**
 * Strategies for the API extension kinds synchronized from the remote cluster
 */
public class ApiExtensionsKinds {
    /**
     * Compositions
     */
    public static final InstanceSetStrategy<Composition, CompositionList> COMPOSITIONS =
            InstanceSetStrategy.of(CompositionList::new, ApiExtensionsKinds::items, Composition::new);

    /**
     * Composite resource definitions
     */
    public static final InstanceSetStrategy<CompositeResourceDefinition, CompositeResourceDefinitionList> DEFINITIONS =
            InstanceSetStrategy.of(CompositeResourceDefinitionList::new, ApiExtensionsKinds::items, CompositeResourceDefinition::new);

    private ApiExtensionsKinds() {
        // Utility class
    }

    private static <T extends HasMetadata> List<T> items(KubernetesResourceList<T> list) {
        return list == null || list.getItems() == null ? List.of() : list.getItems();
    }
}
