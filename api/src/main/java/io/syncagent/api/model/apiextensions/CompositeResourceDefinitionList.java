/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.api.model.apiextensions;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

public class CompositeResourceDefinitionList extends DefaultKubernetesResourceList<CompositeResourceDefinition> {
    private static final long serialVersionUID = 1L;
}
