/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.api.model.apiextensions;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.KubernetesResource;
import io.syncagent.api.model.common.UnknownPropertyPreserving;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Spec of the {@link CompositeResourceDefinition}. The agent copies it between clusters without interpreting it, so all its fields are kept
 * as unknown properties.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode
@ToString
public class CompositeResourceDefinitionSpec implements KubernetesResource, UnknownPropertyPreserving {
    private static final long serialVersionUID = 1L;

    private Map<String, Object> additionalProperties;

    @Override
    public Map<String, Object> getAdditionalProperties() {
        return this.additionalProperties != null ? this.additionalProperties : new HashMap<>(0);
    }

    @Override
    public void setAdditionalProperty(String name, Object value) {
        if (this.additionalProperties == null) {
            this.additionalProperties = new HashMap<>(1);
        }
        this.additionalProperties.put(name, value);
    }
}
