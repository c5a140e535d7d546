/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource.kubernetes;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionCondition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.vertx.core.Vertx;

/**
 * Operator for {@code CustomResourceDefinition}s
 */
public class CustomResourceDefinitionOperator extends CrdOperator<KubernetesClient, CustomResourceDefinition, CustomResourceDefinitionList> {
    /**
     * Type of the condition signalling that the CRD can be used
     */
    public static final String ESTABLISHED = "Established";

    /**
     * Constructs the CustomResourceDefinition operator
     *
     * @param vertx  The Vertx instance.
     * @param client The Kubernetes client.
     */
    public CustomResourceDefinitionOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, CustomResourceDefinition.class, CustomResourceDefinitionList.class, "CustomResourceDefinition");
    }

    /**
     * Checks whether the CRD has the Established condition set to True
     *
     * @param crd   The CRD (can be null)
     *
     * @return  True if the CRD exists and is established, false otherwise
     */
    public static boolean isEstablished(CustomResourceDefinition crd) {
        if (crd == null || crd.getStatus() == null || crd.getStatus().getConditions() == null) {
            return false;
        }

        for (CustomResourceDefinitionCondition condition : crd.getStatus().getConditions()) {
            if (ESTABLISHED.equals(condition.getType())) {
                return "True".equals(condition.getStatus());
            }
        }

        return false;
    }
}
