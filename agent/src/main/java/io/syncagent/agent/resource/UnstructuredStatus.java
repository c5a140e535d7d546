/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.syncagent.api.model.common.Condition;
import io.syncagent.operator.common.model.StatusUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the status of resources without a Java model (the claims). The status is kept in the
 * {@code status} additional property of the {@link GenericKubernetesResource}.
 */
public class UnstructuredStatus {
    private static final ObjectMapper MAPPER = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<Condition>> CONDITIONS = new TypeReference<>() { };

    /**
     * Name of the status field
     */
    public static final String STATUS = "status";

    /**
     * Name of the conditions field in the status
     */
    public static final String CONDITIONS_FIELD = "conditions";

    private UnstructuredStatus() {
        // Utility class
    }

    /**
     * Returns the status of the resource as a map
     *
     * @param resource  The resource
     *
     * @return  The status or null if the resource has no status
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getStatus(GenericKubernetesResource resource) {
        Object status = resource.getAdditionalProperties().get(STATUS);
        return status instanceof Map ? (Map<String, Object>) status : null;
    }

    /**
     * Returns the conditions from the status of the resource
     *
     * @param resource  The resource
     *
     * @return  The list of conditions. Empty list if the resource has no conditions.
     */
    public static List<Condition> getConditions(GenericKubernetesResource resource) {
        Map<String, Object> status = getStatus(resource);

        if (status == null || status.get(CONDITIONS_FIELD) == null) {
            return List.of();
        }

        return MAPPER.convertValue(status.get(CONDITIONS_FIELD), CONDITIONS);
    }

    /**
     * Replaces the conditions in the status of the resource. The other status fields are kept.
     *
     * @param resource      The resource
     * @param conditions    The new conditions
     */
    public static void setConditions(GenericKubernetesResource resource, List<Condition> conditions) {
        Map<String, Object> status = mutableStatus(resource);
        status.put(CONDITIONS_FIELD, MAPPER.convertValue(conditions, new TypeReference<List<Map<String, Object>>>() { }));
    }

    /**
     * Sets the condition in the status of the resource. An existing condition with the same type is replaced.
     *
     * @param resource      The resource
     * @param condition     The condition
     */
    public static void setCondition(GenericKubernetesResource resource, Condition condition) {
        setConditions(resource, StatusUtils.setCondition(getConditions(resource), condition));
    }

    /**
     * Copies the status fields of one resource into the status of another resource. The conditions of the target
     * resource are not touched.
     *
     * @param from  Resource from which the status should be copied
     * @param to    Resource to which the status should be copied
     */
    public static void copyStatusExceptConditions(GenericKubernetesResource from, GenericKubernetesResource to) {
        Map<String, Object> source = getStatus(from);

        if (source == null) {
            return;
        }

        Map<String, Object> target = mutableStatus(to);

        for (Map.Entry<String, Object> field : source.entrySet()) {
            if (!CONDITIONS_FIELD.equals(field.getKey())) {
                target.put(field.getKey(), field.getValue());
            }
        }
    }

    private static Map<String, Object> mutableStatus(GenericKubernetesResource resource) {
        Map<String, Object> existing = getStatus(resource);
        Map<String, Object> status = existing != null ? new LinkedHashMap<>(existing) : new LinkedHashMap<>();
        resource.setAdditionalProperty(STATUS, status);
        return status;
    }
}
