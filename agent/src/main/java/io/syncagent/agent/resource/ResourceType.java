/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.syncagent.operator.common.InvalidConfigurationException;

/**
 * Group, version and kind of a Kubernetes resource
 *
 * @param group     API group (empty for the core group)
 * @param version   API version
 * @param kind      Kind
 */
public record ResourceType(String group, String version, String kind) {
    /**
     * @return  The apiVersion as used in the resources (group/version or just version for the core group)
     */
    public String apiVersion() {
        return group == null || group.isEmpty() ? version : group + "/" + version;
    }

    /**
     * Parses the resource type from the {@code group/version/Kind} format. Resources from the core group can be given
     * as {@code version/Kind}.
     *
     * @param value     The value which should be parsed
     *
     * @return  The resource type
     */
    public static ResourceType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("Resource type cannot be empty");
        }

        String[] parts = value.trim().split("/");

        for (String part : parts) {
            if (part.isBlank()) {
                throw new InvalidConfigurationException("Invalid resource type " + value + ". Expected format is group/version/Kind");
            }
        }

        if (parts.length == 3) {
            return new ResourceType(parts[0], parts[1], parts[2]);
        } else if (parts.length == 2) {
            return new ResourceType("", parts[0], parts[1]);
        } else {
            throw new InvalidConfigurationException("Invalid resource type " + value + ". Expected format is group/version/Kind");
        }
    }

    @Override
    public String toString() {
        return apiVersion() + "/" + kind;
    }
}
