/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

/**
 * Helpers for the metadata of resources copied between the clusters
 */
public class ResourceMeta {
    private static final KubernetesSerialization SERIALIZATION = new KubernetesSerialization();

    private ResourceMeta() {
        // Utility class
    }

    /**
     * Creates a deep copy of the resource without the metadata which are owned by the cluster the resource was read
     * from. The copy can be created or updated in the other cluster.
     *
     * @param resource  The resource which should be copied
     *
     * @return  The copy without the cluster specific metadata
     *
     * @param <T>   Type of the resource
     */
    public static <T extends HasMetadata> T sanitizedCopy(T resource) {
        T copy = SERIALIZATION.clone(resource);
        ObjectMeta metadata = copy.getMetadata();

        if (metadata != null) {
            metadata.setResourceVersion(null);
            metadata.setUid(null);
            metadata.setCreationTimestamp(null);
            metadata.setSelfLink(null);
            metadata.setGeneration(null);
            metadata.setDeletionTimestamp(null);
            metadata.setDeletionGracePeriodSeconds(null);
            metadata.setOwnerReferences(null);
            metadata.setManagedFields(null);
            metadata.setFinalizers(null);
        }

        return copy;
    }
}
