/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.api.model.apiextensions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;
import io.syncagent.api.model.common.Constants;

/**
 * Cluster-scoped CompositeResourceDefinition published by the remote cluster and mirrored into the local one
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Version(CompositeResourceDefinition.VERSION)
@Group(CompositeResourceDefinition.GROUP)
@Plural(CompositeResourceDefinition.RESOURCE_PLURAL)
public class CompositeResourceDefinition extends CustomResource<CompositeResourceDefinitionSpec, Void> {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.APIEXTENSIONS_GROUP_NAME;
    public static final String VERSION = Constants.V1ALPHA1;
    public static final String RESOURCE_KIND = "CompositeResourceDefinition";
    public static final String RESOURCE_PLURAL = "compositeresourcedefinitions";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
}
