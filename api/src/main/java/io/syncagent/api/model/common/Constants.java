/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.api.model.common;

/**
 * Constants shared by the API model classes
 */
public class Constants {
    /**
     * API group of the extension kinds synchronized by the agent
     */
    public static final String APIEXTENSIONS_GROUP_NAME = "apiextensions.crossplane.io";

    /**
     * API version v1alpha1
     */
    public static final String V1ALPHA1 = "v1alpha1";

    private Constants() {
        // Constants holder
    }
}
