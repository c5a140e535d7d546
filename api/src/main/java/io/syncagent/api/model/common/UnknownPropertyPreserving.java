/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.api.model.common;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.Map;

/**
 * Model types which keep the properties they do not know about, so that a read-modify-write cycle does not drop
 * fields written by a newer version of the API.
 */
public interface UnknownPropertyPreserving {
    /**
     * @return  Properties without a dedicated field
     */
    @JsonAnyGetter
    Map<String, Object> getAdditionalProperties();

    /**
     * Stores a property without a dedicated field
     *
     * @param name      Name of the property
     * @param value     Value of the property
     */
    @JsonAnySetter
    void setAdditionalProperty(String name, Object value);
}
