/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.resource;

import io.syncagent.api.model.common.Condition;
import io.syncagent.operator.common.model.StatusUtils;

import java.time.Clock;

/**
 * Conditions set by the agent on the local resources after each reconciliation
 */
public class AgentConditions {
    /**
     * Type of the condition describing the result of the last synchronization
     */
    public static final String TYPE_AGENT_SYNCED = "AgentSynced";

    /**
     * Reason used when the synchronization succeeded
     */
    public static final String REASON_SUCCESS = "Success";

    /**
     * Reason used when the synchronization failed
     */
    public static final String REASON_ERROR = "Error";

    private AgentConditions() {
        // Utility class
    }

    /**
     * @param clock     Clock used for the transition time
     *
     * @return  Condition indicating successful synchronization
     */
    public static Condition agentSyncSuccess(Clock clock) {
        return agentSyncSuccess(clock, null);
    }

    /**
     * @param clock     Clock used for the transition time
     * @param message   Message of the condition or null
     *
     * @return  Condition indicating successful synchronization with a message
     */
    public static Condition agentSyncSuccess(Clock clock, String message) {
        return new Condition(TYPE_AGENT_SYNCED, "True", StatusUtils.iso8601(clock.instant()), REASON_SUCCESS, message);
    }

    /**
     * @param clock     Clock used for the transition time
     * @param error     The error which caused the synchronization to fail
     *
     * @return  Condition indicating failed synchronization
     */
    public static Condition agentSyncError(Clock clock, Throwable error) {
        return new Condition(TYPE_AGENT_SYNCED, "False", StatusUtils.iso8601(clock.instant()), REASON_ERROR, error.getMessage());
    }
}
