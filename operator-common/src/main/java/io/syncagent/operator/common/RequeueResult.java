/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a single reconciliation pass handed back to the controller runtime. A zero delay means the runtime should
 * not requeue the resource (it will still react to watch events).
 *
 * @param requeueAfter  Delay after which the resource should be reconciled again
 */
public record RequeueResult(Duration requeueAfter) {
    private static final RequeueResult DONE = new RequeueResult(Duration.ZERO);

    /**
     * Constructor
     *
     * @param requeueAfter  Delay after which the resource should be reconciled again
     */
    public RequeueResult {
        Objects.requireNonNull(requeueAfter, "requeueAfter");
        if (requeueAfter.isNegative()) {
            throw new IllegalArgumentException("requeueAfter cannot be negative: " + requeueAfter);
        }
    }

    /**
     * @return  Result which asks for no requeue
     */
    public static RequeueResult done() {
        return DONE;
    }

    /**
     * @param delay     Delay after which the resource should be reconciled again
     *
     * @return  Result which asks for a requeue after the delay
     */
    public static RequeueResult after(Duration delay) {
        return new RequeueResult(delay);
    }

    /**
     * @return  True if the runtime should requeue the resource
     */
    public boolean requeue() {
        return !requeueAfter.isZero();
    }
}
