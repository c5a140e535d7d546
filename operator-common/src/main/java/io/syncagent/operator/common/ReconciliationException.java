/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

/**
 * Failure of a reconciliation which the controller runtime should log. It carries the requeue result, because the
 * runtime is expected to retry the resource after the delay even when the pass failed.
 */
public class ReconciliationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final RequeueResult result;

    /**
     * Constructor
     *
     * @param result    Requeue result of the failed pass
     * @param cause     The failure
     */
    public ReconciliationException(RequeueResult result, Throwable cause) {
        super(cause.getMessage(), cause);
        this.result = result;
    }

    /**
     * @return  Requeue result of the failed pass
     */
    public RequeueResult getResult() {
        return result;
    }
}
