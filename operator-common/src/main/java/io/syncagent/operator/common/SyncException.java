/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

/**
 * Error wrapping a failure of one of the synchronization steps. The message is prefixed with the cluster the failure
 * originates from, so that users can tell local store problems from remote cluster problems from the status alone.
 */
public class SyncException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * The cluster an error originates from
     */
    public enum Origin {
        /**
         * The local (management) cluster
         */
        LOCAL("local: "),

        /**
         * The remote (target) cluster
         */
        REMOTE("remote: ");

        private final String prefix;

        Origin(String prefix) {
            this.prefix = prefix;
        }

        /**
         * @return  Prefix added to the error messages
         */
        public String prefix() {
            return prefix;
        }
    }

    private final Origin origin;

    private SyncException(Origin origin, String message, Throwable cause) {
        super((origin != null ? origin.prefix() : "") + message + ": " + describe(cause), cause);
        this.origin = origin;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }

    /**
     * Wraps a failure of the local cluster
     *
     * @param message   Description of the failed step
     * @param cause     The failure
     *
     * @return  The wrapping exception
     */
    public static SyncException local(String message, Throwable cause) {
        return new SyncException(Origin.LOCAL, message, cause);
    }

    /**
     * Wraps a failure of the remote cluster
     *
     * @param message   Description of the failed step
     * @param cause     The failure
     *
     * @return  The wrapping exception
     */
    public static SyncException remote(String message, Throwable cause) {
        return new SyncException(Origin.REMOTE, message, cause);
    }

    /**
     * Wraps a failure which does not belong to a single cluster
     *
     * @param message   Description of the failed step
     * @param cause     The failure
     *
     * @return  The wrapping exception
     */
    public static SyncException of(String message, Throwable cause) {
        return new SyncException(null, message, cause);
    }

    /**
     * @return  The cluster the error originates from or null when it does not belong to a single cluster
     */
    public Origin getOrigin() {
        return origin;
    }
}
