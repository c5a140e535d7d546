/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logger wrapper which adds the reconciliation context to the log messages. The *Cr methods prefix the message with
 * the reconciliation and attach its marker. The *Op methods are used for operator-level messages which do not belong
 * to any reconciliation.
 */
public class ReconciliationLogger {
    private final Logger logger;

    private ReconciliationLogger(Logger logger) {
        this.logger = logger;
    }

    /**
     * Creates the logger for given class
     *
     * @param clazz     Class for which the logger should be created
     *
     * @return  New ReconciliationLogger instance
     */
    public static ReconciliationLogger create(Class<?> clazz) {
        return new ReconciliationLogger(LogManager.getLogger(clazz));
    }

    private void logCr(Level level, Reconciliation reconciliation, String message, Object... params) {
        if (logger.isEnabled(level)) {
            logger.log(level, reconciliation.getMarker(), reconciliation + ": " + message, params);
        }
    }

    public void debugCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.DEBUG, reconciliation, message, params);
    }

    public void infoCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.INFO, reconciliation, message, params);
    }

    public void warnCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.WARN, reconciliation, message, params);
    }

    public void infoOp(String message, Object... params) {
        logger.info(message, params);
    }
}
