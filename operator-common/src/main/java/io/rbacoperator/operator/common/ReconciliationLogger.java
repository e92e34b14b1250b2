/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;

import java.io.Serializable;

/**
 * Logger which prefixes the messages with the reconciliation they belong to and tags them with its marker. The
 * {@code *Cr} methods log in the context of a reconciliation. The {@code *Op} methods log operator-wide messages.
 * <p>As with Log4j, a {@link Throwable} passed as the last parameter is logged with its stack trace.</p>
 */
public class ReconciliationLogger implements Serializable {
    private static final long serialVersionUID = 6126452379185243562L;
    private static final String FQCN = ReconciliationLogger.class.getName();

    private final ExtendedLoggerWrapper logger;

    protected ReconciliationLogger(final Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    /**
     * Returns a custom Logger using the fully qualified name of the Class as the Logger name.
     *
     * @param loggerName The Class whose name should be used as the Logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final Class<?> loggerName) {
        return new ReconciliationLogger(LogManager.getLogger(loggerName));
    }

    /**
     * Returns a custom Logger with the specified name.
     *
     * @param name The logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    ////// Operator logging

    public void traceOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.TRACE, null, message, params);
    }

    public void debugOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, null, message, params);
    }

    public void infoOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, null, message, params);
    }

    public void warnOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, params);
    }

    public void errorOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.ERROR, null, message, params);
    }

    ////// Custom resource logging

    /**
     * Logs a message with parameters at the {@code TRACE} level.
     *
     * @param reconciliation    The reconciliation
     * @param message           The message to log; the format depends on the message factory.
     * @param params            Parameters to the message.
     */
    public void traceCr(final Reconciliation reconciliation, final String message, final Object... params) {
        log(Level.TRACE, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param reconciliation    The reconciliation
     * @param message           The message to log; the format depends on the message factory.
     * @param params            Parameters to the message.
     */
    public void debugCr(final Reconciliation reconciliation, final String message, final Object... params) {
        log(Level.DEBUG, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param reconciliation    The reconciliation
     * @param message           The message to log; the format depends on the message factory.
     * @param params            Parameters to the message.
     */
    public void infoCr(final Reconciliation reconciliation, final String message, final Object... params) {
        log(Level.INFO, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param reconciliation    The reconciliation
     * @param message           The message to log; the format depends on the message factory.
     * @param params            Parameters to the message.
     */
    public void warnCr(final Reconciliation reconciliation, final String message, final Object... params) {
        log(Level.WARN, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level.
     *
     * @param reconciliation    The reconciliation
     * @param message           The message to log; the format depends on the message factory.
     * @param params            Parameters to the message.
     */
    public void errorCr(final Reconciliation reconciliation, final String message, final Object... params) {
        log(Level.ERROR, reconciliation, message, params);
    }

    private void log(Level level, Reconciliation reconciliation, String message, Object... params) {
        logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    /**
     * @return  True if debug logging is enabled. False otherwise.
     */
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    /**
     * @return  True if trace logging is enabled. False otherwise.
     */
    public boolean isTraceEnabled() {
        return logger.isTraceEnabled();
    }
}
