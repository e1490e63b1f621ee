package com.ryuqq.maintenance.core.exception;

/**
 * Base class for failures of the maintenance params store.
 *
 * <p>Each subclass names the stage that failed and wraps the backend cause.
 * Absence of parameters is never reported as an exception.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public abstract class MaintenanceParamsException extends RuntimeException {

    protected MaintenanceParamsException(String message, Throwable cause) {
        super(message, cause);
    }
}
