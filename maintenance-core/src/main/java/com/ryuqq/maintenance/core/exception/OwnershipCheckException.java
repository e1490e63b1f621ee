package com.ryuqq.maintenance.core.exception;

/**
 * The ownership check could not read the maintenance params.
 *
 * <p>The cause is the {@link MaintenanceParamsException} raised by the read path.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class OwnershipCheckException extends MaintenanceParamsException {

    public OwnershipCheckException(Throwable cause) {
        super("error getting maintenance params", cause);
    }
}
