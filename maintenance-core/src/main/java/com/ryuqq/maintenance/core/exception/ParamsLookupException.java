package com.ryuqq.maintenance.core.exception;

/**
 * The label query for maintenance entries failed.
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class ParamsLookupException extends MaintenanceParamsException {

    public ParamsLookupException(Throwable cause) {
        super("error looking for maintenance manifest", cause);
    }
}
