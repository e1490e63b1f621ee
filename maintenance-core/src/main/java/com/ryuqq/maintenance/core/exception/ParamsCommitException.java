package com.ryuqq.maintenance.core.exception;

/**
 * Creating the new maintenance entry failed.
 *
 * <p>No existing entry has been deleted when this is thrown; the previous
 * parameters remain in effect.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class ParamsCommitException extends MaintenanceParamsException {

    public ParamsCommitException(Throwable cause) {
        super("error committing maintenance manifest", cause);
    }
}
