/**
 * Failures of the maintenance params store, one type per stage.
 *
 * <ul>
 *   <li>{@link com.ryuqq.maintenance.core.exception.ParamsLookupException} - Label query failed</li>
 *   <li>{@link com.ryuqq.maintenance.core.exception.ParamsLoadException} - Entry found but unreadable</li>
 *   <li>{@link com.ryuqq.maintenance.core.exception.ParamsCommitException} - New entry not created, prior state intact</li>
 *   <li>{@link com.ryuqq.maintenance.core.exception.ParamsRetireException} - New entry committed, stale entries remain</li>
 *   <li>{@link com.ryuqq.maintenance.core.exception.OwnershipCheckException} - Ownership check could not read params</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.core.exception;
