/**
 * Abstract contract tests for manifest index implementations.
 *
 * <p>An adapter module extends {@link com.ryuqq.maintenance.testkit.contract.AbstractManifestIndexContractTest}
 * and {@link com.ryuqq.maintenance.testkit.contract.AbstractParamsStoreContractTest} in its own test
 * sources and inherits every scenario.</p>
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.testkit.contract;
