/**
 * Fault injection for manifest index implementations.
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.testkit.fault;
