/**
 * Maintenance params store: read path and the two-phase write protocol.
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.maintenance.core.store.MaintenanceParamsStore} - get / has / set params and the ownership check</li>
 *   <li>{@link com.ryuqq.maintenance.core.store.ParamsWrite} - Phase 1, commit the new entry</li>
 *   <li>{@link com.ryuqq.maintenance.core.store.CommittedWrite} - Phase 2, retire the superseded entries</li>
 *   <li>{@link com.ryuqq.maintenance.core.store.MaintenanceParamsStoreConfig} - Labels and default params</li>
 * </ul>
 *
 * <h2>Write Protocol</h2>
 * <pre>
 * ParamsWrite write = store.beginWrite(repository);   // snapshot existing entries
 * CommittedWrite committed = write.commit(params);    // create new entry
 * committed.retire();                                 // delete snapshot entries
 * </pre>
 * <p>Retire is only reachable through a successful commit, so at least one valid
 * entry exists at every observable instant.</p>
 *
 * <h2>Consistency Model</h2>
 * <ul>
 *   <li><strong>Convergence:</strong> Racing writers may leave duplicates; every reader resolves them the same way</li>
 *   <li><strong>No locks:</strong> Readers see the value picked by a deterministic rule, not the last write in wall-clock time</li>
 *   <li><strong>Advisory owner:</strong> The owner field is a hint, not a mutual exclusion primitive</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.core.store;
