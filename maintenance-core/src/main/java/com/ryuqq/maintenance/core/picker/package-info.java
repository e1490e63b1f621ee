/**
 * Deterministic selection among duplicate manifest entries.
 *
 * <p>The manifest index behaves like a multi-value register: racing writers leave
 * several entries under one label. {@link com.ryuqq.maintenance.core.picker.LatestEntryPicker}
 * is the register's reduce function. It takes the maximum under a total order, so every
 * reader that sees the same entry set resolves it to the same entry.</p>
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.core.picker;
