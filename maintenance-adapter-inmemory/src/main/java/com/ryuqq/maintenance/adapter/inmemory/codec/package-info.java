/**
 * JSON encoding of manifest payloads (Jackson with the JSR-310 module).
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.adapter.inmemory.codec;
