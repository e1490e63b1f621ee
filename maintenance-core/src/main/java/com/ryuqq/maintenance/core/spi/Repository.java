package com.ryuqq.maintenance.core.spi;

import com.ryuqq.maintenance.core.model.ClientIdentity;

/**
 * Read-only view of a connected repository.
 *
 * <p>Connection and authentication are handled outside this module; a {@code Repository}
 * only exposes the manifest index and the identity the connection was opened with.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public interface Repository {

    /**
     * Returns the manifest index of this repository.
     *
     * @return the manifest reader
     */
    ManifestReader manifests();

    /**
     * Returns the identity of the client that opened this connection.
     *
     * @return the client identity
     */
    ClientIdentity clientIdentity();
}
