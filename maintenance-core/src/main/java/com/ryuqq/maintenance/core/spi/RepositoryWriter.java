package com.ryuqq.maintenance.core.spi;

/**
 * Writable view of a connected repository.
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public interface RepositoryWriter extends Repository {

    /**
     * Returns the writable manifest index of this repository.
     *
     * @return the manifest writer
     */
    @Override
    ManifestWriter manifests();
}
