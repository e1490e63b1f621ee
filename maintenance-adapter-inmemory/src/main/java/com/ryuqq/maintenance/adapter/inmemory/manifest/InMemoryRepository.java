package com.ryuqq.maintenance.adapter.inmemory.manifest;

import com.ryuqq.maintenance.core.model.ClientIdentity;
import com.ryuqq.maintenance.core.spi.ManifestWriter;
import com.ryuqq.maintenance.core.spi.RepositoryWriter;

/**
 * In-memory repository connection binding a manifest index to a client identity.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryManifestIndex index = new InMemoryManifestIndex();
 * RepositoryWriter alice = new InMemoryRepository(index, ClientIdentity.of("alice", "host-a"));
 * RepositoryWriter bob = new InMemoryRepository(index, ClientIdentity.of("bob", "host-b"));
 *
 * // alice and bob now share one backend, like two processes on one repository
 * store.setParams(alice, params);
 * store.getParams(bob);
 * </pre>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class InMemoryRepository implements RepositoryWriter {

    private final ManifestWriter manifests;
    private final ClientIdentity clientIdentity;

    /**
     * Creates a repository connection.
     *
     * @param manifests the shared manifest index
     * @param clientIdentity the identity of this connection
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryRepository(ManifestWriter manifests, ClientIdentity clientIdentity) {
        if (manifests == null) {
            throw new IllegalArgumentException("manifests cannot be null");
        }
        if (clientIdentity == null) {
            throw new IllegalArgumentException("clientIdentity cannot be null");
        }
        this.manifests = manifests;
        this.clientIdentity = clientIdentity;
    }

    @Override
    public ManifestWriter manifests() {
        return manifests;
    }

    @Override
    public ClientIdentity clientIdentity() {
        return clientIdentity;
    }
}
