package com.ryuqq.maintenance.core.exception;

import com.ryuqq.maintenance.core.model.ManifestId;

/**
 * A maintenance entry was found but could not be loaded or decoded.
 *
 * <p>Distinct from {@link ParamsLookupException}: something is there, but it is broken.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class ParamsLoadException extends MaintenanceParamsException {

    private final ManifestId manifestId;

    public ParamsLoadException(ManifestId manifestId, Throwable cause) {
        super("error loading maintenance manifest " + manifestId.getValue(), cause);
        this.manifestId = manifestId;
    }

    /**
     * @return the entry that failed to load
     */
    public ManifestId getManifestId() {
        return manifestId;
    }
}
