package com.ryuqq.maintenance.core.exception;

import com.ryuqq.maintenance.core.model.ManifestId;

import java.util.List;

/**
 * Deleting a superseded maintenance entry failed after the new entry was committed.
 *
 * <p>The committed entry is durable. The remaining stale entries stay visible until a
 * later write retires them; readers resolve the duplicates meanwhile.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class ParamsRetireException extends MaintenanceParamsException {

    private final ManifestId committedId;
    private final List<ManifestId> remaining;

    /**
     * @param committedId the entry committed by this write
     * @param remaining stale entries not retired, starting with the one that failed
     * @param cause the backend failure
     */
    public ParamsRetireException(ManifestId committedId, List<ManifestId> remaining, Throwable cause) {
        super("error retiring maintenance manifest " + remaining.get(0).getValue(), cause);
        this.committedId = committedId;
        this.remaining = List.copyOf(remaining);
    }

    public ManifestId getCommittedId() {
        return committedId;
    }

    public List<ManifestId> getRemaining() {
        return remaining;
    }
}
