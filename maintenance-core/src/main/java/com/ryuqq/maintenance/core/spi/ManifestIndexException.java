package com.ryuqq.maintenance.core.spi;

/**
 * Failure reported by a manifest index implementation.
 *
 * <p>Covers connectivity, permission, corruption and decoding failures.
 * Deleting a missing entry is not a failure.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class ManifestIndexException extends RuntimeException {

    /**
     * Creates an exception with a message.
     *
     * @param message the detail message
     */
    public ManifestIndexException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public ManifestIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
