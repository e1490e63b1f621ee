package com.ryuqq.maintenance.testkit.fault;

import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;
import com.ryuqq.maintenance.core.spi.ManifestIndexException;
import com.ryuqq.maintenance.core.spi.ManifestWriter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ManifestWriter} decorator that fails selected calls on demand.
 *
 * <p>Faults are armed per call kind and consumed by the next matching call.
 * Injected failures are {@link ManifestIndexException}s whose message starts with
 * {@code "injected"}; the delegate is not called for a failed operation.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * FaultInjectingManifestWriter faults = new FaultInjectingManifestWriter(index);
 * faults.failNextDelete();          // crash between commit and retire
 * store.setParams(repository, params);  // throws ParamsRetireException
 * </pre>
 *
 * <p>Thread-safe: counters are atomic, so faults can be armed while other threads write.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class FaultInjectingManifestWriter implements ManifestWriter {

    private final ManifestWriter delegate;
    private final AtomicInteger findFailures = new AtomicInteger();
    private final AtomicInteger loadFailures = new AtomicInteger();
    private final AtomicInteger createFailures = new AtomicInteger();
    private final AtomicInteger deletesBeforeFailure = new AtomicInteger(-1);
    private final AtomicInteger createCount = new AtomicInteger();
    private final AtomicInteger deleteCount = new AtomicInteger();

    /**
     * Wraps a manifest writer.
     *
     * @param delegate the real manifest index
     * @throws IllegalArgumentException if delegate is null
     */
    public FaultInjectingManifestWriter(ManifestWriter delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Fails the next {@link #find(ManifestLabels)} call.
     */
    public void failNextFind() {
        findFailures.incrementAndGet();
    }

    /**
     * Fails the next {@link #load(ManifestId, Class)} call.
     */
    public void failNextLoad() {
        loadFailures.incrementAndGet();
    }

    /**
     * Fails the next {@link #create(ManifestLabels, Object)} call.
     */
    public void failNextCreate() {
        createFailures.incrementAndGet();
    }

    /**
     * Fails the next {@link #delete(ManifestId)} call.
     */
    public void failNextDelete() {
        failDeleteAfter(0);
    }

    /**
     * Lets {@code successfulDeletes} deletes through, then fails the following one.
     *
     * @param successfulDeletes number of deletes to pass before the failure
     * @throws IllegalArgumentException if successfulDeletes is negative
     */
    public void failDeleteAfter(int successfulDeletes) {
        if (successfulDeletes < 0) {
            throw new IllegalArgumentException("successfulDeletes must be non-negative (current: " + successfulDeletes + ")");
        }
        deletesBeforeFailure.set(successfulDeletes);
    }

    /**
     * Disarms every pending fault.
     */
    public void reset() {
        findFailures.set(0);
        loadFailures.set(0);
        createFailures.set(0);
        deletesBeforeFailure.set(-1);
    }

    /**
     * @return number of creates passed to the delegate
     */
    public int createCount() {
        return createCount.get();
    }

    /**
     * @return number of deletes passed to the delegate
     */
    public int deleteCount() {
        return deleteCount.get();
    }

    @Override
    public List<EntryMetadata> find(ManifestLabels labels) {
        if (consume(findFailures)) {
            throw injected("find");
        }
        return delegate.find(labels);
    }

    @Override
    public <T> T load(ManifestId id, Class<T> type) {
        if (consume(loadFailures)) {
            throw injected("load");
        }
        return delegate.load(id, type);
    }

    @Override
    public ManifestId create(ManifestLabels labels, Object payload) {
        if (consume(createFailures)) {
            throw injected("create");
        }
        ManifestId id = delegate.create(labels, payload);
        createCount.incrementAndGet();
        return id;
    }

    @Override
    public void delete(ManifestId id) {
        int remaining = deletesBeforeFailure.getAndUpdate(n -> n >= 0 ? n - 1 : n);
        if (remaining == 0) {
            throw injected("delete");
        }
        delegate.delete(id);
        deleteCount.incrementAndGet();
    }

    private static boolean consume(AtomicInteger failures) {
        while (true) {
            int pending = failures.get();
            if (pending <= 0) {
                return false;
            }
            if (failures.compareAndSet(pending, pending - 1)) {
                return true;
            }
        }
    }

    private static ManifestIndexException injected(String operation) {
        return new ManifestIndexException("injected " + operation + " failure");
    }
}
