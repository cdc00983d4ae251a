package com.caredirectory.providers.snapshot;

import com.caredirectory.providers.exception.SnapshotNotAvailableException;
import com.caredirectory.providers.exception.UpdateInProgressException;
import com.caredirectory.providers.model.PublishedSnapshot;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the refresh flag and the currently published snapshot.
 *
 * Only the refresh cycle, while holding its lock, calls the mutators. Readers never block: while
 * a cycle runs, {@link #currentSnapshotPath()} rejects immediately even if an older snapshot is
 * still on disk.
 */
@Component
public class PublicationGate {

    private final AtomicBoolean updating = new AtomicBoolean(false);
    private final AtomicReference<PublishedSnapshot> current = new AtomicReference<>();

    /**
     * @throws UpdateInProgressException if the flag is already set
     */
    public void beginUpdate() {
        if (!updating.compareAndSet(false, true)) {
            throw new UpdateInProgressException();
        }
    }

    public void endUpdate() {
        updating.set(false);
    }

    public boolean isUpdating() {
        return updating.get();
    }

    /**
     * Makes {@code snapshot} the current one.
     *
     * @return the snapshot it replaced, if any
     */
    public Optional<PublishedSnapshot> publish(PublishedSnapshot snapshot) {
        return Optional.ofNullable(current.getAndSet(snapshot));
    }

    public Optional<PublishedSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @throws UpdateInProgressException while a refresh cycle runs
     * @throws SnapshotNotAvailableException if nothing has been published yet
     */
    public Path currentSnapshotPath() {
        if (updating.get()) {
            throw new UpdateInProgressException();
        }
        PublishedSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new SnapshotNotAvailableException();
        }
        return snapshot.path();
    }
}
