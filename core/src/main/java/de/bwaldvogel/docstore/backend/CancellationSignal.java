package de.bwaldvogel.docstore.backend;

import java.util.concurrent.atomic.AtomicBoolean;

import de.bwaldvogel.docstore.exception.OperationCancelledException;

/**
 * Owned by the caller of a command. Long running scans poll it and abort once it was cancelled.
 */
public class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared signal cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException();
        }
    }

}
