package io.github.flameyossnowy.tally.api.exceptions;

/**
 * A failure reported by a {@link io.github.flameyossnowy.tally.api.store.CounterStore}.
 * <p>
 * Counter synchronization never retries or suppresses these; they surface at the call that
 * triggered the write.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(Throwable cause) {
        super(cause);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
