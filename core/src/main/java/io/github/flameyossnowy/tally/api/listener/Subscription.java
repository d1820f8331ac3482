package io.github.flameyossnowy.tally.api.listener;

/**
 * Handle to a registered listener. Closing it more than once is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
