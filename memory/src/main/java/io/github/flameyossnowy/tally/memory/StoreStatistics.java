package io.github.flameyossnowy.tally.memory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Operation counts of a {@link MemoryRepositoryAdapter}.
 */
public final class StoreStatistics {
    private final AtomicLong counterWrites = new AtomicLong();
    private final AtomicLong rowWrites = new AtomicLong();
    private final AtomicLong reads = new AtomicLong();

    /**
     * Counter updates applied, whether as deltas or as assignments. One update touching several
     * fields or rows counts once.
     */
    public long counterWrites() {
        return counterWrites.get();
    }

    /**
     * Inserts, updates and deletes of whole rows.
     */
    public long rowWrites() {
        return rowWrites.get();
    }

    /**
     * Field reads, member lookups and entity loads.
     */
    public long reads() {
        return reads.get();
    }

    public void reset() {
        counterWrites.set(0);
        rowWrites.set(0);
        reads.set(0);
    }

    void recordCounterWrite() {
        counterWrites.incrementAndGet();
    }

    void recordRowWrite() {
        rowWrites.incrementAndGet();
    }

    void recordRead() {
        reads.incrementAndGet();
    }

    @Override
    public String toString() {
        return "StoreStatistics[counterWrites=" + counterWrites + ", rowWrites=" + rowWrites + ", reads=" + reads + ']';
    }
}
