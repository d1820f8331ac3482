package io.github.flameyossnowy.tally.memory;

import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;

import java.util.Objects;

public class MemoryRepositoryAdapterBuilder {
    private final MetadataRegistry metadata;
    private boolean reportClearedIds;

    public MemoryRepositoryAdapterBuilder(MetadataRegistry metadata) {
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
    }

    /**
     * Makes post-clear notifications carry the ids that were removed. Off by default, in which
     * case listeners only learn the ids by querying during pre-clear.
     */
    public MemoryRepositoryAdapterBuilder withReportClearedIds(boolean reportClearedIds) {
        this.reportClearedIds = reportClearedIds;
        return this;
    }

    public MemoryRepositoryAdapter build() {
        return new MemoryRepositoryAdapter(metadata, reportClearedIds);
    }
}
