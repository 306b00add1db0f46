package com.libragraph.unwrap.core.collect;

import com.libragraph.unwrap.formats.tika.ContentClassifier;
import com.libragraph.unwrap.util.ContentHash;
import com.libragraph.unwrap.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Filters leaves for one run and keeps its counters.
 *
 * <p>{@link #admit} applies the size and content filters and may be called from any thread.
 * {@link #firstOccurrence} applies deduplication and must be called in emission order,
 * which is what keeps the kept occurrence stable across thread counts.
 */
public class EntryCollector {

    private static final Logger log = Logger.getLogger(EntryCollector.class);

    private final long minSize;
    private final Long maxSize;
    private final IncludeType include;
    private final boolean unique;
    private final ContentClassifier classifier = new ContentClassifier();

    private final AtomicLong read = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong deduplicated = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final Set<ContentHash> seen = new HashSet<>();
    private final List<InputFailure> failures = new ArrayList<>();

    public EntryCollector(long minSize, Long maxSize, IncludeType include, boolean unique) {
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.include = include;
        this.unique = unique;
    }

    /**
     * Applies the size filter, then the content filter.
     *
     * @return the materialized entry, or empty if the leaf was filtered out
     */
    public Optional<LeafEntry> admit(String source, String path, BinaryData data) {
        read.incrementAndGet();
        long size = data.size();
        if (size < minSize || (maxSize != null && size > maxSize)) {
            log.tracef("Size filter dropped %s (%d bytes)", path, size);
            skipped.incrementAndGet();
            return Optional.empty();
        }

        byte[] content = data.toByteArray();
        if (include != IncludeType.ALL && !include.accepts(classifier.classify(content))) {
            log.tracef("Content filter '%s' dropped %s", include.token(), path);
            skipped.incrementAndGet();
            return Optional.empty();
        }
        return Optional.of(LeafEntry.of(source, path, content));
    }

    /**
     * Counts a container entry that is not a regular file.
     */
    public void skipEntry() {
        skipped.incrementAndGet();
    }

    /**
     * Returns true if {@code entry} should be emitted. Always true unless deduplication is on.
     */
    public synchronized boolean firstOccurrence(LeafEntry entry) {
        if (!unique || seen.add(entry.hash())) {
            return true;
        }
        log.tracef("Duplicate content %s at %s", entry.hash(), entry.path());
        deduplicated.incrementAndGet();
        return false;
    }

    public void recordWritten() {
        written.incrementAndGet();
    }

    public synchronized void recordFailure(InputFailure failure) {
        failures.add(failure);
    }

    public synchronized Counts counts() {
        return new Counts(read.get(), skipped.get(), deduplicated.get(), written.get(), failures);
    }
}
