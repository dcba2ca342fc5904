package org.gamma.geobatch.metrics;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared progress of a batch. The reader is the only one advancing {@code queued}, the writer the only one
 * advancing {@code written}; anyone may read them.
 */
public class ProgressTracker {
    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong total = new AtomicLong(-1L);

    public void jobQueued() {
        queued.incrementAndGet();
    }

    public void rowWritten() {
        written.incrementAndGet();
    }

    /**
     * Sets the expected number of rows. Ignored when it would lower an already known total.
     */
    public void setTotal(long value) {
        total.accumulateAndGet(value, Math::max);
    }

    public long queued() {
        return queued.get();
    }

    public long written() {
        return written.get();
    }

    public OptionalLong total() {
        final long t = total.get();
        return t < 0 ? OptionalLong.empty() : OptionalLong.of(t);
    }

    public String describe() {
        final OptionalLong t = total();
        return "Geocoding: " + written() + "/" + (t.isPresent() ? String.valueOf(t.getAsLong()) : "?");
    }
}
