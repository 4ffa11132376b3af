package com.tapas.orderstream.validator.processing;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals since start, for the periodic report line.
 */
public class ValidatorStats {

    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong valid = new AtomicLong();
    private final AtomicLong invalid = new AtomicLong();
    private final AtomicLong lastBatchId = new AtomicLong();

    void record(BatchResult result) {
        batches.incrementAndGet();
        valid.addAndGet(result.valid());
        invalid.addAndGet(result.invalid());
        lastBatchId.set(result.batchId());
    }

    public long batches() {
        return batches.get();
    }

    public long valid() {
        return valid.get();
    }

    public long invalid() {
        return invalid.get();
    }

    public String toLine() {
        return String.format(Locale.ROOT, "batches=%d last_batch_id=%d valid=%d invalid=%d",
                batches.get(), lastBatchId.get(), valid.get(), invalid.get());
    }
}
