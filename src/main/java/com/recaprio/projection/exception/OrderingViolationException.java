package com.recaprio.projection.exception;

/**
 * A feed event arrived for a key after a later event for the same key had already
 * been processed. Per-key serialization makes this unreachable; seeing it means
 * the feed or the worker pool broke its ordering contract.
 */
public class OrderingViolationException extends RuntimeException {

    private final Long key;
    private final long receivedSequence;
    private final long processedSequence;

    public OrderingViolationException(Long key, long receivedSequence, long processedSequence) {
        super("Key " + key + " received sequence " + receivedSequence
                + " after already processing sequence " + processedSequence);
        this.key = key;
        this.receivedSequence = receivedSequence;
        this.processedSequence = processedSequence;
    }

    public Long getKey() {
        return key;
    }

    public long getReceivedSequence() {
        return receivedSequence;
    }

    public long getProcessedSequence() {
        return processedSequence;
    }
}
