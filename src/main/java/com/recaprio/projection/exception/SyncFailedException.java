package com.recaprio.projection.exception;

/**
 * Retries for a key are exhausted; its projection keeps the previous value.
 */
public class SyncFailedException extends RuntimeException {

    private final Long key;
    private final long sequence;
    private final int attempts;

    public SyncFailedException(Long key, long sequence, int attempts, Throwable cause) {
        super("Giving up on key " + key + " (sequence " + sequence + ") after " + attempts
                + " attempts: " + cause.getMessage(), cause);
        this.key = key;
        this.sequence = sequence;
        this.attempts = attempts;
    }

    public Long getKey() {
        return key;
    }

    public long getSequence() {
        return sequence;
    }

    public int getAttempts() {
        return attempts;
    }
}
