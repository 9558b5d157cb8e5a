package edu.stanford.futuredata.bitimport.exceptions;

/**
 * Terminal failure of one import call. The cause is the first error observed by any worker;
 * shards other than {@link #getShard()} may or may not have been committed.
 */
public class ImportException extends BitImportException {
    private final long shard;
    private final boolean cancelled;

    public ImportException(String message, long shard, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.shard = shard;
        this.cancelled = cancelled;
    }

    // Shard whose processing failed, or -1 if the failure was not tied to a shard.
    public long getShard() {
        return shard;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
