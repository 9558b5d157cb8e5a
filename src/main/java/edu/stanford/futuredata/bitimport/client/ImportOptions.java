package edu.stanford.futuredata.bitimport.client;

// Per-call import settings. Zero thread count and queue capacity mean "derive at call time".
public class ImportOptions {

    public static final int DEFAULT_BATCH_SIZE = 100000;

    private final int batchSize;
    private final int threadCount;
    private final int queueCapacity;
    private final boolean fastImport;
    private final boolean clear;

    private ImportOptions(Builder b) {
        this.batchSize = b.batchSize;
        this.threadCount = b.threadCount;
        this.queueCapacity = b.queueCapacity;
        this.fastImport = b.fastImport;
        this.clear = b.clear;
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getThreadCount() {
        return threadCount > 0 ? threadCount : Runtime.getRuntime().availableProcessors();
    }

    public int getQueueCapacity() {
        return queueCapacity > 0 ? queueCapacity : 2 * getThreadCount();
    }

    // Use the roaring bitmap format where the field allows it.
    public boolean isFastImport() {
        return fastImport;
    }

    // Remove the imported associations instead of adding them.
    public boolean isClear() {
        return clear;
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int threadCount = 0;
        private int queueCapacity = 0;
        private boolean fastImport = false;
        private boolean clear = false;

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder threadCount(int threadCount) {
            if (threadCount < 0) {
                throw new IllegalArgumentException("threadCount must not be negative: " + threadCount);
            }
            this.threadCount = threadCount;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity < 0) {
                throw new IllegalArgumentException("queueCapacity must not be negative: " + queueCapacity);
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder fastImport(boolean fastImport) {
            this.fastImport = fastImport;
            return this;
        }

        public Builder clear(boolean clear) {
            this.clear = clear;
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }
}
