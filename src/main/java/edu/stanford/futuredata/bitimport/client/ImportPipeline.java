package edu.stanford.futuredata.bitimport.client;

import edu.stanford.futuredata.bitimport.encoder.EncodedRequest;
import edu.stanford.futuredata.bitimport.encoder.RequestEncoder;
import edu.stanford.futuredata.bitimport.exceptions.ImportException;
import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.interfaces.TimeParser;
import edu.stanford.futuredata.bitimport.interfaces.TransportClient;
import edu.stanford.futuredata.bitimport.partition.ShardPartitioner;
import edu.stanford.futuredata.bitimport.reader.CsvRecordReader;
import edu.stanford.futuredata.bitimport.reader.RecordShape;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.topology.NodeResolver;
import edu.stanford.futuredata.bitimport.transport.Node;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bulk imports a record stream into a field. The calling thread reads the stream in batches,
 * splits every batch by shard and queues the groups; a fixed pool of workers resolves the owning
 * nodes of each group, encodes it and posts it. The call returns once every queued group has
 * been processed and the workers have exited.
 *
 * <p>The first failure of any worker stops scheduling and is rethrown to the caller as an
 * {@link ImportException}. Groups already sent stay committed on the server; the call does not
 * report which ones those are.
 */
public class ImportPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ImportPipeline.class);

    static final Map<String, String> PROTOBUF_HEADERS = Map.of(
            "Content-Type", "application/x-protobuf",
            "Accept", "application/x-protobuf");

    private final TransportClient transport;
    private final NodeResolver nodeResolver;

    // Import calls currently running, so that cancel() can reach them.
    private final Set<ImportRun> activeRuns = ConcurrentHashMap.newKeySet();
    private volatile PipelineState lastState = PipelineState.IDLE;

    private final AtomicInteger workerNumber = new AtomicInteger(0);

    public ImportPipeline(TransportClient transport) {
        this(transport, new NodeResolver(transport));
    }

    public ImportPipeline(TransportClient transport, NodeResolver nodeResolver) {
        this.transport = transport;
        this.nodeResolver = nodeResolver;
    }

    /*
     * PUBLIC FUNCTIONS
     */

    public ImportSummary importField(Field field, Iterator<? extends Record> records, ImportOptions options) {
        ImportRun run = new ImportRun(field, options);
        activeRuns.add(run);
        try {
            return run.execute(records);
        } finally {
            activeRuns.remove(run);
        }
    }

    // Reads row,column[,timestamp] (or column,value) lines and imports them.
    public ImportSummary importCsv(Field field, Reader source, TimeParser timeParser, boolean skipHeader,
                                   ImportOptions options) {
        CsvRecordReader reader = new CsvRecordReader(source, RecordShape.forField(field), timeParser, skipHeader);
        return importField(field, reader, options);
    }

    // Aborts every running import call; each fails with a cancelled ImportException.
    public void cancel() {
        for (ImportRun run : activeRuns) {
            run.cancel();
        }
    }

    // State of the most recent import call.
    public PipelineState getState() {
        return lastState;
    }

    /*
     * PRIVATE CLASSES
     */

    private static class WorkItem {
        static final WorkItem POISON = new WorkItem(-1, Collections.emptyList());

        final long shard;
        final List<Record> records;

        WorkItem(long shard, List<Record> records) {
            this.shard = shard;
            this.records = records;
        }
    }

    private class ImportRun {
        private final Field field;
        private final ImportOptions options;
        private final RequestEncoder encoder;
        private final int threadCount;

        private final BlockingQueue<WorkItem> workQueue;
        // One permit per processed work item, whatever its outcome.
        private final Semaphore completed = new Semaphore(0);
        private final AtomicReference<ImportException> failure = new AtomicReference<>();
        private final AtomicLong requestsSent = new AtomicLong(0);
        private final ExecutorService workerPool;

        ImportRun(Field field, ImportOptions options) {
            this.field = field;
            this.options = options;
            this.encoder = new RequestEncoder(field, options.isFastImport(), options.isClear());
            this.threadCount = options.getThreadCount();
            this.workQueue = new ArrayBlockingQueue<>(options.getQueueCapacity());
            this.workerPool = Executors.newFixedThreadPool(threadCount, r -> {
                Thread t = new Thread(r, String.format("import-worker-%d", workerNumber.getAndIncrement()));
                t.setDaemon(true);
                return t;
            });
            for (int i = 0; i < threadCount; i++) {
                workerPool.execute(new ImportWorker());
            }
        }

        ImportSummary execute(Iterator<? extends Record> records) {
            long start = System.currentTimeMillis();
            logger.info("Importing into {} with {} workers, batch size {}, format {}",
                    field, threadCount, options.getBatchSize(), encoder.getFormat());
            setState(PipelineState.SCHEDULING);
            ShardPartitioner<Record> partitioner =
                    new ShardPartitioner<>(records, options.getBatchSize(), field.getShardWidth());
            int scheduled = 0;
            boolean interrupted = false;
            try {
                while (failure.get() == null && partitioner.hasNext()) {
                    Pair<Long, List<Record>> group = partitioner.next();
                    workQueue.put(new WorkItem(group.getValue0(), group.getValue1()));
                    scheduled++;
                }
            } catch (InterruptedException e) {
                interrupted = true;
                cancel();
            } catch (RuntimeException e) {
                // Any source failure, I/O errors included.
                fail(new ImportException("Reading import data failed: " + e.getMessage(), -1, false, e));
            }
            setState(PipelineState.DRAINING);
            completed.acquireUninterruptibly(scheduled);
            shutdownWorkers();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            ImportException e = failure.get();
            if (e != null) {
                setState(PipelineState.FAILED);
                throw e;
            }
            setState(PipelineState.DONE);
            ImportSummary summary = new ImportSummary(partitioner.getRecordCount(), scheduled, requestsSent.get(),
                    System.currentTimeMillis() - start);
            logger.info("Imported into {}: {}", field, summary);
            return summary;
        }

        void cancel() {
            if (fail(new ImportException("Import cancelled", -1, true, null))) {
                logger.warn("Import into {} cancelled", field);
            }
            // Interrupts workers blocked in transport calls; they keep draining the queue.
            workerPool.shutdownNow();
        }

        private boolean fail(ImportException e) {
            if (failure.compareAndSet(null, e)) {
                setState(PipelineState.FAILED);
                if (!e.isCancelled()) {
                    logger.error("Import into {} failed: {}", field, e.getMessage());
                }
                return true;
            }
            return false;
        }

        private void setState(PipelineState state) {
            lastState = state;
        }

        private void shutdownWorkers() {
            for (int i = 0; i < threadCount; i++) {
                boolean queued = false;
                while (!queued) {
                    try {
                        workQueue.put(WorkItem.POISON);
                        queued = true;
                    } catch (InterruptedException e) {
                        cancel();
                    }
                }
            }
            workerPool.shutdown();
            try {
                while (!workerPool.awaitTermination(1, TimeUnit.SECONDS)) {
                    logger.debug("Waiting for import workers of {} to exit", field);
                }
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for import workers of {}", field);
                Thread.currentThread().interrupt();
            }
        }

        private void process(WorkItem item) throws InterruptedException {
            List<Node> nodes = nodeResolver.nodesFor(field, item.shard);
            EncodedRequest request = encoder.encode(item.shard, item.records);
            for (Node node : nodes) {
                logger.debug("Sending {} records of shard {} to {} as {}",
                        item.records.size(), item.shard, node, request.format);
                transport.send(node, "POST", request.path, request.body, PROTOBUF_HEADERS);
                requestsSent.incrementAndGet();
            }
        }

        private class ImportWorker implements Runnable {
            @Override
            public void run() {
                while (true) {
                    WorkItem item;
                    try {
                        item = workQueue.take();
                    } catch (InterruptedException e) {
                        continue;
                    }
                    if (item == WorkItem.POISON) {
                        return;
                    }
                    try {
                        if (failure.get() == null) {
                            process(item);
                        }
                    } catch (InterruptedException e) {
                        fail(new ImportException("Import cancelled", item.shard, true, e));
                    } catch (RuntimeException e) {
                        fail(new ImportException(String.format("Import of shard %s failed: %s",
                                Long.toUnsignedString(item.shard), e.getMessage()), item.shard, false, e));
                    } finally {
                        completed.release();
                    }
                }
            }
        }
    }
}
