package edu.stanford.futuredata.bitimport.partition;

import edu.stanford.futuredata.bitimport.interfaces.Record;
import org.javatuples.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Splits a record stream into (shard, records) groups, one batch at a time. At most
 * {@code batchSize} records are held in memory; the rest stays in the source iterator.
 * A shard may be emitted once per batch it appears in.
 */
public class ShardPartitioner<R extends Record> implements Iterator<Pair<Long, List<R>>> {

    private final Iterator<? extends R> source;
    private final int batchSize;
    private final long shardWidth;

    private Iterator<Pair<Long, List<R>>> currentBatch = Collections.emptyIterator();
    private long batchCount = 0;
    private long recordCount = 0;

    public ShardPartitioner(Iterator<? extends R> source, int batchSize, long shardWidth) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (shardWidth <= 0) {
            throw new IllegalArgumentException("shardWidth must be positive: " + shardWidth);
        }
        this.source = source;
        this.batchSize = batchSize;
        this.shardWidth = shardWidth;
    }

    public static <R extends Record> Iterator<Pair<Long, List<R>>> batchColumns(Iterator<? extends R> source,
                                                                              int batchSize, long shardWidth) {
        return new ShardPartitioner<>(source, batchSize, shardWidth);
    }

    public static long shardOf(long columnID, long shardWidth) {
        return Long.divideUnsigned(columnID, shardWidth);
    }

    @Override
    public boolean hasNext() {
        while (!currentBatch.hasNext()) {
            if (!source.hasNext()) {
                return false;
            }
            currentBatch = nextBatch();
        }
        return true;
    }

    @Override
    public Pair<Long, List<R>> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return currentBatch.next();
    }

    public long getBatchCount() {
        return batchCount;
    }

    public long getRecordCount() {
        return recordCount;
    }

    private Iterator<Pair<Long, List<R>>> nextBatch() {
        Map<Long, List<R>> shardRecordMap = new LinkedHashMap<>();
        int pulled = 0;
        while (pulled < batchSize && source.hasNext()) {
            R record = source.next();
            long shard = shardOf(record.getColumnID(), shardWidth);
            shardRecordMap.computeIfAbsent(shard, k -> new ArrayList<>()).add(record);
            pulled++;
        }
        batchCount++;
        recordCount += pulled;
        List<Pair<Long, List<R>>> groups = new ArrayList<>(shardRecordMap.size());
        for (Map.Entry<Long, List<R>> e : shardRecordMap.entrySet()) {
            groups.add(new Pair<>(e.getKey(), e.getValue()));
        }
        return groups.iterator();
    }
}
