package edu.stanford.futuredata.bitimport.client;

public class ImportSummary {
    public final long records;
    public final long shardGroups;
    public final long requests;
    public final long elapsedMillis;

    ImportSummary(long records, long shardGroups, long requests, long elapsedMillis) {
        this.records = records;
        this.shardGroups = shardGroups;
        this.requests = requests;
        this.elapsedMillis = elapsedMillis;
    }

    @Override
    public String toString() {
        return String.format("%d records in %d shard groups, %d requests, %d ms",
                records, shardGroups, requests, elapsedMillis);
    }
}
