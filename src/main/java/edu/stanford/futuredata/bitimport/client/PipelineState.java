package edu.stanford.futuredata.bitimport.client;

public enum PipelineState {
    IDLE,
    // Reading the input and queueing shard groups.
    SCHEDULING,
    // Everything is queued; waiting for the workers to finish it.
    DRAINING,
    DONE,
    FAILED
}
