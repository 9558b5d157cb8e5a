package edu.stanford.futuredata.bitimport.interfaces;

public interface Record {
    /*
     One unit of imported data.  Records are routed to shards by column ID;
     when the index addresses columns by key the column ID is 0 and the key is set.
     Implementations are immutable.
     */

    long getColumnID();

    // Null unless the column is addressed by key.
    String getColumnKey();
}
