package edu.stanford.futuredata.bitimport.reader;

import edu.stanford.futuredata.bitimport.interfaces.Record;

import java.util.Objects;

// A (row, column) association, optionally timestamped. Either the ID or the key of each side is
// meaningful, never both; which one is fixed by the field's RecordShape.
public final class Column implements Record {
    private final long rowID;
    private final long columnID;
    private final String rowKey;
    private final String columnKey;
    private final long timestamp;

    private Column(long rowID, long columnID, String rowKey, String columnKey, long timestamp) {
        this.rowID = rowID;
        this.columnID = columnID;
        this.rowKey = rowKey;
        this.columnKey = columnKey;
        this.timestamp = timestamp;
    }

    public static Column rowIDColumnID(long rowID, long columnID, long timestamp) {
        return new Column(rowID, columnID, null, null, timestamp);
    }

    public static Column rowIDColumnKey(long rowID, String columnKey, long timestamp) {
        return new Column(rowID, 0, null, Objects.requireNonNull(columnKey), timestamp);
    }

    public static Column rowKeyColumnID(String rowKey, long columnID, long timestamp) {
        return new Column(0, columnID, Objects.requireNonNull(rowKey), null, timestamp);
    }

    public static Column rowKeyColumnKey(String rowKey, String columnKey, long timestamp) {
        return new Column(0, 0, Objects.requireNonNull(rowKey), Objects.requireNonNull(columnKey), timestamp);
    }

    public long getRowID() {
        return rowID;
    }

    @Override
    public long getColumnID() {
        return columnID;
    }

    public String getRowKey() {
        return rowKey;
    }

    @Override
    public String getColumnKey() {
        return columnKey;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Column)) {
            return false;
        }
        Column other = (Column) o;
        return rowID == other.rowID && columnID == other.columnID && timestamp == other.timestamp
                && Objects.equals(rowKey, other.rowKey) && Objects.equals(columnKey, other.columnKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowID, columnID, rowKey, columnKey, timestamp);
    }

    @Override
    public String toString() {
        String row = rowKey != null ? "rowKey='" + rowKey + "'" : "rowID=" + Long.toUnsignedString(rowID);
        String column = columnKey != null ? "columnKey='" + columnKey + "'" : "columnID=" + Long.toUnsignedString(columnID);
        return String.format("Column(%s, %s, timestamp=%d)", row, column, timestamp);
    }
}
