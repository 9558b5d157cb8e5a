package edu.stanford.futuredata.bitimport.reader;

import edu.stanford.futuredata.bitimport.interfaces.Record;

import java.util.Objects;

public final class FieldValue implements Record {
    private final long columnID;
    private final String columnKey;
    private final long value;

    private FieldValue(long columnID, String columnKey, long value) {
        this.columnID = columnID;
        this.columnKey = columnKey;
        this.value = value;
    }

    public static FieldValue columnID(long columnID, long value) {
        return new FieldValue(columnID, null, value);
    }

    public static FieldValue columnKey(String columnKey, long value) {
        return new FieldValue(0, Objects.requireNonNull(columnKey), value);
    }

    @Override
    public long getColumnID() {
        return columnID;
    }

    @Override
    public String getColumnKey() {
        return columnKey;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue)) {
            return false;
        }
        FieldValue other = (FieldValue) o;
        return columnID == other.columnID && value == other.value && Objects.equals(columnKey, other.columnKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnID, columnKey, value);
    }

    @Override
    public String toString() {
        if (columnKey != null) {
            return String.format("FieldValue(columnKey='%s', value=%d)", columnKey, value);
        }
        return String.format("FieldValue(columnID=%s, value=%d)", Long.toUnsignedString(columnID), value);
    }
}
