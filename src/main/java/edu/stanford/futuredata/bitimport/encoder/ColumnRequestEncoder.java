package edu.stanford.futuredata.bitimport.encoder;

import edu.stanford.futuredata.bitimport.ImportRequest;
import edu.stanford.futuredata.bitimport.ImportValueRequest;
import edu.stanford.futuredata.bitimport.exceptions.EncodingException;
import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.reader.Column;
import edu.stanford.futuredata.bitimport.reader.FieldValue;
import edu.stanford.futuredata.bitimport.reader.RecordShape;
import edu.stanford.futuredata.bitimport.schema.Field;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

// Builds the row-oriented import messages. Populates exactly one of the ID/key arrays on each
// side, aligned by index with the timestamps (or values).
public class ColumnRequestEncoder {

    // Unsigned, as IDs are uint64 on the wire.
    static final Comparator<Column> ROW_COLUMN_ORDER = (a, b) -> {
        int c = Long.compareUnsigned(a.getRowID(), b.getRowID());
        return c != 0 ? c : Long.compareUnsigned(a.getColumnID(), b.getColumnID());
    };

    private ColumnRequestEncoder() {}

    public static ImportRequest encodeColumns(Field field, RecordShape shape, long shard, List<? extends Record> records) {
        List<Column> columns = new ArrayList<>(records.size());
        for (Record r : records) {
            columns.add(asColumn(r, shape));
        }
        // ID addressed columns must reach the server sorted by (row, column).
        if (!shape.hasColumnKeys()) {
            columns.sort(ROW_COLUMN_ORDER);
        }
        ImportRequest.Builder request = ImportRequest.newBuilder()
                .setIndex(field.getIndexName())
                .setField(field.getName())
                .setShard(shard);
        switch (shape) {
            case ROW_ID_COLUMN_ID:
                for (Column c : columns) {
                    request.addRowIDs(c.getRowID()).addColumnIDs(c.getColumnID()).addTimestamps(c.getTimestamp());
                }
                break;
            case ROW_ID_COLUMN_KEY:
                for (Column c : columns) {
                    request.addRowIDs(c.getRowID()).addColumnKeys(c.getColumnKey()).addTimestamps(c.getTimestamp());
                }
                break;
            case ROW_KEY_COLUMN_ID:
                for (Column c : columns) {
                    request.addRowKeys(c.getRowKey()).addColumnIDs(c.getColumnID()).addTimestamps(c.getTimestamp());
                }
                break;
            case ROW_KEY_COLUMN_KEY:
                for (Column c : columns) {
                    request.addRowKeys(c.getRowKey()).addColumnKeys(c.getColumnKey()).addTimestamps(c.getTimestamp());
                }
                break;
            default:
                throw new EncodingException("Invalid import format for column records: " + shape);
        }
        return request.build();
    }

    public static ImportValueRequest encodeValues(Field field, RecordShape shape, long shard, List<? extends Record> records) {
        ImportValueRequest.Builder request = ImportValueRequest.newBuilder()
                .setIndex(field.getIndexName())
                .setField(field.getName())
                .setShard(shard);
        switch (shape) {
            case VALUE_COLUMN_ID:
                for (Record r : records) {
                    FieldValue v = asFieldValue(r, shape);
                    request.addColumnIDs(v.getColumnID()).addValues(v.getValue());
                }
                break;
            case VALUE_COLUMN_KEY:
                for (Record r : records) {
                    FieldValue v = asFieldValue(r, shape);
                    request.addColumnKeys(v.getColumnKey()).addValues(v.getValue());
                }
                break;
            default:
                throw new EncodingException("Invalid import format for value records: " + shape);
        }
        return request.build();
    }

    static Column asColumn(Record r, RecordShape shape) {
        if (!(r instanceof Column)) {
            throw new EncodingException(String.format("%s cannot be imported as %s", r, shape));
        }
        Column c = (Column) r;
        if ((c.getRowKey() != null) != shape.hasRowKeys() || (c.getColumnKey() != null) != shape.hasColumnKeys()) {
            throw new EncodingException(String.format("%s does not match the field addressing %s", c, shape));
        }
        return c;
    }

    private static FieldValue asFieldValue(Record r, RecordShape shape) {
        if (!(r instanceof FieldValue)) {
            throw new EncodingException(String.format("%s cannot be imported as %s", r, shape));
        }
        FieldValue v = (FieldValue) r;
        if ((v.getColumnKey() != null) != shape.hasColumnKeys()) {
            throw new EncodingException(String.format("%s does not match the field addressing %s", v, shape));
        }
        return v;
    }
}
