package edu.stanford.futuredata.bitimport.reader;

import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.schema.FieldType;

// How the records of one import are addressed. Resolved once per import from the field
// and its index, then used both to parse input lines and to pick the wire variant.
public enum RecordShape {
    ROW_ID_COLUMN_ID {
        @Override
        public Record parse(String[] fields, long timestamp) {
            return Column.rowIDColumnID(parseID(fields[0]), parseID(fields[1]), timestamp);
        }
    },
    ROW_ID_COLUMN_KEY {
        @Override
        public Record parse(String[] fields, long timestamp) {
            return Column.rowIDColumnKey(parseID(fields[0]), fields[1], timestamp);
        }
    },
    ROW_KEY_COLUMN_ID {
        @Override
        public Record parse(String[] fields, long timestamp) {
            return Column.rowKeyColumnID(fields[0], parseID(fields[1]), timestamp);
        }
    },
    ROW_KEY_COLUMN_KEY {
        @Override
        public Record parse(String[] fields, long timestamp) {
            return Column.rowKeyColumnKey(fields[0], fields[1], timestamp);
        }
    },
    VALUE_COLUMN_ID {
        @Override
        public Record parse(String[] fields, long timestamp) {
            return FieldValue.columnID(parseID(fields[0]), Long.parseLong(fields[1]));
        }
    },
    VALUE_COLUMN_KEY {
        @Override
        public Record parse(String[] fields, long timestamp) {
            return FieldValue.columnKey(fields[0], Long.parseLong(fields[1]));
        }
    };

    public abstract Record parse(String[] fields, long timestamp);

    public static RecordShape forField(Field field) {
        if (field.getFieldType() == FieldType.INT) {
            return field.indexUsesKeys() ? VALUE_COLUMN_KEY : VALUE_COLUMN_ID;
        }
        if (field.indexUsesKeys()) {
            return field.fieldUsesKeys() ? ROW_KEY_COLUMN_KEY : ROW_ID_COLUMN_KEY;
        }
        return field.fieldUsesKeys() ? ROW_KEY_COLUMN_ID : ROW_ID_COLUMN_ID;
    }

    public boolean isValue() {
        return this == VALUE_COLUMN_ID || this == VALUE_COLUMN_KEY;
    }

    public boolean hasColumnKeys() {
        return this == ROW_ID_COLUMN_KEY || this == ROW_KEY_COLUMN_KEY || this == VALUE_COLUMN_KEY;
    }

    public boolean hasRowKeys() {
        return this == ROW_KEY_COLUMN_ID || this == ROW_KEY_COLUMN_KEY;
    }

    // IDs are unsigned 64-bit on the wire.
    private static long parseID(String s) {
        return Long.parseUnsignedLong(s);
    }
}
