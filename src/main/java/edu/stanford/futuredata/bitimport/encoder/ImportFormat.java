package edu.stanford.futuredata.bitimport.encoder;

import edu.stanford.futuredata.bitimport.reader.RecordShape;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.schema.FieldType;

public enum ImportFormat {
    // Row-oriented (row, column, timestamp) arrays.
    COLUMNS,
    // Column and int64 value arrays for int fields.
    VALUES,
    // One roaring bitmap per view; only for ID addressed set, bool and time fields.
    ROARING;

    public static ImportFormat select(Field field, RecordShape shape, boolean fastImport) {
        if (shape.isValue()) {
            return VALUES;
        }
        if (fastImport && shape == RecordShape.ROW_ID_COLUMN_ID && supportsRoaring(field.getFieldType())) {
            return ROARING;
        }
        return COLUMNS;
    }

    private static boolean supportsRoaring(FieldType fieldType) {
        return fieldType == FieldType.SET || fieldType == FieldType.BOOL || fieldType == FieldType.TIME;
    }
}
