package edu.stanford.futuredata.bitimport.encoder;

import edu.stanford.futuredata.bitimport.ImportRequest;
import edu.stanford.futuredata.bitimport.ImportValueRequest;
import edu.stanford.futuredata.bitimport.exceptions.EncodingException;
import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.reader.Column;
import edu.stanford.futuredata.bitimport.reader.FieldValue;
import edu.stanford.futuredata.bitimport.reader.RecordShape;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.schema.FieldType;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnRequestEncoderTests {

    private static final Logger logger = LoggerFactory.getLogger(ColumnRequestEncoderTests.class);

    private static final Field SET_FIELD = Field.builder("repository", "stargazer").build();

    @Test
    public void testRowIDColumnIDDecodes() throws Exception {
        logger.info("testRowIDColumnIDDecodes");
        List<Record> records = List.of(
                Column.rowIDColumnID(10, 7, 100),
                Column.rowIDColumnID(10, 5, 200),
                Column.rowIDColumnID(2, 3, 300),
                Column.rowIDColumnID(7, 1, 400));
        RequestEncoder encoder = new RequestEncoder(SET_FIELD, false, false);
        EncodedRequest encoded = encoder.encode(0, records);
        assertEquals(ImportFormat.COLUMNS, encoded.format);
        assertEquals("/index/repository/field/stargazer/import", encoded.path);

        ImportRequest request = ImportRequest.parseFrom(encoded.body);
        assertEquals("repository", request.getIndex());
        assertEquals("stargazer", request.getField());
        assertEquals(0, request.getShard());
        // Sorted by (row, column), timestamps travel with their column.
        assertEquals(List.of(2L, 7L, 10L, 10L), request.getRowIDsList());
        assertEquals(List.of(3L, 1L, 5L, 7L), request.getColumnIDsList());
        assertEquals(List.of(300L, 400L, 200L, 100L), request.getTimestampsList());
        assertEquals(0, request.getRowKeysCount());
        assertEquals(0, request.getColumnKeysCount());
    }

    @Test
    public void testOrderingOnRandomInput() {
        logger.info("testOrderingOnRandomInput");
        Random random = new Random(7);
        List<Record> records = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            records.add(Column.rowIDColumnID(random.nextInt(30), random.nextInt(1 << 20), i));
        }
        ImportRequest request = ColumnRequestEncoder.encodeColumns(SET_FIELD, RecordShape.ROW_ID_COLUMN_ID, 0, records);
        assertEquals(1000, request.getRowIDsCount());
        assertEquals(1000, request.getColumnIDsCount());
        assertEquals(1000, request.getTimestampsCount());
        for (int i = 1; i < 1000; i++) {
            long prevRow = request.getRowIDs(i - 1);
            long row = request.getRowIDs(i);
            assertTrue(prevRow < row || (prevRow == row && request.getColumnIDs(i - 1) <= request.getColumnIDs(i)));
        }
    }

    @Test
    public void testKeyVariants() {
        logger.info("testKeyVariants");
        Field indexKeys = Field.builder("i", "f").indexKeys(true).build();
        ImportRequest r1 = ColumnRequestEncoder.encodeColumns(indexKeys, RecordShape.forField(indexKeys), 0,
                List.of(Column.rowIDColumnKey(1, "alice", 0), Column.rowIDColumnKey(2, "bob", 0)));
        assertEquals(List.of(1L, 2L), r1.getRowIDsList());
        assertEquals(List.of("alice", "bob"), r1.getColumnKeysList());
        assertEquals(0, r1.getRowKeysCount());
        assertEquals(0, r1.getColumnIDsCount());

        Field fieldKeys = Field.builder("i", "f").fieldKeys(true).build();
        ImportRequest r2 = ColumnRequestEncoder.encodeColumns(fieldKeys, RecordShape.forField(fieldKeys), 0,
                List.of(Column.rowKeyColumnID("blue", 9, 0), Column.rowKeyColumnID("red", 4, 0)));
        assertEquals(List.of("red", "blue"), r2.getRowKeysList());
        assertEquals(List.of(4L, 9L), r2.getColumnIDsList());
        assertEquals(0, r2.getRowIDsCount());
        assertEquals(0, r2.getColumnKeysCount());

        Field bothKeys = Field.builder("i", "f").indexKeys(true).fieldKeys(true).build();
        ImportRequest r3 = ColumnRequestEncoder.encodeColumns(bothKeys, RecordShape.forField(bothKeys), 0,
                List.of(Column.rowKeyColumnKey("blue", "alice", 5)));
        assertEquals(List.of("blue"), r3.getRowKeysList());
        assertEquals(List.of("alice"), r3.getColumnKeysList());
        assertEquals(List.of(5L), r3.getTimestampsList());
    }

    @Test
    public void testMismatchedRecordsFailFast() {
        logger.info("testMismatchedRecordsFailFast");
        Field indexKeys = Field.builder("i", "f").indexKeys(true).build();
        assertThrows(EncodingException.class, () -> ColumnRequestEncoder.encodeColumns(indexKeys,
                RecordShape.forField(indexKeys), 0, List.of(Column.rowIDColumnID(1, 2, 0))));
        assertThrows(EncodingException.class, () -> ColumnRequestEncoder.encodeColumns(SET_FIELD,
                RecordShape.ROW_ID_COLUMN_ID, 0, List.of(FieldValue.columnID(1, 2))));
        assertThrows(EncodingException.class, () -> ColumnRequestEncoder.encodeColumns(SET_FIELD,
                RecordShape.VALUE_COLUMN_ID, 0, List.of(Column.rowIDColumnID(1, 2, 0))));
    }

    @Test
    public void testValues() throws Exception {
        logger.info("testValues");
        Field intField = Field.builder("i", "size").fieldType(FieldType.INT).build();
        RequestEncoder encoder = new RequestEncoder(intField, true, false);
        assertEquals(ImportFormat.VALUES, encoder.getFormat());
        EncodedRequest encoded = encoder.encode(3, List.of(FieldValue.columnID(3145729, -7), FieldValue.columnID(3145728, 12)));
        assertEquals("/index/i/field/size/import", encoded.path);
        ImportValueRequest request = ImportValueRequest.parseFrom(encoded.body);
        assertEquals(3, request.getShard());
        assertEquals(List.of(3145729L, 3145728L), request.getColumnIDsList());
        assertEquals(List.of(-7L, 12L), request.getValuesList());
        assertEquals(0, request.getColumnKeysCount());

        Field keyedInt = Field.builder("i", "size").fieldType(FieldType.INT).indexKeys(true).build();
        ImportValueRequest keyed = ColumnRequestEncoder.encodeValues(keyedInt, RecordShape.forField(keyedInt), 0,
                List.of(FieldValue.columnKey("alice", 1)));
        assertEquals(List.of("alice"), keyed.getColumnKeysList());
        assertEquals(0, keyed.getColumnIDsCount());
    }

    @Test
    public void testClearPath() {
        logger.info("testClearPath");
        RequestEncoder encoder = new RequestEncoder(SET_FIELD, false, true);
        assertEquals("/index/repository/field/stargazer/import?clear=true",
                encoder.encode(0, List.of(Column.rowIDColumnID(1, 1, 0))).path);
    }

    @Test
    public void testFormatSelection() {
        logger.info("testFormatSelection");
        assertEquals(ImportFormat.ROARING, new RequestEncoder(SET_FIELD, true, false).getFormat());
        assertEquals(ImportFormat.COLUMNS, new RequestEncoder(SET_FIELD, false, false).getFormat());
        Field mutex = Field.builder("i", "m").fieldType(FieldType.MUTEX).build();
        assertEquals(ImportFormat.COLUMNS, new RequestEncoder(mutex, true, false).getFormat());
        Field keyedSet = Field.builder("i", "f").fieldKeys(true).build();
        assertEquals(ImportFormat.COLUMNS, new RequestEncoder(keyedSet, true, false).getFormat());
        Field keyedIndex = Field.builder("i", "f").fieldType(FieldType.TIME).indexKeys(true).build();
        assertEquals(ImportFormat.COLUMNS, new RequestEncoder(keyedIndex, true, false).getFormat());
        Field bool = Field.builder("i", "b").fieldType(FieldType.BOOL).build();
        assertEquals(ImportFormat.ROARING, new RequestEncoder(bool, true, false).getFormat());
    }
}
