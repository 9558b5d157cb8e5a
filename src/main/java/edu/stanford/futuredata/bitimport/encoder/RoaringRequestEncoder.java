package edu.stanford.futuredata.bitimport.encoder;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.bitimport.ImportRoaringRequest;
import edu.stanford.futuredata.bitimport.ImportRoaringRequestView;
import edu.stanford.futuredata.bitimport.exceptions.EncodingException;
import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.reader.Column;
import edu.stanford.futuredata.bitimport.reader.RecordShape;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.schema.TimeQuantum;
import org.roaringbitmap.longlong.Roaring64NavigableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the bitmap import message for one shard. Every (row, column) pair becomes the bit
 * {@code row * shardWidth + column % shardWidth}, set in the standard view and, for time
 * fields, in every time view its timestamp falls into.
 */
public class RoaringRequestEncoder {

    public static final String STANDARD_VIEW = "";

    private RoaringRequestEncoder() {}

    public static ImportRoaringRequest encode(Field field, List<? extends Record> records, boolean clear) {
        long shardWidth = field.getShardWidth();
        TimeQuantum quantum = field.getTimeQuantum();
        Map<String, Roaring64NavigableMap> views = new LinkedHashMap<>();
        Roaring64NavigableMap standard = new Roaring64NavigableMap();
        views.put(STANDARD_VIEW, standard);
        for (Record r : records) {
            Column c = ColumnRequestEncoder.asColumn(r, RecordShape.ROW_ID_COLUMN_ID);
            long bit = bitPosition(c.getRowID(), c.getColumnID(), shardWidth);
            standard.addLong(bit);
            for (String viewName : quantum.viewNames(c.getTimestamp())) {
                views.computeIfAbsent(viewName, k -> new Roaring64NavigableMap()).addLong(bit);
            }
        }
        ImportRoaringRequest.Builder request = ImportRoaringRequest.newBuilder().setClear(clear);
        for (Map.Entry<String, Roaring64NavigableMap> e : views.entrySet()) {
            request.addViews(ImportRoaringRequestView.newBuilder()
                    .setName(e.getKey())
                    .setData(serialize(e.getValue())));
        }
        return request.build();
    }

    public static long bitPosition(long rowID, long columnID, long shardWidth) {
        long offset = Long.remainderUnsigned(columnID, shardWidth);
        long maxRowID = Long.divideUnsigned(-1L, shardWidth);
        int c = Long.compareUnsigned(rowID, maxRowID);
        if (c > 0 || (c == 0 && Long.compareUnsigned(offset, Long.remainderUnsigned(-1L, shardWidth)) > 0)) {
            throw new EncodingException(String.format("Row %s overflows the bitmap position space",
                    Long.toUnsignedString(rowID)));
        }
        return rowID * shardWidth + offset;
    }

    private static ByteString serialize(Roaring64NavigableMap bitmap) {
        return ByteString.copyFrom(RoaringViewFormat.write(bitmap));
    }
}
