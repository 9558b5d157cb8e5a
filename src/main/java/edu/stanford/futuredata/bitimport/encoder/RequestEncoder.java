package edu.stanford.futuredata.bitimport.encoder;

import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.reader.RecordShape;
import edu.stanford.futuredata.bitimport.schema.Field;

import java.util.List;

public class RequestEncoder {

    private final Field field;
    private final RecordShape shape;
    private final ImportFormat format;
    private final boolean clear;

    public RequestEncoder(Field field, boolean fastImport, boolean clear) {
        this.field = field;
        this.shape = RecordShape.forField(field);
        this.format = ImportFormat.select(field, shape, fastImport);
        this.clear = clear;
    }

    public EncodedRequest encode(long shard, List<? extends Record> records) {
        switch (format) {
            case ROARING:
                return new EncodedRequest(format, roaringPath(shard),
                        RoaringRequestEncoder.encode(field, records, clear).toByteArray());
            case VALUES:
                return new EncodedRequest(format, importPath(),
                        ColumnRequestEncoder.encodeValues(field, shape, shard, records).toByteArray());
            case COLUMNS:
            default:
                return new EncodedRequest(format, importPath(),
                        ColumnRequestEncoder.encodeColumns(field, shape, shard, records).toByteArray());
        }
    }

    public ImportFormat getFormat() {
        return format;
    }

    public RecordShape getShape() {
        return shape;
    }

    private String importPath() {
        String path = String.format("/index/%s/field/%s/import", field.getIndexName(), field.getName());
        return clear ? path + "?clear=true" : path;
    }

    private String roaringPath(long shard) {
        return String.format("/index/%s/field/%s/import-roaring/%s",
                field.getIndexName(), field.getName(), Long.toUnsignedString(shard));
    }
}
