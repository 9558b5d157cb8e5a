package edu.stanford.futuredata.bitimport.schema;

import java.util.Objects;

public class Field {

    public static final long DEFAULT_SHARD_WIDTH = 1048576L;

    private final String indexName;
    private final String name;
    private final FieldType fieldType;
    private final boolean indexKeys;
    private final boolean fieldKeys;
    private final TimeQuantum timeQuantum;
    private final long shardWidth;

    private Field(Builder builder) {
        this.indexName = builder.indexName;
        this.name = builder.name;
        this.fieldType = builder.fieldType;
        this.indexKeys = builder.indexKeys;
        this.fieldKeys = builder.fieldKeys;
        this.timeQuantum = builder.timeQuantum;
        this.shardWidth = builder.shardWidth;
    }

    public static Builder builder(String indexName, String name) {
        return new Builder(indexName, name);
    }

    public String getIndexName() {
        return indexName;
    }

    public String getName() {
        return name;
    }

    public FieldType getFieldType() {
        return fieldType;
    }

    // Whether columns of the index are addressed by string keys.
    public boolean indexUsesKeys() {
        return indexKeys;
    }

    // Whether rows of the field are addressed by string keys.
    public boolean fieldUsesKeys() {
        return fieldKeys;
    }

    public TimeQuantum getTimeQuantum() {
        return timeQuantum;
    }

    public long getShardWidth() {
        return shardWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Field)) {
            return false;
        }
        Field other = (Field) o;
        return indexKeys == other.indexKeys && fieldKeys == other.fieldKeys && shardWidth == other.shardWidth
                && indexName.equals(other.indexName) && name.equals(other.name)
                && fieldType == other.fieldType && timeQuantum == other.timeQuantum;
    }

    @Override
    public int hashCode() {
        return Objects.hash(indexName, name, fieldType, indexKeys, fieldKeys, timeQuantum, shardWidth);
    }

    @Override
    public String toString() {
        return String.format("%s/%s(%s)", indexName, name, fieldType);
    }

    public static class Builder {
        private final String indexName;
        private final String name;
        private FieldType fieldType = FieldType.SET;
        private boolean indexKeys = false;
        private boolean fieldKeys = false;
        private TimeQuantum timeQuantum = TimeQuantum.NONE;
        private long shardWidth = DEFAULT_SHARD_WIDTH;

        private Builder(String indexName, String name) {
            this.indexName = Objects.requireNonNull(indexName, "indexName");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder fieldType(FieldType fieldType) {
            this.fieldType = Objects.requireNonNull(fieldType);
            return this;
        }

        public Builder indexKeys(boolean indexKeys) {
            this.indexKeys = indexKeys;
            return this;
        }

        public Builder fieldKeys(boolean fieldKeys) {
            this.fieldKeys = fieldKeys;
            return this;
        }

        public Builder timeQuantum(TimeQuantum timeQuantum) {
            this.timeQuantum = Objects.requireNonNull(timeQuantum);
            return this;
        }

        // A non-positive width means "server default".
        public Builder shardWidth(long shardWidth) {
            this.shardWidth = shardWidth > 0 ? shardWidth : DEFAULT_SHARD_WIDTH;
            return this;
        }

        public Field build() {
            return new Field(this);
        }
    }
}
