package edu.stanford.futuredata.bitimport.schema;

public enum FieldType {
    SET("set"),
    INT("int"),
    TIME("time"),
    MUTEX("mutex"),
    BOOL("bool");

    private final String name;

    FieldType(String name) {
        this.name = name;
    }

    public static FieldType fromName(String name) {
        for (FieldType t : values()) {
            if (t.name.equalsIgnoreCase(name)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
