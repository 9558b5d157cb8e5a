package edu.stanford.futuredata.bitimport.exceptions;

public class ParseException extends BitImportException {
    private final long lineNumber;
    private final String line;

    public ParseException(long lineNumber, String line) {
        this(lineNumber, line, null);
    }

    public ParseException(long lineNumber, String line, Throwable cause) {
        super(String.format("Invalid CSV line %d: %s", lineNumber, line), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
