package edu.stanford.futuredata.bitimport.reader;

import edu.stanford.futuredata.bitimport.exceptions.ParseException;
import edu.stanford.futuredata.bitimport.interfaces.Record;
import edu.stanford.futuredata.bitimport.interfaces.TimeParser;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily turns comma separated lines into records. Each non-blank line must be
 * {@code first,second} or {@code first,second,timestamp}; the meaning of the first two fields
 * is given by the {@link RecordShape}. A malformed line aborts the read with a
 * {@link ParseException}.
 *
 * <p>Single pass and not thread-safe.
 */
public class CsvRecordReader implements Iterator<Record>, Closeable {

    private final BufferedReader reader;
    private final RecordShape shape;
    private final TimeParser timeParser;
    private boolean skipHeader;

    private long lineNumber = 0;
    private Record next = null;
    private boolean exhausted = false;

    public CsvRecordReader(Reader source, RecordShape shape) {
        this(source, shape, TimeParsers.EPOCH_SECONDS, false);
    }

    public CsvRecordReader(Reader source, RecordShape shape, TimeParser timeParser, boolean skipHeader) {
        this.reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        this.shape = shape;
        this.timeParser = timeParser;
        this.skipHeader = skipHeader;
    }

    public static CsvRecordReader fromString(String text, RecordShape shape) {
        return new CsvRecordReader(new StringReader(text), shape);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            next = readRecord();
            exhausted = next == null;
        }
        return next != null;
    }

    @Override
    public Record next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Record r = next;
        next = null;
        return r;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private Record readRecord() {
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            if (skipHeader) {
                skipHeader = false;
                continue;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            return parseLine(line);
        }
        return null;
    }

    private Record parseLine(String line) {
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        try {
            if (parts.length == 2) {
                return shape.parse(parts, 0);
            } else if (parts.length == 3) {
                // Int values carry no timestamp; the third field is ignored.
                return shape.parse(parts, shape.isValue() ? 0 : timeParser.parse(parts[2]));
            }
        } catch (RuntimeException e) {
            throw new ParseException(lineNumber, line, e);
        }
        throw new ParseException(lineNumber, line);
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
