package edu.stanford.futuredata.bitimport.reader;

import edu.stanford.futuredata.bitimport.interfaces.TimeParser;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class TimeParsers {

    public static final TimeParser EPOCH_SECONDS = Long::parseLong;

    private TimeParsers() {}

    // Parses timestamps written with the given pattern, interpreted as UTC.
    public static TimeParser pattern(String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        return value -> LocalDateTime.parse(value, formatter).toEpochSecond(ZoneOffset.UTC);
    }
}
