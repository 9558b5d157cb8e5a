package edu.stanford.futuredata.bitimport.schema;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public enum TimeQuantum {
    NONE(""),
    YEAR("Y"),
    MONTH("M"),
    DAY("D"),
    HOUR("H"),
    YEAR_MONTH("YM"),
    MONTH_DAY("MD"),
    DAY_HOUR("DH"),
    YEAR_MONTH_DAY("YMD"),
    MONTH_DAY_HOUR("MDH"),
    YEAR_MONTH_DAY_HOUR("YMDH");

    private static final DateTimeFormatter YEAR_FORMAT = utcFormatter("yyyy");
    private static final DateTimeFormatter MONTH_FORMAT = utcFormatter("yyyyMM");
    private static final DateTimeFormatter DAY_FORMAT = utcFormatter("yyyyMMdd");
    private static final DateTimeFormatter HOUR_FORMAT = utcFormatter("yyyyMMddHH");

    private final String value;

    TimeQuantum(String value) {
        this.value = value;
    }

    public static TimeQuantum fromString(String value) {
        if (value == null) {
            return NONE;
        }
        for (TimeQuantum q : values()) {
            if (q.value.equals(value)) {
                return q;
            }
        }
        throw new IllegalArgumentException("Invalid time quantum: " + value);
    }

    public boolean isNone() {
        return this == NONE;
    }

    // Names of the time views a timestamp (epoch seconds, UTC) falls into, one per granularity,
    // in quantum order. "YM" yields e.g. ["2020", "202003"].
    public List<String> viewNames(long timestamp) {
        if (isNone()) {
            return Collections.emptyList();
        }
        Instant instant = Instant.ofEpochSecond(timestamp);
        List<String> names = new ArrayList<>(value.length());
        for (char c : value.toCharArray()) {
            names.add(formatterFor(c).format(instant));
        }
        return names;
    }

    private static DateTimeFormatter formatterFor(char granularity) {
        switch (granularity) {
            case 'Y':
                return YEAR_FORMAT;
            case 'M':
                return MONTH_FORMAT;
            case 'D':
                return DAY_FORMAT;
            case 'H':
                return HOUR_FORMAT;
            default:
                throw new IllegalStateException("Unknown time granularity: " + granularity);
        }
    }

    private static DateTimeFormatter utcFormatter(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC);
    }

    @Override
    public String toString() {
        return value;
    }
}
