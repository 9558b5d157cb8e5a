package edu.stanford.futuredata.bitimport.interfaces;

@FunctionalInterface
public interface TimeParser {
    /*
     Turns the third field of an import line into epoch seconds.
     Throws any RuntimeException on malformed input.
     */
    long parse(String value);
}
