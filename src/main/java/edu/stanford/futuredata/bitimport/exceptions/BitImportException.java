package edu.stanford.futuredata.bitimport.exceptions;

public class BitImportException extends RuntimeException {

    public BitImportException(String message) {
        super(message);
    }

    public BitImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
