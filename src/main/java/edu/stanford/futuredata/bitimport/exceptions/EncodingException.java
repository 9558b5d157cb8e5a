package edu.stanford.futuredata.bitimport.exceptions;

public class EncodingException extends BitImportException {

    public EncodingException(String message) {
        super(message);
    }
}
