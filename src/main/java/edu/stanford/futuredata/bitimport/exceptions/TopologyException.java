package edu.stanford.futuredata.bitimport.exceptions;

public class TopologyException extends BitImportException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
