package edu.stanford.futuredata.bitimport.exceptions;

public class TransportException extends BitImportException {
    // -1 when the request never got a response.
    private final int statusCode;
    private final String responseBody;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = "";
    }

    public TransportException(int statusCode, String responseBody) {
        super(String.format("Server error (%d): %s", statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
