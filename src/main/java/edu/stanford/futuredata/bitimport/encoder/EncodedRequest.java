package edu.stanford.futuredata.bitimport.encoder;

public class EncodedRequest {
    public final ImportFormat format;
    public final String path;
    public final byte[] body;

    public EncodedRequest(ImportFormat format, String path, byte[] body) {
        this.format = format;
        this.path = path;
        this.body = body;
    }
}
