package edu.stanford.futuredata.bitimport.interfaces;

import edu.stanford.futuredata.bitimport.transport.Node;

import java.util.Map;

public interface TransportClient extends AutoCloseable {
    /*
     Moves bytes to and from the server cluster.  Lives with the caller and is shared
     by every worker of an import; implementations must be thread-safe.

     Every method returns the response body of a 2xx answer and throws
     TransportException for any other status or when no server could be reached.
     */

    // Send a request to one specific node.
    byte[] send(Node node, String method, String path, byte[] body, Map<String, String> headers)
            throws InterruptedException;

    // Send a request to any live node of the cluster.
    byte[] send(String method, String path, byte[] body, Map<String, String> headers)
            throws InterruptedException;

    @Override
    void close();
}
