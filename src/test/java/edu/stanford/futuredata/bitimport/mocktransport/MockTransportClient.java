package edu.stanford.futuredata.bitimport.mocktransport;

import edu.stanford.futuredata.bitimport.exceptions.TransportException;
import edu.stanford.futuredata.bitimport.interfaces.TransportClient;
import edu.stanford.futuredata.bitimport.transport.Node;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

// In-memory cluster. Cluster-wide GETs are answered from canned JSON keyed by path prefix;
// node POSTs are recorded and acknowledged, optionally failing or blocking.
public class MockTransportClient implements TransportClient {

    public static class SentRequest {
        public final Node node;
        public final String method;
        public final String path;
        public final byte[] body;

        SentRequest(Node node, String method, String path, byte[] body) {
            this.node = node;
            this.method = method;
            this.path = path;
            this.body = body;
        }
    }

    private final Map<String, String> cannedResponses = new ConcurrentHashMap<>();
    private final List<SentRequest> sentRequests = new ArrayList<>();
    private final List<String> clusterPaths = new ArrayList<>();
    private final AtomicInteger nodeRequestCount = new AtomicInteger(0);
    private volatile int failingRequestNumber = -1;
    private volatile CountDownLatch gate = null;

    public static String nodeJson(String host, int port, boolean coordinator) {
        return String.format("{\"id\":\"%s\",\"uri\":{\"scheme\":\"http\",\"host\":\"%s\",\"port\":%d},\"isCoordinator\":%b}",
                host, host, port, coordinator);
    }

    public static String fragmentNodesJson(String... hosts) {
        List<String> nodes = new ArrayList<>();
        for (String h : hosts) {
            nodes.add(nodeJson(h, 10101, false));
        }
        return "[" + String.join(",", nodes) + "]";
    }

    public MockTransportClient respondTo(String pathPrefix, String json) {
        cannedResponses.put(pathPrefix, json);
        return this;
    }

    // The n-th request sent to a node (1-based) answers with a 500.
    public MockTransportClient failNodeRequest(int n) {
        this.failingRequestNumber = n;
        return this;
    }

    // Node requests wait until the returned latch is counted down, or the sender is interrupted.
    public CountDownLatch blockNodeRequests() {
        gate = new CountDownLatch(1);
        return gate;
    }

    @Override
    public byte[] send(Node node, String method, String path, byte[] body, Map<String, String> headers)
            throws InterruptedException {
        int number = nodeRequestCount.incrementAndGet();
        CountDownLatch g = gate;
        if (g != null) {
            g.await();
        }
        if (number == failingRequestNumber) {
            throw new TransportException(500, "injected failure");
        }
        synchronized (sentRequests) {
            sentRequests.add(new SentRequest(node, method, path, body));
        }
        return new byte[0];
    }

    @Override
    public byte[] send(String method, String path, byte[] body, Map<String, String> headers) {
        synchronized (clusterPaths) {
            clusterPaths.add(path);
        }
        String longestMatch = null;
        for (String prefix : cannedResponses.keySet()) {
            if (path.startsWith(prefix) && (longestMatch == null || prefix.length() > longestMatch.length())) {
                longestMatch = prefix;
            }
        }
        if (longestMatch == null) {
            throw new TransportException(404, "not found: " + path);
        }
        return cannedResponses.get(longestMatch).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void close() {}

    public List<SentRequest> getSentRequests() {
        synchronized (sentRequests) {
            return new ArrayList<>(sentRequests);
        }
    }

    public List<String> getClusterPaths() {
        synchronized (clusterPaths) {
            return new ArrayList<>(clusterPaths);
        }
    }

    public List<String> sentPaths() {
        return getSentRequests().stream().map(r -> r.path).collect(Collectors.toList());
    }

    public int getNodeRequestCount() {
        return nodeRequestCount.get();
    }
}
