package edu.stanford.futuredata.bitimport.transport;

import edu.stanford.futuredata.bitimport.exceptions.TransportException;
import edu.stanford.futuredata.bitimport.interfaces.TransportClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link TransportClient} over the JDK HTTP client. Requests without a target node go to the
 * first healthy host of the {@link Cluster}; hosts that cannot be reached are marked down and the
 * next one is tried. A non-2xx answer is never retried.
 */
public class HttpTransportClient implements TransportClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpTransportClient.class);

    public static final String USER_AGENT = "bitimport-java/1.0";

    private final Cluster cluster;
    private final ClientOptions options;
    private final HttpClient httpClient;

    public HttpTransportClient(Cluster cluster, ClientOptions options) {
        this.cluster = cluster;
        this.options = options;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(options.connectTimeoutMillis))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public static HttpTransportClient forAddress(String address) {
        return new HttpTransportClient(Cluster.withHosts(Node.parse(address)), ClientOptions.defaults());
    }

    @Override
    public byte[] send(Node node, String method, String path, byte[] body, Map<String, String> headers)
            throws InterruptedException {
        try {
            return execute(node, method, path, body, headers);
        } catch (IOException e) {
            throw new TransportException(String.format("Request %s %s to %s failed: %s", method, path, node, e), e);
        }
    }

    @Override
    public byte[] send(String method, String path, byte[] body, Map<String, String> headers)
            throws InterruptedException {
        IOException lastFailure = null;
        for (int i = 0; i < options.maxHosts; i++) {
            Node host = cluster.nextHost();
            try {
                return execute(host, method, path, body, headers);
            } catch (IOException e) {
                lastFailure = e;
                if (options.useManualAddress) {
                    break;
                }
                cluster.markDown(host);
                logger.warn("Removed {} from the cluster due to {}", host, e.toString());
            }
        }
        throw new TransportException(String.format("Tried %d hosts, still failing", options.maxHosts), lastFailure);
    }

    @Override
    public void close() {
        // HttpClient on JDK 17 has no close; connections are released with the client.
    }

    public Cluster getCluster() {
        return cluster;
    }

    private byte[] execute(Node node, String method, String path, byte[] body, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(node.url() + path))
                .method(method, publisher)
                .header("User-Agent", USER_AGENT);
        if (options.requestTimeoutMillis > 0) {
            request.timeout(Duration.ofMillis(options.requestTimeoutMillis));
        }
        if (headers != null) {
            headers.forEach(request::header);
        }
        logger.debug("Request: {} {}{}", method, node.url(), path);
        HttpResponse<byte[]> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            byte[] content = response.body();
            throw new TransportException(status, content == null ? "" : new String(content, StandardCharsets.UTF_8));
        }
        return response.body();
    }
}
