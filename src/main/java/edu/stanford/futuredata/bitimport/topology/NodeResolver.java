package edu.stanford.futuredata.bitimport.topology;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.stanford.futuredata.bitimport.exceptions.TopologyException;
import edu.stanford.futuredata.bitimport.interfaces.TransportClient;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.transport.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Finds the servers an import request must go to. Topology is asked for again on every call;
// nothing is cached, so a cluster change is picked up by the next shard group.
public class NodeResolver {

    private static final Logger logger = LoggerFactory.getLogger(NodeResolver.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final TransportClient transport;
    // Set when the client is pinned to a single server.
    private final Node manualNode;

    public NodeResolver(TransportClient transport) {
        this(transport, null);
    }

    public NodeResolver(TransportClient transport, Node manualNode) {
        this.transport = transport;
        this.manualNode = manualNode;
    }

    // Nodes that must receive the import of shard for field. Writes addressed by
    // key go to the coordinator only, which owns key translation.
    public List<Node> nodesFor(Field field, long shard) throws InterruptedException {
        if (manualNode != null) {
            return Collections.singletonList(manualNode);
        }
        if (field.indexUsesKeys() || field.fieldUsesKeys()) {
            return Collections.singletonList(coordinatorNode());
        }
        return fragmentNodes(field.getIndexName(), shard);
    }

    public List<Node> fragmentNodes(String indexName, long shard) throws InterruptedException {
        String path = String.format("/internal/fragment/nodes?shard=%s&index=%s",
                Long.toUnsignedString(shard), URLEncoder.encode(indexName, StandardCharsets.UTF_8));
        JsonNode nodeList = readJson(transport.send("GET", path, null, null), path);
        if (!nodeList.isArray() || nodeList.size() == 0) {
            throw new TopologyException(String.format("No nodes own shard %s of index %s",
                    Long.toUnsignedString(shard), indexName));
        }
        List<Node> nodes = new ArrayList<>(nodeList.size());
        for (JsonNode n : nodeList) {
            nodes.add(parseNode(n, path));
        }
        logger.debug("Shard {} of {} is owned by {}", shard, indexName, nodes);
        return nodes;
    }

    public Node coordinatorNode() throws InterruptedException {
        JsonNode status = readJson(transport.send("GET", "/status", null, null), "/status");
        for (JsonNode n : status.path("nodes")) {
            if (n.path("isCoordinator").asBoolean(false)) {
                return parseNode(n, "/status");
            }
        }
        throw new TopologyException("No coordinator node found in cluster status");
    }

    private static Node parseNode(JsonNode n, String source) {
        JsonNode uri = n.path("uri");
        if (!uri.hasNonNull("host")) {
            throw new TopologyException(String.format("Node without host in %s response: %s", source, n));
        }
        return new Node(uri.path("scheme").asText(Node.DEFAULT_SCHEME), uri.get("host").asText(),
                uri.path("port").asInt(0));
    }

    private static JsonNode readJson(byte[] content, String source) {
        try {
            return mapper.readTree(content);
        } catch (IOException e) {
            throw new TopologyException(String.format("Unparseable %s response", source), e);
        }
    }
}
