package edu.stanford.futuredata.bitimport.transport;

import edu.stanford.futuredata.bitimport.exceptions.TransportException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// The hosts a client may contact when no particular node is required. Hosts that fail a
// connection are taken out of rotation until every host has failed, at which point all
// of them become eligible again.
public class Cluster {

    private final List<Node> hosts;
    // Map from host to whether it is currently usable.
    private final Map<Node, Boolean> hostStatusMap = new ConcurrentHashMap<>();

    public Cluster(List<Node> hosts) {
        this.hosts = new ArrayList<>(hosts);
        for (Node host : hosts) {
            hostStatusMap.put(host, true);
        }
    }

    public static Cluster withHosts(Node... hosts) {
        return new Cluster(Arrays.asList(hosts));
    }

    public static Cluster defaultCluster() {
        return withHosts(Node.defaultNode());
    }

    public synchronized Node nextHost() {
        for (Node host : hosts) {
            if (hostStatusMap.get(host)) {
                return host;
            }
        }
        reset();
        throw new TransportException("There are no available hosts", null);
    }

    public synchronized void markDown(Node host) {
        if (hostStatusMap.containsKey(host)) {
            hostStatusMap.put(host, false);
        }
    }

    public synchronized void addHost(Node host) {
        if (!hostStatusMap.containsKey(host)) {
            hosts.add(host);
        }
        hostStatusMap.put(host, true);
    }

    public synchronized List<Node> getHosts() {
        return new ArrayList<>(hosts);
    }

    private void reset() {
        for (Node host : hosts) {
            hostStatusMap.put(host, true);
        }
    }
}
