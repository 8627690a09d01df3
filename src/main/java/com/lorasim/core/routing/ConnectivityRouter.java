package com.lorasim.core.routing;

import com.lorasim.core.events.EventLog;
import com.lorasim.core.events.SimulationClock;
import com.lorasim.core.events.SimulationEvent;
import com.lorasim.core.metrics.SimulationMetrics;
import com.lorasim.core.model.ConnectivityMatrix;
import com.lorasim.node.NodeHandle;
import com.lorasim.node.NodeProtocol;
import com.lorasim.node.PacketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the directed connectivity matrix and the registry of live nodes, and fans
 * transmitted packets out to every node currently reachable from the sender.
 *
 * <p>The matrix is an immutable snapshot behind an {@link AtomicReference}. An
 * update swaps the whole snapshot; a delivery reads one snapshot and routes against
 * it, so it can never observe a half-applied update. Sends happen outside any
 * router-wide lock, so a node with a full stdin pipe cannot hold up connectivity
 * updates or deliveries from other nodes.
 */
public class ConnectivityRouter implements PacketListener {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityRouter.class);

    private final List<String> nodeNames;
    private final SimulationClock clock;
    private final EventLog eventLog;
    private final StateProbe stateProbe;
    private final SimulationMetrics metrics;

    private final AtomicReference<ConnectivityMatrix> matrix;
    private final Map<String, NodeHandle> nodes = new ConcurrentHashMap<>();

    /**
     * @param nodeNames  every configured node, in matrix order
     * @param stateProbe optional probe run after each forward, may be {@code null}
     * @param metrics    optional metrics, may be {@code null}
     */
    public ConnectivityRouter(List<String> nodeNames, SimulationClock clock, EventLog eventLog,
                              StateProbe stateProbe, SimulationMetrics metrics) {
        this.nodeNames = List.copyOf(nodeNames);
        this.clock = clock;
        this.eventLog = eventLog;
        this.stateProbe = stateProbe;
        this.metrics = metrics;
        this.matrix = new AtomicReference<>(ConnectivityMatrix.disconnected(this.nodeNames));
    }

    /**
     * Adds a live node. It receives forwarded traffic from now on.
     *
     * @throws IllegalArgumentException if the node is not part of the matrix
     */
    public void register(NodeHandle node) {
        if (!nodeNames.contains(node.name())) {
            throw new IllegalArgumentException("Node " + node.name() + " is not in the configured node set");
        }
        nodes.put(node.name(), node);
        log.debug("Registered node {}", node.name());
    }

    public Optional<NodeHandle> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public List<String> nodeNames() {
        return nodeNames;
    }

    /**
     * Replaces the whole matrix from a row-major bitstring of length N*N.
     * Row {@code i} is reachability from node {@code i}.
     *
     * @param bitstring '0'/'1' characters
     * @param timestamp seconds stamped on the {@code connectivity_update} record
     * @return {@code true} when applied; {@code false} when rejected, leaving the matrix unchanged
     */
    public boolean updateConnectivity(String bitstring, double timestamp) {
        ConnectivityMatrix next;
        try {
            next = ConnectivityMatrix.parse(nodeNames, bitstring);
        } catch (IllegalArgumentException e) {
            log.error("Rejected connectivity update at {}s: {}", SimulationEvent.formatSeconds(timestamp), e.getMessage());
            if (metrics != null) {
                metrics.recordConnectivityUpdate(false);
            }
            return false;
        }
        matrix.set(next);
        eventLog.append(SimulationEvent.connectivityUpdate(timestamp, bitstring));
        if (metrics != null) {
            metrics.recordConnectivityUpdate(true);
        }
        return true;
    }

    public ConnectivityMatrix matrix() {
        return matrix.get();
    }

    public boolean reachable(String src, String dst) {
        return matrix.get().reachable(src, dst);
    }

    /**
     * Forwards {@code hexData} from {@code src} to every registered node reachable from it,
     * never back to {@code src}. Destinations that are not running yet are skipped.
     *
     * @return the destinations the payload was sent to, in matrix order
     */
    public List<String> deliver(String src, String hexData) {
        ConnectivityMatrix snapshot = matrix.get();
        var delivered = new ArrayList<String>();
        for (String dst : snapshot.reachableFrom(src)) {
            NodeHandle target = nodes.get(dst);
            if (target == null) {
                log.debug("Skipping forward {} -> {}: node not running", src, dst);
                continue;
            }
            target.send(NodeProtocol.receivePacket(hexData));
            eventLog.append(SimulationEvent.forward(clock.elapsedSeconds(), src, dst, hexData));
            if (metrics != null) {
                metrics.recordForward(src, dst);
            }
            if (stateProbe != null) {
                stateProbe.request(target);
            }
            delivered.add(dst);
        }
        return delivered;
    }

    @Override
    public void onTransmit(String source, String hexData) {
        deliver(source, hexData);
    }
}
