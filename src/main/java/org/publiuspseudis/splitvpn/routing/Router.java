/*
 * Copyright (C) 2024 Publius Pseudis
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.publiuspseudis.splitvpn.routing;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.publiuspseudis.splitvpn.core.CaptureEdge;
import org.publiuspseudis.splitvpn.core.RouterConfig;
import org.publiuspseudis.splitvpn.network.IPPacket;
import org.publiuspseudis.splitvpn.network.NATRewriter;
import org.publiuspseudis.splitvpn.network.PacketClassifier;
import org.publiuspseudis.splitvpn.network.PacketInfo;
import org.publiuspseudis.splitvpn.policy.AppRule;
import org.publiuspseudis.splitvpn.policy.IdentityResolver;
import org.publiuspseudis.splitvpn.policy.PolicyStore;
import org.publiuspseudis.splitvpn.policy.RuleIndex;
import org.publiuspseudis.splitvpn.tunnel.PacketQueue;
import org.publiuspseudis.splitvpn.tunnel.ReadinessCoordinator;
import org.publiuspseudis.splitvpn.tunnel.Tunnel;
import org.publiuspseudis.splitvpn.tunnel.TunnelBackend;
import org.publiuspseudis.splitvpn.tunnel.TunnelCallback;
import org.publiuspseudis.splitvpn.tunnel.TunnelError;
import org.publiuspseudis.splitvpn.tunnel.TunnelLifecycle;
import org.publiuspseudis.splitvpn.tunnel.TunnelState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code Router} class decides, for every outbound IP packet read from the capture edge,
 * which tunnel carries it, and moves packets along accordingly. It owns the route table, the
 * connection tracker, the rule index, the tunnel lifecycle, the packet queue and the NAT
 * rewriter, and wires them together.
 * </p>
 *
 * <p>
 * <strong>Decision precedence</strong> (first match wins):
 * </p>
 * <ol>
 *   <li>the destination matches a pushed route;</li>
 *   <li>the source address was seen with exactly one tunnel;</li>
 *   <li>the flow (source address and port) already has a connection entry, possibly direct;</li>
 *   <li>DNS traffic goes to the tunnel of the owning app if that tunnel is ready, else to the
 *       configured default DNS tunnel if it is active, else to the first ready tunnel, else direct;</li>
 *   <li>the owning app has a rule or an identity binding, which is recorded for the flow;</li>
 *   <li>otherwise direct.</li>
 * </ol>
 *
 * <p>
 * A chosen tunnel that is ready gets the packet NAT-rewritten to its address
 * ({@link RoutingDecision.Action#FORWARD}); a tunnel that is not ready gets it queued
 * ({@link RoutingDecision.Action#QUEUE}) and replayed through the whole decision once the tunnel
 * becomes ready. Malformed packets are dropped, packets that are not IPv4 or IPv4-mapped go
 * direct.
 * </p>
 *
 * <p>
 * <strong>Tunnel teardown:</strong> when a tunnel disconnects or closes, its routes, flow entries,
 * identity bindings, address cache rows, queued packets and NAT state are removed before the
 * lifecycle call returns. Nothing is forwarded to it afterwards.
 * </p>
 *
 * <p>
 * <strong>Thread Safety:</strong> every method may be called concurrently. The packet path only
 * touches in-memory tables and never blocks on I/O other than the backend send and the capture
 * edge write.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class Router implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    /**
     * Receives decrypted packets from tunnel backends. The default is to process them on
     * the backend's own thread; an {@link org.publiuspseudis.splitvpn.core.InboundDispatcher}
     * moves them onto per-tunnel executors instead.
     */
    public interface InboundHandler {
        void onInbound(String tunnelId, byte[] packet);
    }

    private final RouterConfig config;
    private final IdentityResolver identityResolver;
    private final RouteTable routeTable;
    private final ConnectionTracker tracker;
    private final RuleIndex ruleIndex;
    private final TunnelLifecycle lifecycle;
    private final PacketQueue packetQueue;
    private final NATRewriter nat;
    private final ReadinessCoordinator readinessCoordinator;
    private final RouterStats stats = new RouterStats();
    private final Map<String, Object> flushLocks = new ConcurrentHashMap<>();

    private volatile CaptureEdge captureEdge;
    private volatile InboundHandler inboundHandler;

    /**
     * Creates a router with its own tables.
     *
     * @param config           tunables
     * @param identityResolver connection owner lookup, {@link IdentityResolver#UNKNOWN} if none
     */
    public Router(RouterConfig config, IdentityResolver identityResolver) {
        this.config = Objects.requireNonNull(config, "config");
        this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver");
        this.routeTable = new RouteTable();
        this.tracker = new ConnectionTracker(config.getConnectionTtlMillis(), config.getMaxConnections(),
                config.getClock());
        this.ruleIndex = new RuleIndex(tracker);
        this.lifecycle = new TunnelLifecycle();
        this.packetQueue = new PacketQueue(config.getMaxQueueSize(), config.getQueueTimeoutMillis(),
                config.getClock());
        this.nat = new NATRewriter();
        this.readinessCoordinator = new ReadinessCoordinator();
        lifecycle.addListener(this::onTunnelStateChanged);
        lifecycle.addListener(readinessCoordinator);
        log.info("Router created with {}", config);
    }

    /**
     * Sets where direct and reply traffic is written.
     *
     * @param captureEdge the capture edge
     */
    public void setCaptureEdge(CaptureEdge captureEdge) {
        this.captureEdge = captureEdge;
    }

    /**
     * Sets who handles decrypted packets; {@code null} processes them on the backend's thread.
     *
     * @param inboundHandler the handler
     */
    public void setInboundHandler(InboundHandler inboundHandler) {
        this.inboundHandler = inboundHandler;
    }

    /**
     * Subscribes the rule index to a policy store.
     *
     * @param store the policy source
     */
    public void usePolicyStore(PolicyStore store) {
        ruleIndex.start(store);
    }

    // ------------------------------------------------------------------------------------------
    // Tunnel management
    // ------------------------------------------------------------------------------------------

    /**
     * Registers a tunnel and starts connecting it.
     *
     * @param tunnelId unique tunnel id
     * @param backend  backend carrying the tunnel
     * @return {@code true} if the backend accepted the connection attempt; otherwise the tunnel
     *         is {@link TunnelState#DISCONNECTED} with its error recorded
     * @throws IllegalStateException if the id is already in use
     */
    public boolean openTunnel(String tunnelId, TunnelBackend backend) {
        lifecycle.create(tunnelId, backend);
        return lifecycle.connect(tunnelId, new BoundCallback(tunnelId));
    }

    /**
     * Starts a new connection attempt for a disconnected tunnel.
     *
     * @param tunnelId tunnel id
     * @return {@code true} if the backend accepted the attempt
     * @throws IllegalArgumentException if the tunnel does not exist
     */
    public boolean reconnectTunnel(String tunnelId) {
        return lifecycle.connect(tunnelId, new BoundCallback(tunnelId));
    }

    /**
     * Closes a tunnel and removes everything that refers to it.
     *
     * @param tunnelId tunnel id
     * @return {@code true} if the tunnel existed
     */
    public boolean closeTunnel(String tunnelId) {
        return lifecycle.close(tunnelId);
    }

    /**
     * Closes every tunnel.
     */
    public void closeAll() {
        for (Tunnel tunnel : lifecycle.getTunnels()) {
            lifecycle.close(tunnel.getId());
        }
    }

    /**
     * @param tunnelId tunnel id
     * @return the tunnel's state, or {@code null} if it does not exist
     */
    public TunnelState getTunnelState(String tunnelId) {
        return lifecycle.getState(tunnelId);
    }

    /**
     * @return ids of all tunnels in creation order
     */
    public List<String> getTunnelIds() {
        List<String> ids = new ArrayList<>();
        for (Tunnel tunnel : lifecycle.getTunnels()) {
            ids.add(tunnel.getId());
        }
        return ids;
    }

    // ------------------------------------------------------------------------------------------
    // Outbound path
    // ------------------------------------------------------------------------------------------

    /**
     * Decides what to do with an outbound packet. Apart from recording flow entries and NAT
     * state, nothing is sent, queued or written.
     *
     * @param packet raw IP bytes, not modified
     * @return the decision, never {@code null}; failures become a {@code DROP}
     */
    public RoutingDecision route(byte[] packet) {
        try {
            return decide(packet);
        } catch (RuntimeException e) {
            log.error("Routing failed, dropping packet", e);
            return RoutingDecision.drop(packet, RoutingDecision.REASON_ERROR);
        }
    }

    /**
     * Routes an outbound packet and acts on the decision: sends it through a tunnel, queues it,
     * writes it back to the capture edge or drops it.
     *
     * @param packet raw IP bytes; ownership passes to the router
     * @return the decision that was acted on
     */
    public RoutingDecision handleOutbound(byte[] packet) {
        RoutingDecision decision = route(packet);
        dispatch(decision);
        return decision;
    }

    /**
     * Acts on a decision made by {@link #route(byte[])}. A forward whose tunnel stopped being
     * ready after the decision is dropped rather than sent.
     *
     * @param decision the decision
     */
    void dispatch(RoutingDecision decision) {
        try {
            switch (decision.getAction()) {
                case FORWARD -> send(decision);
                case QUEUE -> enqueue(decision);
                case DIRECT -> {
                    if (writeToEdge(decision.getPacket())) {
                        stats.direct.incrementAndGet();
                    }
                }
                case DROP -> {
                    if (RoutingDecision.REASON_MALFORMED.equals(decision.getReason())) {
                        stats.droppedMalformed.incrementAndGet();
                    } else {
                        stats.droppedError.incrementAndGet();
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to act on {}", decision, e);
            stats.droppedError.incrementAndGet();
        }
    }

    private RoutingDecision decide(byte[] packet) {
        PacketClassifier.Classification classification = PacketClassifier.classify(packet);
        switch (classification.getOutcome()) {
            case MALFORMED -> {
                log.warn("Dropping malformed packet: {}", classification.getReason());
                return RoutingDecision.drop(packet, RoutingDecision.REASON_MALFORMED);
            }
            case UNSUPPORTED -> {
                return RoutingDecision.direct(packet, RoutingDecision.REASON_UNSUPPORTED);
            }
            default -> {
                // classified
            }
        }
        PacketInfo info = classification.getInfo();

        String tunnelId = routeTable.lookup(info.dstAddr());
        if (tunnelId != null) {
            return toTunnel(tunnelId, packet, info, RoutingDecision.REASON_ROUTE_TABLE);
        }

        tunnelId = tracker.getTunnelForAddress(info.srcAddr());
        if (tunnelId != null) {
            return toTunnel(tunnelId, packet, info, RoutingDecision.REASON_ADDRESS_CACHE);
        }

        ConnectionEntry entry = tracker.lookupConnection(info.srcAddr(), info.srcPort());
        if (entry != null) {
            if (entry.isDirect()) {
                return RoutingDecision.direct(packet, RoutingDecision.REASON_CONNECTION);
            }
            return toTunnel(entry.tunnelId(), packet, info, RoutingDecision.REASON_CONNECTION);
        }

        if (isDns(info)) {
            String dnsTunnel = chooseDnsTunnel(info);
            if (dnsTunnel == null) {
                return RoutingDecision.direct(packet, RoutingDecision.REASON_DNS);
            }
            tracker.registerConnection(info.srcAddr(), info.srcPort(), null, dnsTunnel);
            return toTunnel(dnsTunnel, packet, info, RoutingDecision.REASON_DNS);
        }

        String identity = resolveIdentity(info);
        if (identity != null) {
            AppRule rule = ruleIndex.lookup(identity);
            if (rule != null) {
                tracker.registerConnection(info.srcAddr(), info.srcPort(), identity, rule.tunnelId());
                if (rule.isDirect()) {
                    return RoutingDecision.direct(packet, RoutingDecision.REASON_POLICY);
                }
                return toTunnel(rule.tunnelId(), packet, info, RoutingDecision.REASON_POLICY);
            }
            String bound = tracker.getTunnelForIdentity(identity);
            if (bound != null) {
                tracker.registerConnection(info.srcAddr(), info.srcPort(), identity, bound);
                return toTunnel(bound, packet, info, RoutingDecision.REASON_POLICY);
            }
        }

        return RoutingDecision.direct(packet, RoutingDecision.REASON_NO_MATCH);
    }

    private RoutingDecision toTunnel(String tunnelId, byte[] packet, PacketInfo info, String reason) {
        Tunnel tunnel = lifecycle.getTunnel(tunnelId);
        if (tunnel == null || !tunnel.isReady()) {
            if (log.isDebugEnabled()) {
                log.debug("{} -> {} not ready, queueing ({})", info, tunnelId, reason);
            }
            return RoutingDecision.queue(tunnelId, packet, reason);
        }
        byte[] rewritten = nat.toTunnel(packet, tunnel);
        tracker.setTunnelForAddress(info.dstAddr(), tunnelId);
        if (log.isDebugEnabled()) {
            log.debug("{} -> {} ({})", info, tunnelId, reason);
        }
        return RoutingDecision.forward(tunnelId, rewritten, reason);
    }

    private boolean isDns(PacketInfo info) {
        return (info.isUdp() || info.isTcp()) && info.dstPort() == config.getDnsPort();
    }

    private String chooseDnsTunnel(PacketInfo info) {
        String identity = resolveIdentity(info);
        if (identity != null) {
            String bound = tunnelForIdentity(identity);
            if (bound != null && lifecycle.isReady(bound)) {
                return bound;
            }
        }
        String fallback = config.getDefaultDnsTunnel();
        if (fallback != null) {
            TunnelState state = lifecycle.getState(fallback);
            if (state != null && state.isActive()) {
                return fallback;
            }
        }
        for (Tunnel tunnel : lifecycle.getTunnels()) {
            if (tunnel.isReady()) {
                return tunnel.getId();
            }
        }
        return null;
    }

    private String tunnelForIdentity(String identity) {
        AppRule rule = ruleIndex.lookup(identity);
        if (rule != null) {
            return rule.tunnelId();
        }
        return tracker.getTunnelForIdentity(identity);
    }

    private String resolveIdentity(PacketInfo info) {
        try {
            return identityResolver.resolveOwner(info.srcAddr(), info.srcPort(), info.dstAddr(),
                    info.dstPort(), info.protocol());
        } catch (RuntimeException e) {
            log.debug("Identity lookup failed for {}: {}", info, e.getMessage());
            return null;
        }
    }

    private void send(RoutingDecision decision) {
        Tunnel tunnel = lifecycle.getTunnel(decision.getTunnelId());
        if (tunnel == null || !tunnel.isReady()) {
            stats.droppedTunnelDown.incrementAndGet();
            log.warn("Tunnel {} went down after routing, dropping packet", decision.getTunnelId());
            return;
        }
        boolean sent = false;
        try {
            sent = tunnel.getBackend().send(decision.getPacket());
        } catch (RuntimeException e) {
            log.warn("Backend of tunnel {} failed to send: {}", decision.getTunnelId(), e.getMessage());
        }
        if (sent) {
            stats.forwarded.incrementAndGet();
        } else {
            stats.sendFailures.incrementAndGet();
            log.warn("Tunnel {} did not accept a packet", decision.getTunnelId());
        }
    }

    private void enqueue(RoutingDecision decision) {
        String tunnelId = decision.getTunnelId();
        switch (packetQueue.enqueue(tunnelId, decision.getPacket())) {
            case ACCEPTED -> {
                stats.queued.incrementAndGet();
                // the tunnel may have become ready between the decision and the enqueue
                if (lifecycle.isReady(tunnelId)) {
                    flushQueued(tunnelId);
                }
            }
            case FULL -> stats.queueOverflow.incrementAndGet();
            case CLOSED -> {
                stats.queueRejectedClosed.incrementAndGet();
                log.warn("Tunnel {} is not connecting, dropping packet", tunnelId);
            }
        }
    }

    private void flushQueued(String tunnelId) {
        Object flushLock = flushLocks.computeIfAbsent(tunnelId, id -> new Object());
        synchronized (flushLock) {
            List<byte[]> packets = packetQueue.flush(tunnelId);
            if (!packets.isEmpty()) {
                log.info("Replaying {} queued packets for tunnel {}", packets.size(), tunnelId);
            }
            for (byte[] packet : packets) {
                handleOutbound(packet);
            }
        }
    }

    private boolean writeToEdge(byte[] packet) {
        CaptureEdge edge = captureEdge;
        if (edge == null) {
            log.warn("No capture edge, dropping packet");
            stats.droppedError.incrementAndGet();
            return false;
        }
        try {
            edge.writePacket(packet);
            return true;
        } catch (IOException e) {
            log.warn("Capture edge write failed: {}", e.getMessage());
            stats.droppedError.incrementAndGet();
            return false;
        }
    }

    // ------------------------------------------------------------------------------------------
    // Inbound path
    // ------------------------------------------------------------------------------------------

    /**
     * Handles a decrypted packet from a tunnel: reverses the NAT rewrite and writes the result to
     * the capture edge.
     *
     * @param tunnelId tunnel the packet came from
     * @param packet   raw IP bytes
     * @return {@code true} if the packet was written to the capture edge
     */
    public boolean handleInbound(String tunnelId, byte[] packet) {
        try {
            Tunnel tunnel = lifecycle.getTunnel(tunnelId);
            if (tunnel == null || !tunnel.getState().isActive()) {
                log.warn("Dropping inbound packet from inactive tunnel {}", tunnelId);
                stats.inboundDropped.incrementAndGet();
                return false;
            }
            byte[] restored = nat.fromTunnel(packet, tunnel);
            CaptureEdge edge = captureEdge;
            if (edge == null) {
                log.warn("No capture edge, dropping inbound packet from {}", tunnelId);
                stats.inboundDropped.incrementAndGet();
                return false;
            }
            edge.writePacket(restored);
            stats.inboundDelivered.incrementAndGet();
            return true;
        } catch (IOException e) {
            log.warn("Capture edge write failed for tunnel {}: {}", tunnelId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Inbound processing failed for tunnel {}", tunnelId, e);
        }
        stats.inboundDropped.incrementAndGet();
        return false;
    }

    // ------------------------------------------------------------------------------------------
    // Lifecycle reactions and maintenance
    // ------------------------------------------------------------------------------------------

    private void onTunnelStateChanged(Tunnel tunnel, TunnelState previous, TunnelState current) {
        String id = tunnel.getId();
        switch (current) {
            case CONNECTING -> packetQueue.open(id);
            case CONNECTED -> {
                if (previous == TunnelState.DISCONNECTED) {
                    packetQueue.open(id);
                }
            }
            case READY -> flushQueued(id);
            case DISCONNECTED -> teardown(id, false);
            case CLOSED -> teardown(id, true);
        }
    }

    private void teardown(String tunnelId, boolean closed) {
        int routes = routeTable.removeRoutesForTunnel(tunnelId);
        int flows = tracker.clearForTunnel(tunnelId);
        int discarded = closed ? packetQueue.remove(tunnelId) : packetQueue.seal(tunnelId);
        nat.forgetTunnel(tunnelId);
        if (closed) {
            flushLocks.remove(tunnelId);
        }
        log.info("Tunnel {} torn down: {} routes, {} flows, {} queued packets removed",
                tunnelId, routes, flows, discarded);
    }

    /**
     * Evicts stale flow entries and expired queued packets. Meant to be called periodically.
     */
    public void sweep() {
        int flows = tracker.evictStale();
        int packets = packetQueue.sweepExpired();
        if (flows > 0 || packets > 0) {
            log.debug("Sweep removed {} stale flows and {} expired packets", flows, packets);
        }
    }

    /**
     * @return packet counters plus the statistics of every table
     */
    public Map<String, Object> getStats() {
        Map<String, Object> result = new HashMap<>(stats.toMap(packetQueue.getExpiredCount()));
        result.put("routes", routeTable.size());
        result.put("rules", ruleIndex.size());
        result.put("connections", tracker.getStats());
        result.put("tunnels", lifecycle.getStats());
        result.put("queue", packetQueue.getStats());
        result.put("nat", nat.getStats());
        return result;
    }

    public RouterStats getRouterStats() {
        return stats;
    }

    public RouterConfig getConfig() {
        return config;
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    public ConnectionTracker getConnectionTracker() {
        return tracker;
    }

    public RuleIndex getRuleIndex() {
        return ruleIndex;
    }

    public TunnelLifecycle getLifecycle() {
        return lifecycle;
    }

    public PacketQueue getPacketQueue() {
        return packetQueue;
    }

    public NATRewriter getNatRewriter() {
        return nat;
    }

    public ReadinessCoordinator getReadinessCoordinator() {
        return readinessCoordinator;
    }

    /**
     * Closes every tunnel and stops following the policy store.
     */
    @Override
    public void close() {
        ruleIndex.stop();
        closeAll();
        log.info("Router closed, final stats: {}", stats.toMap(packetQueue.getExpiredCount()));
    }

    /**
     * Callback handed to one tunnel's backend, bound to the tunnel id.
     */
    private final class BoundCallback implements TunnelCallback {
        private final String tunnelId;

        BoundCallback(String tunnelId) {
            this.tunnelId = tunnelId;
        }

        @Override
        public void onConnected() {
            lifecycle.connected(tunnelId);
        }

        @Override
        public void onDisconnected(String reason) {
            lifecycle.disconnected(tunnelId, TunnelError.fromReason(reason, tunnelId));
        }

        @Override
        public void onAddressAssigned(InetAddress address, int prefixLength) {
            if (!(address instanceof Inet4Address) || prefixLength < 0 || prefixLength > 32) {
                log.warn("Tunnel {} reported unusable address {}/{}", tunnelId, address, prefixLength);
                return;
            }
            lifecycle.addressAssigned(tunnelId, IPPacket.toInt(address), prefixLength);
        }

        @Override
        public void onDnsConfigured(List<InetAddress> servers) {
            lifecycle.dnsConfigured(tunnelId, servers);
        }

        @Override
        public void onRoutePushed(InetAddress network, int prefixLength) {
            if (!(network instanceof Inet4Address) || prefixLength < 0 || prefixLength > 32) {
                log.warn("Tunnel {} pushed unusable route {}/{}", tunnelId, network, prefixLength);
                return;
            }
            if (lifecycle.routePushed(tunnelId, IPPacket.toInt(network), prefixLength)) {
                routeTable.addRoute(network, prefixLength, tunnelId);
                TunnelState state = lifecycle.getState(tunnelId);
                if (state == null || !state.isActive()) {
                    // torn down while the route was being installed
                    routeTable.removeRoutesForTunnel(tunnelId);
                }
            }
        }

        @Override
        public void onReceive(byte[] packet) {
            InboundHandler handler = inboundHandler;
            if (handler != null) {
                handler.onInbound(tunnelId, packet);
            } else {
                handleInbound(tunnelId, packet);
            }
        }
    }
}
