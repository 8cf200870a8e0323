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
package org.publiuspseudis.splitvpn.tunnel;

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.publiuspseudis.splitvpn.network.IPPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code TunnelLifecycle} class owns every {@link Tunnel} and drives it through the
 * {@link TunnelState} machine in response to backend events.
 * </p>
 *
 * <p>
 * <strong>Key Functionalities:</strong>
 * </p>
 * <ul>
 *   <li><strong>State Machine:</strong> {@code DISCONNECTED -> CONNECTING -> CONNECTED -> READY},
 *       any active state back to {@code DISCONNECTED} on failure, and {@code CLOSED} on explicit
 *       close. A tunnel becomes {@code READY} once it is connected and both an address and a DNS
 *       configuration have been reported, in whatever order they arrive.</li>
 *   <li><strong>Session Reset:</strong> a disconnect clears the address, DNS servers and pushed
 *       routes, and records a classified {@link TunnelError}.</li>
 *   <li><strong>Subnet Ownership:</strong> when several tunnels are assigned addresses in the same
 *       subnet, the first one to claim it is primary. When the primary goes away the next
 *       claimer is promoted.</li>
 *   <li><strong>Listeners:</strong> every state change is reported to registered
 *       {@link Listener}s.</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> transitions of one tunnel are serialized on the tunnel instance.
 * Listeners are invoked synchronously on the thread that caused the transition, after the lock is
 * released, so a listener may call back into the lifecycle.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class TunnelLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TunnelLifecycle.class);

    /**
     * Receives tunnel state changes.
     */
    public interface Listener {
        /**
         * Called after a tunnel changed state.
         *
         * @param tunnel   the tunnel, already in {@code current}
         * @param previous state before the change
         * @param current  state after the change
         */
        void onStateChanged(Tunnel tunnel, TunnelState previous, TunnelState current);
    }

    private final Map<String, Tunnel> tunnels = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Claimers per subnet key in claim order; the first entry is the primary. Guarded by itself.
     */
    private final Map<String, List<String>> subnetClaims = new LinkedHashMap<>();

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a new tunnel in {@link TunnelState#DISCONNECTED}.
     *
     * @param id      unique tunnel id
     * @param backend backend carrying the tunnel
     * @return the new tunnel
     * @throws IllegalArgumentException if the id is blank
     * @throws IllegalStateException    if a tunnel with this id already exists
     */
    public Tunnel create(String id, TunnelBackend backend) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(backend, "backend");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Tunnel id must not be blank");
        }
        Tunnel tunnel = new Tunnel(id, backend, sequence.getAndIncrement());
        if (tunnels.putIfAbsent(id, tunnel) != null) {
            throw new IllegalStateException("Tunnel already exists: " + id);
        }
        log.info("Tunnel {} created", id);
        return tunnel;
    }

    /**
     * Starts connecting a tunnel. The tunnel moves to {@link TunnelState#CONNECTING} before the
     * backend is called, so reports made synchronously from inside {@code connect} are kept. If
     * the backend fails to start, the tunnel drops back to {@link TunnelState#DISCONNECTED}.
     *
     * @param id       tunnel id
     * @param callback callback handed to the backend
     * @return {@code true} if the backend accepted the connection attempt
     */
    public boolean connect(String id, TunnelCallback callback) {
        Tunnel tunnel = require(id);
        TunnelState previous;
        synchronized (tunnel) {
            previous = tunnel.getState();
            if (previous != TunnelState.DISCONNECTED) {
                log.debug("Tunnel {} is {}, not starting another connection", id, previous);
                return previous.isActive();
            }
            tunnel.setState(TunnelState.CONNECTING);
        }
        fire(tunnel, previous, TunnelState.CONNECTING);

        try {
            tunnel.getBackend().connect(callback);
            return true;
        } catch (IOException e) {
            log.warn("Tunnel {} failed to start connecting: {}", id, e.getMessage());
            disconnected(id, TunnelError.fromException(e, id));
            return false;
        }
    }

    /**
     * The backend reports an established session.
     *
     * @param id tunnel id
     */
    public void connected(String id) {
        Tunnel tunnel = find(id, "connected");
        if (tunnel == null) {
            return;
        }
        TunnelState previous;
        TunnelState next;
        synchronized (tunnel) {
            previous = tunnel.getState();
            if (previous != TunnelState.CONNECTING && previous != TunnelState.DISCONNECTED) {
                return;
            }
            tunnel.setState(TunnelState.CONNECTED);
            next = promoteIfReady(tunnel);
        }
        fire(tunnel, previous, next);
    }

    /**
     * The backend reports an assigned address.
     *
     * @param id           tunnel id
     * @param address      IPv4 address as an int
     * @param prefixLength prefix length, 0 to 32
     */
    public void addressAssigned(String id, int address, int prefixLength) {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("Invalid prefix length: " + prefixLength);
        }
        Tunnel tunnel = find(id, "address");
        if (tunnel == null) {
            return;
        }
        TunnelState previous;
        TunnelState next;
        String oldSubnet;
        String newSubnet;
        synchronized (tunnel) {
            previous = tunnel.getState();
            if (!previous.isActive()) {
                log.warn("Ignoring address for tunnel {} in state {}", id, previous);
                return;
            }
            if (tunnel.hasAssignedAddress()
                    && tunnel.getAssignedAddress() == address
                    && tunnel.getPrefixLength() == prefixLength) {
                return;
            }
            oldSubnet = tunnel.getSubnetKey();
            tunnel.assignAddress(address, prefixLength);
            newSubnet = tunnel.getSubnetKey();
            next = promoteIfReady(tunnel);
        }
        log.info("Tunnel {} assigned {}/{}", id, IPPacket.formatIP(address), prefixLength);
        if (!newSubnet.equals(oldSubnet)) {
            if (oldSubnet != null) {
                releaseSubnet(id, oldSubnet);
            }
            claimSubnet(id, newSubnet);
        }
        fire(tunnel, previous, next);
    }

    /**
     * The backend reports DNS servers.
     *
     * @param id      tunnel id
     * @param servers server addresses, may be empty
     */
    public void dnsConfigured(String id, List<InetAddress> servers) {
        Tunnel tunnel = find(id, "dns");
        if (tunnel == null) {
            return;
        }
        TunnelState previous;
        TunnelState next;
        synchronized (tunnel) {
            previous = tunnel.getState();
            if (!previous.isActive()) {
                log.warn("Ignoring DNS configuration for tunnel {} in state {}", id, previous);
                return;
            }
            tunnel.configureDns(servers == null ? List.of() : servers);
            next = promoteIfReady(tunnel);
        }
        log.debug("Tunnel {} DNS servers {}", id, servers);
        fire(tunnel, previous, next);
    }

    /**
     * Records a route pushed by the remote end on the tunnel. Installing it into the route table
     * is the router's job.
     *
     * @param id           tunnel id
     * @param network      network address
     * @param prefixLength prefix length
     * @return {@code true} if the tunnel is active and the route was recorded
     */
    public boolean routePushed(String id, int network, int prefixLength) {
        Tunnel tunnel = find(id, "route");
        if (tunnel == null) {
            return false;
        }
        synchronized (tunnel) {
            if (!tunnel.getState().isActive()) {
                log.warn("Ignoring pushed route for tunnel {} in state {}", id, tunnel.getState());
                return false;
            }
            tunnel.addPushedRoute(IPPacket.formatIP(network & IPPacket.prefixMask(prefixLength))
                    + "/" + prefixLength);
        }
        return true;
    }

    /**
     * The backend reports that the session dropped.
     *
     * @param id    tunnel id
     * @param error classified reason, may be {@code null}
     */
    public void disconnected(String id, TunnelError error) {
        Tunnel tunnel = find(id, "disconnect");
        if (tunnel == null) {
            return;
        }
        TunnelState previous;
        String subnet;
        synchronized (tunnel) {
            previous = tunnel.getState();
            if (previous == TunnelState.CLOSED) {
                return;
            }
            subnet = tunnel.getSubnetKey();
            tunnel.resetSession(error);
            tunnel.setState(TunnelState.DISCONNECTED);
        }
        if (subnet != null) {
            releaseSubnet(id, subnet);
        }
        if (previous != TunnelState.DISCONNECTED) {
            log.info("Tunnel {} disconnected: {}", id, error != null ? error.getMessage() : "no reason");
        }
        fire(tunnel, previous, TunnelState.DISCONNECTED);
    }

    /**
     * Closes a tunnel for good: it moves to {@link TunnelState#CLOSED}, is removed from the
     * lifecycle and its backend is told to disconnect.
     *
     * @param id tunnel id
     * @return {@code true} if the tunnel existed
     */
    public boolean close(String id) {
        Tunnel tunnel = tunnels.get(id);
        if (tunnel == null) {
            return false;
        }
        TunnelState previous;
        String subnet;
        synchronized (tunnel) {
            previous = tunnel.getState();
            if (previous == TunnelState.CLOSED) {
                return false;
            }
            subnet = tunnel.getSubnetKey();
            tunnel.resetSession(null);
            tunnel.setState(TunnelState.CLOSED);
            tunnels.remove(id, tunnel);
        }
        if (subnet != null) {
            releaseSubnet(id, subnet);
        }
        try {
            tunnel.getBackend().disconnect();
        } catch (RuntimeException e) {
            log.warn("Backend of tunnel {} failed to disconnect cleanly: {}", id, e.getMessage());
        }
        log.info("Tunnel {} closed", id);
        fire(tunnel, previous, TunnelState.CLOSED);
        return true;
    }

    public Tunnel getTunnel(String id) {
        return id == null ? null : tunnels.get(id);
    }

    /**
     * @param id tunnel id
     * @return the tunnel's state, or {@code null} if it does not exist
     */
    public TunnelState getState(String id) {
        Tunnel tunnel = getTunnel(id);
        return tunnel == null ? null : tunnel.getState();
    }

    public boolean isReady(String id) {
        Tunnel tunnel = getTunnel(id);
        return tunnel != null && tunnel.isReady();
    }

    /**
     * @return all tunnels in creation order
     */
    public List<Tunnel> getTunnels() {
        List<Tunnel> result = new ArrayList<>(tunnels.values());
        result.sort(Comparator.comparingLong(Tunnel::getSequence));
        return result;
    }

    /**
     * @param id tunnel id
     * @return {@code true} if the tunnel has an address and is the first claimer of its subnet
     */
    public boolean isPrimary(String id) {
        Tunnel tunnel = getTunnel(id);
        if (tunnel == null) {
            return false;
        }
        String subnet = tunnel.getSubnetKey();
        return subnet != null && id.equals(getPrimaryForSubnet(subnet));
    }

    /**
     * @param subnetKey subnet in {@code a.b.c.d/n} form with host bits cleared
     * @return the primary tunnel id for the subnet, or {@code null} if nobody claims it
     */
    public String getPrimaryForSubnet(String subnetKey) {
        synchronized (subnetClaims) {
            List<String> claimers = subnetClaims.get(subnetKey);
            return claimers == null || claimers.isEmpty() ? null : claimers.get(0);
        }
    }

    /**
     * @return tunnel counts by state plus subnet ownership
     */
    public Map<String, Object> getStats() {
        Map<TunnelState, Integer> byState = new EnumMap<>(TunnelState.class);
        for (Tunnel tunnel : tunnels.values()) {
            byState.merge(tunnel.getState(), 1, Integer::sum);
        }
        Map<String, Object> stats = new HashMap<>();
        stats.put("tunnelCount", tunnels.size());
        stats.put("byState", byState);
        synchronized (subnetClaims) {
            Map<String, String> primaries = new LinkedHashMap<>();
            subnetClaims.forEach((subnet, claimers) -> primaries.put(subnet, claimers.get(0)));
            stats.put("subnetPrimaries", primaries);
        }
        return stats;
    }

    private TunnelState promoteIfReady(Tunnel tunnel) {
        if (tunnel.getState() == TunnelState.CONNECTED
                && tunnel.hasAssignedAddress()
                && tunnel.isDnsConfigured()) {
            tunnel.setState(TunnelState.READY);
        }
        return tunnel.getState();
    }

    private void claimSubnet(String id, String subnet) {
        synchronized (subnetClaims) {
            List<String> claimers = subnetClaims.computeIfAbsent(subnet, k -> new ArrayList<>());
            if (!claimers.contains(id)) {
                claimers.add(id);
            }
            if (claimers.size() > 1) {
                log.info("Tunnel {} shares subnet {} with primary {}", id, subnet, claimers.get(0));
            }
        }
    }

    private void releaseSubnet(String id, String subnet) {
        synchronized (subnetClaims) {
            List<String> claimers = subnetClaims.get(subnet);
            if (claimers == null) {
                return;
            }
            boolean wasPrimary = !claimers.isEmpty() && claimers.get(0).equals(id);
            claimers.remove(id);
            if (claimers.isEmpty()) {
                subnetClaims.remove(subnet);
            } else if (wasPrimary) {
                log.info("Tunnel {} promoted to primary for subnet {}", claimers.get(0), subnet);
            }
        }
    }

    private Tunnel require(String id) {
        Tunnel tunnel = getTunnel(id);
        if (tunnel == null) {
            throw new IllegalArgumentException("Unknown tunnel: " + id);
        }
        return tunnel;
    }

    private Tunnel find(String id, String event) {
        Tunnel tunnel = getTunnel(id);
        if (tunnel == null) {
            log.warn("Ignoring {} event for unknown tunnel {}", event, id);
        }
        return tunnel;
    }

    private void fire(Tunnel tunnel, TunnelState previous, TunnelState current) {
        if (previous == current) {
            return;
        }
        log.info("Tunnel {}: {} -> {}", tunnel.getId(), previous, current);
        for (Listener listener : listeners) {
            try {
                listener.onStateChanged(tunnel, previous, current);
            } catch (RuntimeException e) {
                log.error("Tunnel listener failed on {} -> {} for {}", previous, current, tunnel.getId(), e);
            }
        }
    }
}
