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

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.publiuspseudis.splitvpn.network.IPPacket;

/**
 * <p>
 * The {@code Tunnel} class holds everything the router knows about one encrypted tunnel: its id,
 * the backend carrying it, its lifecycle state and the configuration the remote end pushed.
 * </p>
 *
 * <p>
 * Readers may call the getters from any thread. All mutation happens through
 * {@link TunnelLifecycle}, which serializes changes per tunnel by locking on the instance. The
 * fields read on the packet path are volatile so a reader sees a consistent recent value
 * without taking the lock.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public final class Tunnel {

    private final String id;
    private final TunnelBackend backend;
    private final long sequence;
    private final long createdAt;

    private volatile TunnelState state = TunnelState.DISCONNECTED;
    private volatile boolean addressAssigned;
    private volatile int assignedAddress;
    private volatile int prefixLength;
    private volatile List<InetAddress> dnsServers = Collections.emptyList();
    private volatile boolean dnsConfigured;
    private final List<String> pushedRoutes = new ArrayList<>();
    private volatile TunnelError lastError;

    Tunnel(String id, TunnelBackend backend, long sequence) {
        this.id = Objects.requireNonNull(id, "id");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.sequence = sequence;
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public TunnelBackend getBackend() {
        return backend;
    }

    /**
     * @return creation order, lower values were created first
     */
    public long getSequence() {
        return sequence;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public TunnelState getState() {
        return state;
    }

    /**
     * @return {@code true} if the tunnel is {@link TunnelState#READY}
     */
    public boolean isReady() {
        return state == TunnelState.READY;
    }

    public boolean hasAssignedAddress() {
        return addressAssigned;
    }

    /**
     * @return the assigned IPv4 address as an int, only meaningful when
     *         {@link #hasAssignedAddress()} is {@code true}
     */
    public int getAssignedAddress() {
        return assignedAddress;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public boolean isDnsConfigured() {
        return dnsConfigured;
    }

    public List<InetAddress> getDnsServers() {
        return dnsServers;
    }

    /**
     * @return the routes pushed for this tunnel, in {@code a.b.c.d/n} form
     */
    public List<String> getPushedRoutes() {
        synchronized (this) {
            return new ArrayList<>(pushedRoutes);
        }
    }

    /**
     * @return the subnet key of the assigned address ({@code network/prefix}), or {@code null}
     *         if no address is assigned
     */
    public String getSubnetKey() {
        if (!addressAssigned) {
            return null;
        }
        return subnetKey(assignedAddress, prefixLength);
    }

    /**
     * @return why the tunnel last dropped, or {@code null} if it never did
     */
    public TunnelError getLastError() {
        return lastError;
    }

    static String subnetKey(int address, int prefixLength) {
        return IPPacket.formatIP(address & IPPacket.prefixMask(prefixLength)) + "/" + prefixLength;
    }

    // Mutators, called by TunnelLifecycle while holding this instance's monitor.

    void setState(TunnelState state) {
        this.state = state;
    }

    void assignAddress(int address, int prefixLength) {
        this.assignedAddress = address;
        this.prefixLength = prefixLength;
        this.addressAssigned = true;
    }

    void configureDns(List<InetAddress> servers) {
        this.dnsServers = List.copyOf(servers);
        this.dnsConfigured = true;
    }

    void addPushedRoute(String route) {
        if (!pushedRoutes.contains(route)) {
            pushedRoutes.add(route);
        }
    }

    void resetSession(TunnelError error) {
        this.addressAssigned = false;
        this.assignedAddress = 0;
        this.prefixLength = 0;
        this.dnsConfigured = false;
        this.dnsServers = Collections.emptyList();
        this.pushedRoutes.clear();
        if (error != null) {
            this.lastError = error;
        }
    }

    @Override
    public String toString() {
        return "Tunnel{" + id + ", " + state
                + (addressAssigned ? ", " + IPPacket.formatIP(assignedAddress) + "/" + prefixLength : "")
                + "}";
    }
}
