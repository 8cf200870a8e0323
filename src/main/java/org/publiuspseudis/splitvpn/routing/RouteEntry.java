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

import java.util.Objects;
import org.publiuspseudis.splitvpn.network.IPPacket;

/**
 * <p>
 * The {@code RouteEntry} class is one destination route: an IPv4 network with a prefix length and
 * the tunnel that carries it. The network is stored with its host bits cleared.
 * </p>
 *
 * <p>
 * Entries are immutable. {@link #getSequence()} records insertion order so that among equally
 * specific routes the most recently added one can win.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public final class RouteEntry {

    private final int network;
    private final int prefixLength;
    private final String tunnelId;
    private final long sequence;

    RouteEntry(int network, int prefixLength, String tunnelId, long sequence) {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("Invalid prefix length: " + prefixLength);
        }
        this.prefixLength = prefixLength;
        this.network = network & IPPacket.prefixMask(prefixLength);
        this.tunnelId = Objects.requireNonNull(tunnelId, "tunnelId");
        this.sequence = sequence;
    }

    /**
     * @param address IPv4 address as an int
     * @return {@code true} if the address falls inside this route's network
     */
    public boolean matches(int address) {
        return (address & IPPacket.prefixMask(prefixLength)) == network;
    }

    /**
     * @param otherNetwork network address
     * @param otherPrefix  prefix length
     * @param otherTunnel  tunnel id
     * @return {@code true} if both describe the same network and tunnel
     */
    public boolean sameRoute(int otherNetwork, int otherPrefix, String otherTunnel) {
        return prefixLength == otherPrefix
                && network == (otherNetwork & IPPacket.prefixMask(otherPrefix))
                && tunnelId.equals(otherTunnel);
    }

    public int getNetwork() {
        return network;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public String getTunnelId() {
        return tunnelId;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * @return the route in {@code a.b.c.d/n} form
     */
    public String getCidr() {
        return IPPacket.formatIP(network) + "/" + prefixLength;
    }

    @Override
    public String toString() {
        return getCidr() + " -> " + tunnelId;
    }
}
