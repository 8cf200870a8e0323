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

import org.publiuspseudis.splitvpn.network.IPPacket;

/**
 * The routing outcome remembered for one flow, keyed by source address and port.
 *
 * @param srcAddr   source IPv4 address as an int
 * @param srcPort   source port
 * @param identity  owning app identity, {@code null} when the flow was routed without one (DNS)
 * @param tunnelId  tunnel carrying the flow, {@code null} for a flow known to go direct
 * @param createdAt creation time in milliseconds
 *
 * @author
 * Publius Pseudis
 */
public record ConnectionEntry(int srcAddr, int srcPort, String identity, String tunnelId, long createdAt) {

    /**
     * @return {@code true} if the flow bypasses every tunnel
     */
    public boolean isDirect() {
        return tunnelId == null;
    }

    /**
     * @param now current time in milliseconds
     * @param ttl time to live in milliseconds
     * @return {@code true} once the entry is older than {@code ttl}
     */
    public boolean isExpired(long now, long ttl) {
        return now - createdAt > ttl;
    }

    @Override
    public String toString() {
        return IPPacket.formatIP(srcAddr) + ":" + srcPort + " [" + identity + "] -> "
                + (tunnelId == null ? "direct" : tunnelId);
    }
}
