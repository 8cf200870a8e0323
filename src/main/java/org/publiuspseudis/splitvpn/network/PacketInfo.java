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
package org.publiuspseudis.splitvpn.network;

/**
 * Five-tuple descriptor of a classified datagram. Addresses are IPv4 in {@code int} form; for
 * IPv4-mapped IPv6 traffic they hold the embedded IPv4 address and {@code version} is {@code 6}.
 * Ports are {@code 0} for protocols other than TCP and UDP, or when the transport header is
 * truncated.
 *
 * @param version  IP version of the datagram on the wire (4 or 6)
 * @param protocol IP protocol number (next header for IPv6)
 * @param srcAddr  source address
 * @param srcPort  source port
 * @param dstAddr  destination address
 * @param dstPort  destination port
 */
public record PacketInfo(int version, int protocol, int srcAddr, int srcPort, int dstAddr, int dstPort) {

    public boolean isTcp() {
        return protocol == IPPacket.PROTO_TCP;
    }

    public boolean isUdp() {
        return protocol == IPPacket.PROTO_UDP;
    }

    @Override
    public String toString() {
        return String.format("%s:%d -> %s:%d proto=%d",
            IPPacket.formatIP(srcAddr), srcPort, IPPacket.formatIP(dstAddr), dstPort, protocol);
    }
}
