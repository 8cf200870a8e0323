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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.publiuspseudis.splitvpn.tunnel.Tunnel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code NATRewriter} class performs the source address translation that makes a packet
 * captured on the device valid on a tunnel's assigned network, and the reverse translation for
 * traffic coming back from that tunnel.
 * </p>
 *
 * <p>
 * <strong>Egress</strong> ({@link #toTunnel(byte[], Tunnel)}): the IPv4 source address is replaced
 * by the tunnel's assigned address, the header checksum is recomputed and, for TCP and UDP, the
 * transport checksum is recomputed over the new pseudo-header. The original source is remembered
 * per tunnel (last value wins).
 * </p>
 *
 * <p>
 * <strong>Ingress</strong> ({@link #fromTunnel(byte[], Tunnel)}): a reply addressed to the tunnel
 * address gets the remembered original address written into its destination field, with both
 * checksums recomputed the same way. A packet that still carries the tunnel address as its
 * source (an egress packet handed back unchanged) gets its source restored instead.
 * </p>
 *
 * <p>
 * <strong>Buffer contract:</strong> the input array is never modified. When a rewrite happens the
 * method returns a fresh copy; when nothing needs to change it returns the very same instance.
 * </p>
 *
 * <p>
 * <strong>Malformed input:</strong> a packet whose IPv4 header cannot be parsed is returned
 * untouched. If the header is fine but the transport segment is truncated or its declared length
 * is inconsistent, the address and header checksum are still rewritten while the transport
 * checksum is left as it was. Fragments never have their transport checksum recomputed because
 * the segment is not complete.
 * </p>
 *
 * <p>
 * <strong>Thread Safety:</strong> the remembered original addresses live in a
 * {@link ConcurrentHashMap}; rewriting itself only touches the private copy.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class NATRewriter {
    private static final Logger log = LoggerFactory.getLogger(NATRewriter.class);

    /**
     * Original (pre-rewrite) source address per tunnel id.
     */
    private final Map<String, Integer> originalSources = new ConcurrentHashMap<>();

    /**
     * Constructs a rewriter with no remembered addresses.
     */
    public NATRewriter() {
    }

    /**
     * Rewrites an outbound packet so that it originates from the tunnel's assigned address.
     *
     * @param packet raw datagram read from the capture edge
     * @param tunnel destination tunnel
     * @return the rewritten copy, or {@code packet} itself if no rewrite applies
     */
    public byte[] toTunnel(byte[] packet, Tunnel tunnel) {
        if (tunnel == null || !tunnel.hasAssignedAddress() || !isRewritableIPv4(packet)) {
            return packet;
        }
        int tunnelAddress = tunnel.getAssignedAddress();
        int source = IPPacket.getSourceIP(packet);
        if (source == tunnelAddress) {
            return packet;
        }
        originalSources.put(tunnel.getId(), source);
        if (log.isDebugEnabled()) {
            log.debug("NAT egress on {}: {} -> {}", tunnel.getId(),
                IPPacket.formatIP(source), IPPacket.formatIP(tunnelAddress));
        }
        return rewrite(packet, IPPacket.SRC_IP_OFFSET, tunnelAddress);
    }

    /**
     * Reverses {@link #toTunnel(byte[], Tunnel)} for a packet received from the tunnel.
     *
     * @param packet raw datagram delivered by the tunnel backend
     * @param tunnel the tunnel it arrived on
     * @return the restored copy, or {@code packet} itself if no original address is on record or
     *         the packet does not carry the tunnel address
     */
    public byte[] fromTunnel(byte[] packet, Tunnel tunnel) {
        if (tunnel == null || !tunnel.hasAssignedAddress() || !isRewritableIPv4(packet)) {
            return packet;
        }
        Integer original = originalSources.get(tunnel.getId());
        if (original == null) {
            return packet;
        }
        int tunnelAddress = tunnel.getAssignedAddress();
        if (IPPacket.getDestinationIP(packet) == tunnelAddress) {
            return rewrite(packet, IPPacket.DST_IP_OFFSET, original);
        }
        if (IPPacket.getSourceIP(packet) == tunnelAddress) {
            return rewrite(packet, IPPacket.SRC_IP_OFFSET, original);
        }
        return packet;
    }

    /**
     * Returns the remembered original source address for a tunnel.
     *
     * @param tunnelId the tunnel id
     * @return the address, or {@code null} if none has been recorded
     */
    public Integer getOriginalSource(String tunnelId) {
        return originalSources.get(tunnelId);
    }

    /**
     * Forgets the remembered address of a tunnel. Called on tunnel teardown.
     *
     * @param tunnelId the tunnel id
     */
    public void forgetTunnel(String tunnelId) {
        if (originalSources.remove(tunnelId) != null) {
            log.debug("Forgot NAT state for tunnel {}", tunnelId);
        }
    }

    /**
     * Retrieves the current NAT statistics.
     *
     * @return a {@code Map<String, Object>} with the number of tunnels holding NAT state
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("tunnelsWithNatState", originalSources.size());
        return stats;
    }

    private static boolean isRewritableIPv4(byte[] packet) {
        if (packet == null || packet.length < IPPacket.MIN_HEADER_LENGTH || IPPacket.version(packet) != 4) {
            return false;
        }
        int headerLength = IPPacket.headerLength(packet);
        return headerLength >= IPPacket.MIN_HEADER_LENGTH && headerLength <= packet.length;
    }

    /**
     * Writes {@code address} at {@code addressOffset} in a copy of {@code packet} and recomputes
     * the checksums that cover it.
     */
    private static byte[] rewrite(byte[] packet, int addressOffset, int address) {
        byte[] modified = packet.clone();
        IPPacket.writeInt(modified, addressOffset, address);

        int headerLength = IPPacket.headerLength(modified);
        IPPacket.writeShort(modified, IPPacket.CHECKSUM_OFFSET, 0);
        IPPacket.writeShort(modified, IPPacket.CHECKSUM_OFFSET,
            ChecksumEngine.ipv4HeaderChecksum(modified, headerLength));

        if (IPPacket.isFragment(modified)) {
            return modified;
        }
        switch (IPPacket.protocol(modified)) {
            case IPPacket.PROTO_TCP -> updateTcpChecksum(modified, headerLength);
            case IPPacket.PROTO_UDP -> updateUdpChecksum(modified, headerLength);
            default -> {
                // no pseudo-header
            }
        }
        return modified;
    }

    /**
     * Length of the IP payload that is both declared and actually present, or {@code -1} if the
     * total length field contradicts the buffer.
     */
    private static int availablePayload(byte[] packet, int headerLength) {
        int totalLength = IPPacket.totalLength(packet);
        if (totalLength < headerLength || totalLength > packet.length) {
            return -1;
        }
        return totalLength - headerLength;
    }

    private static void updateTcpChecksum(byte[] packet, int headerLength) {
        int segmentLength = availablePayload(packet, headerLength);
        if (segmentLength < IPPacket.TCP_MIN_HEADER_LENGTH) {
            log.debug("TCP segment truncated ({} bytes), transport checksum left untouched", segmentLength);
            return;
        }
        int checksumOffset = headerLength + IPPacket.TCP_CHECKSUM_OFFSET;
        IPPacket.writeShort(packet, checksumOffset, 0);
        int checksum = ChecksumEngine.transportChecksum(
            IPPacket.getSourceIP(packet), IPPacket.getDestinationIP(packet), IPPacket.PROTO_TCP,
            packet, headerLength, segmentLength);
        IPPacket.writeShort(packet, checksumOffset, checksum);
    }

    private static void updateUdpChecksum(byte[] packet, int headerLength) {
        int available = availablePayload(packet, headerLength);
        if (available < IPPacket.UDP_HEADER_LENGTH) {
            log.debug("UDP header truncated, transport checksum left untouched");
            return;
        }
        int udpLength = IPPacket.readShort(packet, headerLength + IPPacket.UDP_LENGTH_OFFSET);
        if (udpLength < IPPacket.UDP_HEADER_LENGTH || udpLength > available) {
            log.debug("UDP length {} inconsistent with {} available bytes, checksum left untouched",
                udpLength, available);
            return;
        }
        int checksumOffset = headerLength + IPPacket.UDP_CHECKSUM_OFFSET;
        if (IPPacket.readShort(packet, checksumOffset) == 0) {
            // sender disabled the UDP checksum
            return;
        }
        IPPacket.writeShort(packet, checksumOffset, 0);
        int checksum = ChecksumEngine.transportChecksum(
            IPPacket.getSourceIP(packet), IPPacket.getDestinationIP(packet), IPPacket.PROTO_UDP,
            packet, headerLength, udpLength);
        IPPacket.writeShort(packet, checksumOffset, checksum == 0 ? 0xFFFF : checksum);
    }
}
