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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code PacketClassifier} turns a raw datagram read from the capture edge into a
 * {@link PacketInfo} five-tuple, or reports why it could not.
 * </p>
 *
 * <p>
 * Supported input:
 * </p>
 * <ul>
 *   <li>IPv4 datagrams of at least 20 bytes with a sane IHL.</li>
 *   <li>IPv6 datagrams of at least 40 bytes whose source and destination are both IPv4-mapped
 *       ({@code ::ffff:a.b.c.d}). Other IPv6 traffic is {@link Outcome#UNSUPPORTED}.</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> the classifier holds no state; {@link #classify(byte[])} may be
 * called concurrently from any number of packet streams.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public final class PacketClassifier {
    private static final Logger log = LoggerFactory.getLogger(PacketClassifier.class);

    /**
     * Result category of a classification attempt.
     */
    public enum Outcome {
        /** A five-tuple was extracted. */
        CLASSIFIED,
        /** The bytes are not a usable IP datagram; the caller drops it. */
        MALFORMED,
        /** Well-formed but outside what the router handles; the caller forwards it directly. */
        UNSUPPORTED
    }

    /**
     * Outcome of {@link #classify(byte[])}: either a descriptor or a failure category with a
     * short reason.
     */
    public static final class Classification {
        private final Outcome outcome;
        private final PacketInfo info;
        private final String reason;

        private Classification(Outcome outcome, PacketInfo info, String reason) {
            this.outcome = outcome;
            this.info = info;
            this.reason = reason;
        }

        static Classification of(PacketInfo info) {
            return new Classification(Outcome.CLASSIFIED, info, null);
        }

        static Classification malformed(String reason) {
            return new Classification(Outcome.MALFORMED, null, reason);
        }

        static Classification unsupported(String reason) {
            return new Classification(Outcome.UNSUPPORTED, null, reason);
        }

        public Outcome getOutcome() {
            return outcome;
        }

        public boolean isClassified() {
            return outcome == Outcome.CLASSIFIED;
        }

        /**
         * @return the descriptor, or {@code null} unless {@link #isClassified()}
         */
        public PacketInfo getInfo() {
            return info;
        }

        /**
         * @return why classification failed, or {@code null} on success
         */
        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return isClassified() ? "Classification[" + info + "]" : "Classification[" + outcome + ": " + reason + "]";
        }
    }

    private PacketClassifier() {
    }

    /**
     * Classifies one datagram.
     *
     * @param packet raw IP bytes; never modified
     * @return the classification, never {@code null}
     */
    public static Classification classify(byte[] packet) {
        if (packet == null || packet.length == 0) {
            return Classification.malformed("empty packet");
        }
        int version = IPPacket.version(packet);
        return switch (version) {
            case 4 -> classifyIPv4(packet);
            case 6 -> classifyIPv6(packet);
            default -> Classification.malformed("unknown IP version " + version);
        };
    }

    private static Classification classifyIPv4(byte[] packet) {
        if (packet.length < IPPacket.MIN_HEADER_LENGTH) {
            return Classification.malformed("IPv4 packet too small: " + packet.length + " bytes");
        }
        int headerLength = IPPacket.headerLength(packet);
        if (headerLength < IPPacket.MIN_HEADER_LENGTH || headerLength > packet.length) {
            return Classification.malformed("invalid IPv4 header length " + headerLength);
        }
        int protocol = IPPacket.protocol(packet);
        int srcPort = 0;
        int dstPort = 0;
        if (hasPorts(protocol) && packet.length >= headerLength + 4) {
            srcPort = IPPacket.readShort(packet, headerLength);
            dstPort = IPPacket.readShort(packet, headerLength + 2);
        }
        return Classification.of(new PacketInfo(4, protocol,
            IPPacket.getSourceIP(packet), srcPort, IPPacket.getDestinationIP(packet), dstPort));
    }

    private static Classification classifyIPv6(byte[] packet) {
        if (packet.length < IPPacket.IPV6_HEADER_LENGTH) {
            return Classification.malformed("IPv6 packet too small: " + packet.length + " bytes");
        }
        if (!isIPv4Mapped(packet, 8) || !isIPv4Mapped(packet, 24)) {
            if (log.isDebugEnabled()) {
                log.debug("IPv6 packet is not IPv4-mapped, leaving it unrouted");
            }
            return Classification.unsupported("native IPv6");
        }
        int protocol = packet[6] & 0xFF;
        int srcPort = 0;
        int dstPort = 0;
        int headerLength = IPPacket.IPV6_HEADER_LENGTH;
        if (hasPorts(protocol) && packet.length >= headerLength + 4) {
            srcPort = IPPacket.readShort(packet, headerLength);
            dstPort = IPPacket.readShort(packet, headerLength + 2);
        }
        return Classification.of(new PacketInfo(6, protocol,
            IPPacket.readInt(packet, 20), srcPort, IPPacket.readInt(packet, 36), dstPort));
    }

    /**
     * Checks for the {@code ::ffff:0:0/96} prefix of a 16-byte address.
     */
    private static boolean isIPv4Mapped(byte[] packet, int offset) {
        for (int i = 0; i < 10; i++) {
            if (packet[offset + i] != 0) {
                return false;
            }
        }
        return (packet[offset + 10] & 0xFF) == 0xFF && (packet[offset + 11] & 0xFF) == 0xFF;
    }

    private static boolean hasPorts(int protocol) {
        return protocol == IPPacket.PROTO_TCP || protocol == IPPacket.PROTO_UDP;
    }
}
