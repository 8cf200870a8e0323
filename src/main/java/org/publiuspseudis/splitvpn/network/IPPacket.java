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

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * <p>
 * The {@code IPPacket} class collects the IPv4 header layout used throughout the router: field
 * offsets, protocol numbers, and static accessors that read or write header fields directly in a
 * raw datagram.
 * </p>
 *
 * <p>
 * All accessors operate on a plain {@code byte[]} in network byte order and never allocate, so
 * they are safe to call from the packet path. Callers are responsible for bounds checks; the
 * classifier validates lengths before anything else touches a packet.
 * </p>
 *
 * <p>
 * Addresses are carried as {@code int} values (big-endian, the first octet in the high byte),
 * which keeps table keys cheap and comparisons branch-free.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public final class IPPacket {

    /**
     * Offset of the version / IHL byte.
     */
    public static final int VERSION_IHL_OFFSET = 0;

    /**
     * Offset of the Total Length field.
     */
    public static final int TOTAL_LENGTH_OFFSET = 2;

    /**
     * Offset of the Flags / Fragment Offset field.
     */
    public static final int FLAGS_OFFSET = 6;

    /**
     * Offset of the Protocol field.
     */
    public static final int PROTOCOL_OFFSET = 9;

    /**
     * Offset of the Header Checksum field.
     */
    public static final int CHECKSUM_OFFSET = 10;

    /**
     * Offset of the Source Address field.
     */
    public static final int SRC_IP_OFFSET = 12;

    /**
     * Offset of the Destination Address field.
     */
    public static final int DST_IP_OFFSET = 16;

    /**
     * Minimum IPv4 header length in bytes.
     */
    public static final int MIN_HEADER_LENGTH = 20;

    /**
     * Fixed IPv6 header length in bytes.
     */
    public static final int IPV6_HEADER_LENGTH = 40;

    /**
     * Protocol number for ICMP.
     */
    public static final int PROTO_ICMP = 1;

    /**
     * Protocol number for TCP.
     */
    public static final int PROTO_TCP = 6;

    /**
     * Protocol number for UDP.
     */
    public static final int PROTO_UDP = 17;

    /**
     * Offset of the checksum field inside a TCP header.
     */
    public static final int TCP_CHECKSUM_OFFSET = 16;

    /**
     * Offset of the checksum field inside a UDP header.
     */
    public static final int UDP_CHECKSUM_OFFSET = 6;

    /**
     * Offset of the length field inside a UDP header.
     */
    public static final int UDP_LENGTH_OFFSET = 4;

    /**
     * Size of a UDP header.
     */
    public static final int UDP_HEADER_LENGTH = 8;

    /**
     * Size of a TCP header without options.
     */
    public static final int TCP_MIN_HEADER_LENGTH = 20;

    private IPPacket() {
    }

    /**
     * Returns the IP version nibble of the datagram.
     *
     * @param packet raw datagram, at least one byte long
     * @return the version (4 or 6 for well-formed traffic)
     */
    public static int version(byte[] packet) {
        return (packet[VERSION_IHL_OFFSET] & 0xF0) >> 4;
    }

    /**
     * Returns the IPv4 header length in bytes derived from the IHL field.
     *
     * @param packet raw IPv4 datagram
     * @return header length in bytes
     */
    public static int headerLength(byte[] packet) {
        return (packet[VERSION_IHL_OFFSET] & 0x0F) * 4;
    }

    /**
     * Returns the declared IPv4 total length.
     *
     * @param packet raw IPv4 datagram
     * @return total length in bytes as written in the header
     */
    public static int totalLength(byte[] packet) {
        return readShort(packet, TOTAL_LENGTH_OFFSET);
    }

    /**
     * Returns the IPv4 protocol number.
     *
     * @param packet raw IPv4 datagram
     * @return protocol number
     */
    public static int protocol(byte[] packet) {
        return packet[PROTOCOL_OFFSET] & 0xFF;
    }

    /**
     * Returns {@code true} if the datagram is a fragment: either the More Fragments flag is set or
     * the fragment offset is non-zero.
     *
     * @param packet raw IPv4 datagram
     * @return whether the datagram is part of a fragmented packet
     */
    public static boolean isFragment(byte[] packet) {
        int flagsAndOffset = readShort(packet, FLAGS_OFFSET);
        return (flagsAndOffset & 0x2000) != 0 || (flagsAndOffset & 0x1FFF) != 0;
    }

    public static int getSourceIP(byte[] packet) {
        return readInt(packet, SRC_IP_OFFSET);
    }

    public static int getDestinationIP(byte[] packet) {
        return readInt(packet, DST_IP_OFFSET);
    }

    public static void setSourceIP(byte[] packet, int address) {
        writeInt(packet, SRC_IP_OFFSET, address);
    }

    public static void setDestinationIP(byte[] packet, int address) {
        writeInt(packet, DST_IP_OFFSET, address);
    }

    /**
     * Reads an unsigned 16-bit big-endian value.
     *
     * @param data   source bytes
     * @param offset offset of the high byte
     * @return value in {@code 0..65535}
     */
    public static int readShort(byte[] data, int offset) {
        return ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF);
    }

    /**
     * Writes a 16-bit big-endian value.
     *
     * @param data   target bytes
     * @param offset offset of the high byte
     * @param value  value to write; only the low 16 bits are used
     */
    public static void writeShort(byte[] data, int offset, int value) {
        data[offset] = (byte) ((value >> 8) & 0xFF);
        data[offset + 1] = (byte) (value & 0xFF);
    }

    /**
     * Reads a 32-bit big-endian value.
     *
     * @param data   source bytes
     * @param offset offset of the first octet
     * @return the value
     */
    public static int readInt(byte[] data, int offset) {
        return ((data[offset] & 0xFF) << 24)
            | ((data[offset + 1] & 0xFF) << 16)
            | ((data[offset + 2] & 0xFF) << 8)
            | (data[offset + 3] & 0xFF);
    }

    /**
     * Writes a 32-bit big-endian value.
     *
     * @param data   target bytes
     * @param offset offset of the first octet
     * @param value  the value
     */
    public static void writeInt(byte[] data, int offset, int value) {
        data[offset] = (byte) ((value >> 24) & 0xFF);
        data[offset + 1] = (byte) ((value >> 16) & 0xFF);
        data[offset + 2] = (byte) ((value >> 8) & 0xFF);
        data[offset + 3] = (byte) (value & 0xFF);
    }

    /**
     * Formats an IP address from its integer representation to the standard dotted-decimal notation.
     *
     * @param ip An integer representing the IP address.
     * @return A {@code String} in the format "x.x.x.x" representing the IP address.
     */
    public static String formatIP(int ip) {
        return String.format("%d.%d.%d.%d",
            (ip >> 24) & 0xFF,
            (ip >> 16) & 0xFF,
            (ip >> 8) & 0xFF,
            ip & 0xFF);
    }

    /**
     * Parses a dotted-decimal IPv4 literal into its integer form. No name resolution is performed.
     *
     * @param ip the literal, for example {@code "10.5.0.2"}
     * @return the address as an {@code int}
     * @throws IllegalArgumentException if the literal is not a valid dotted quad
     */
    public static int parseIP(String ip) {
        if (ip == null) {
            throw new IllegalArgumentException("IPv4 literal is null");
        }
        String[] parts = ip.trim().split("\\.");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 literal: " + ip);
        }
        int value = 0;
        for (String part : parts) {
            int octet;
            try {
                octet = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an IPv4 literal: " + ip, e);
            }
            if (octet < 0 || octet > 255) {
                throw new IllegalArgumentException("Octet out of range in " + ip);
            }
            value = (value << 8) | octet;
        }
        return value;
    }

    /**
     * Converts an {@link InetAddress} to its integer form.
     *
     * @param address an IPv4 address
     * @return the address as an {@code int}
     * @throws IllegalArgumentException if {@code address} is not IPv4
     */
    public static int toInt(InetAddress address) {
        if (!(address instanceof Inet4Address)) {
            throw new IllegalArgumentException("Not an IPv4 address: " + address);
        }
        return readInt(address.getAddress(), 0);
    }

    /**
     * Converts an integer address to an {@link Inet4Address}.
     *
     * @param ip the address as an {@code int}
     * @return the corresponding {@link InetAddress}
     */
    public static InetAddress toInetAddress(int ip) {
        byte[] raw = new byte[4];
        writeInt(raw, 0, ip);
        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException e) {
            // getByAddress only throws for illegal lengths
            throw new IllegalStateException(e);
        }
    }

    /**
     * Returns the network mask for a prefix length.
     *
     * @param prefixLength prefix length in {@code 0..32}
     * @return the mask, {@code 0} for a zero-length prefix
     */
    public static int prefixMask(int prefixLength) {
        return prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
    }
}
