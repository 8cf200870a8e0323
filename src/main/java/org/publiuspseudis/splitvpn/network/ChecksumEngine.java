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
 * <p>
 * The {@code ChecksumEngine} implements the Internet checksum (RFC 1071) used by IPv4 headers and
 * by the TCP (RFC 793) and UDP (RFC 768) pseudo-header checksums.
 * </p>
 *
 * <p>
 * The engine works in two steps, so that several ranges can be combined into one checksum:
 * </p>
 * <ol>
 *   <li>{@link #sum(long, byte[], int, int)} accumulates 16-bit big-endian words into a
 *       {@code long} without folding. A trailing odd byte is padded with a zero low byte.</li>
 *   <li>{@link #finalizeSum(long)} folds the carries back into 16 bits (end-around carry) and
 *       returns the one's complement.</li>
 * </ol>
 *
 * <p>
 * Every method is pure: nothing here writes into a packet. Writing the result back is the
 * caller's job.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public final class ChecksumEngine {

    private ChecksumEngine() {
    }

    /**
     * Adds the 16-bit words of {@code data[offset, offset + length)} to {@code initial}.
     *
     * @param initial running sum
     * @param data    bytes to add
     * @param offset  start of the range
     * @param length  number of bytes in the range
     * @return the new, unfolded running sum
     */
    public static long sum(long initial, byte[] data, int offset, int length) {
        long sum = initial;
        int end = offset + length;
        int i = offset;
        for (; i + 1 < end; i += 2) {
            sum += ((data[i] & 0xFF) << 8) | (data[i + 1] & 0xFF);
        }
        if (i < end) {
            sum += (data[i] & 0xFF) << 8;
        }
        return sum;
    }

    /**
     * Sum of a single range starting from zero.
     *
     * @see #sum(long, byte[], int, int)
     */
    public static long sum(byte[] data, int offset, int length) {
        return sum(0L, data, offset, length);
    }

    /**
     * Folds a running sum into 16 bits using end-around carry.
     *
     * @param sum unfolded running sum
     * @return folded sum in {@code 0..0xFFFF}
     */
    public static int fold(long sum) {
        while ((sum >>> 16) != 0) {
            sum = (sum & 0xFFFF) + (sum >>> 16);
        }
        return (int) sum;
    }

    /**
     * Folds the carries and returns the one's complement, ready to be written into a checksum
     * field.
     *
     * @param sum unfolded running sum
     * @return the 16-bit checksum
     */
    public static int finalizeSum(long sum) {
        return ~fold(sum) & 0xFFFF;
    }

    /**
     * Internet checksum of one byte range.
     *
     * @param data   bytes to checksum
     * @param offset start of the range
     * @param length number of bytes
     * @return the 16-bit checksum
     */
    public static int checksum(byte[] data, int offset, int length) {
        return finalizeSum(sum(data, offset, length));
    }

    /**
     * Returns {@code true} if a range that already contains its checksum field verifies, that is
     * its folded sum is {@code 0xFFFF}.
     *
     * @param data   bytes including the checksum field
     * @param offset start of the range
     * @param length number of bytes
     * @return whether the checksum verifies
     */
    public static boolean verify(byte[] data, int offset, int length) {
        return fold(sum(data, offset, length)) == 0xFFFF;
    }

    /**
     * Partial sum of the IPv4 pseudo-header used by TCP and UDP: source address, destination
     * address, zero byte, protocol and segment length.
     *
     * @param srcAddr       source address
     * @param dstAddr       destination address
     * @param protocol      transport protocol number
     * @param segmentLength length of the transport header plus payload
     * @return unfolded running sum to continue with {@link #sum(long, byte[], int, int)}
     */
    public static long pseudoHeaderChecksum(int srcAddr, int dstAddr, int protocol, int segmentLength) {
        long sum = 0;
        sum += (srcAddr >>> 16) & 0xFFFF;
        sum += srcAddr & 0xFFFF;
        sum += (dstAddr >>> 16) & 0xFFFF;
        sum += dstAddr & 0xFFFF;
        sum += protocol & 0xFF;
        sum += segmentLength & 0xFFFF;
        return sum;
    }

    /**
     * Checksum of a TCP or UDP segment including its pseudo-header. The checksum field inside the
     * segment must already be zero.
     *
     * @param srcAddr  source address
     * @param dstAddr  destination address
     * @param protocol transport protocol number
     * @param data     packet bytes
     * @param offset   start of the transport header
     * @param length   segment length
     * @return the 16-bit checksum
     */
    public static int transportChecksum(int srcAddr, int dstAddr, int protocol,
                                        byte[] data, int offset, int length) {
        long sum = pseudoHeaderChecksum(srcAddr, dstAddr, protocol, length);
        return finalizeSum(sum(sum, data, offset, length));
    }

    /**
     * Checksum of an IPv4 header. The header checksum field must already be zero.
     *
     * @param packet       raw datagram
     * @param headerLength header length in bytes
     * @return the 16-bit checksum
     */
    public static int ipv4HeaderChecksum(byte[] packet, int headerLength) {
        return checksum(packet, 0, headerLength);
    }
}
