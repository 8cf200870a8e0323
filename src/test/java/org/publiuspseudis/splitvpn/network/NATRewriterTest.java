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

import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.publiuspseudis.splitvpn.TestPackets;
import org.publiuspseudis.splitvpn.tunnel.Tunnel;
import org.publiuspseudis.splitvpn.tunnel.TunnelBackend;
import org.publiuspseudis.splitvpn.tunnel.TunnelCallback;
import org.publiuspseudis.splitvpn.tunnel.TunnelLifecycle;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class NATRewriterTest {

    private TunnelLifecycle lifecycle;
    private NATRewriter nat;
    private Tunnel uk;

    @BeforeEach
    void setUp() {
        lifecycle = new TunnelLifecycle();
        nat = new NATRewriter();
        uk = tunnel("uk", "10.5.0.2", 16);
    }

    private Tunnel tunnel(String id, String address, int prefix) {
        lifecycle.create(id, mock(TunnelBackend.class));
        lifecycle.connect(id, mock(TunnelCallback.class));
        if (address != null) {
            lifecycle.addressAssigned(id, TestPackets.ip(address), prefix);
        }
        return lifecycle.getTunnel(id);
    }

    @Test
    void rewritesTcpSourceWithValidChecksums() {
        byte[] packet = TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "GET / HTTP/1.1");
        byte[] original = packet.clone();

        byte[] rewritten = nat.toTunnel(packet, uk);

        assertNotSame(packet, rewritten);
        assertArrayEquals(original, packet);
        assertEquals(TestPackets.ip("10.5.0.2"), IPPacket.getSourceIP(rewritten));
        assertEquals(TestPackets.ip("1.2.3.4"), IPPacket.getDestinationIP(rewritten));
        assertTrue(TestPackets.checksumsValid(rewritten));
        assertEquals(TestPackets.ip("10.0.0.5"), nat.getOriginalSource("uk"));
    }

    @Test
    void rewritesUdpSourceWithValidChecksums() {
        byte[] rewritten = nat.toTunnel(TestPackets.udp("10.0.0.5", 5000, "8.8.8.8", 53, "query"), uk);

        assertEquals(TestPackets.ip("10.5.0.2"), IPPacket.getSourceIP(rewritten));
        assertTrue(TestPackets.checksumsValid(rewritten));
    }

    @Test
    void rewritingTwiceIsANoOp() {
        byte[] once = nat.toTunnel(TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "x"), uk);

        assertSame(once, nat.toTunnel(once, uk));
    }

    @Test
    void roundTripRestoresTcpPacketExactly() {
        byte[] packet = TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "payload");

        byte[] restored = nat.fromTunnel(nat.toTunnel(packet, uk), uk);

        assertArrayEquals(packet, restored);
    }

    @Test
    void roundTripRestoresUdpPacketExactly() {
        byte[] packet = TestPackets.udp("10.0.0.5", 5000, "8.8.8.8", 53, "odd-length");

        byte[] restored = nat.fromTunnel(nat.toTunnel(packet, uk), uk);

        assertArrayEquals(packet, restored);
    }

    @Test
    void replyGetsOriginalAddressAsDestination() {
        nat.toTunnel(TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "req"), uk);
        byte[] reply = TestPackets.tcp("1.2.3.4", 443, "10.5.0.2", 40000, "resp");

        byte[] restored = nat.fromTunnel(reply, uk);

        assertEquals(TestPackets.ip("10.0.0.5"), IPPacket.getDestinationIP(restored));
        assertEquals(TestPackets.ip("1.2.3.4"), IPPacket.getSourceIP(restored));
        assertTrue(TestPackets.checksumsValid(restored));
    }

    @Test
    void tunnelWithoutAddressLeavesPacketAlone() {
        Tunnel pending = tunnel("fr", null, 0);
        byte[] packet = TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "x");

        assertSame(packet, nat.toTunnel(packet, pending));
        assertNull(nat.getOriginalSource("fr"));
    }

    @Test
    void fromTunnelWithoutRecordIsANoOp() {
        byte[] reply = TestPackets.tcp("1.2.3.4", 443, "10.5.0.2", 40000, "resp");

        assertSame(reply, nat.fromTunnel(reply, uk));
    }

    @Test
    void fromTunnelIgnoresUnrelatedPackets() {
        nat.toTunnel(TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "req"), uk);
        byte[] other = TestPackets.tcp("1.2.3.4", 443, "10.9.9.9", 40000, "resp");

        assertSame(other, nat.fromTunnel(other, uk));
    }

    @Test
    void forgottenTunnelNoLongerRestores() {
        byte[] rewritten = nat.toTunnel(TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "req"), uk);

        nat.forgetTunnel("uk");

        assertSame(rewritten, nat.fromTunnel(rewritten, uk));
    }

    @Test
    void lastOriginalSourceWins() {
        nat.toTunnel(TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "a"), uk);
        nat.toTunnel(TestPackets.tcp("10.0.0.6", 40001, "1.2.3.4", 443, "b"), uk);

        assertEquals(TestPackets.ip("10.0.0.6"), nat.getOriginalSource("uk"));
    }

    @Test
    void zeroUdpChecksumStaysDisabled() {
        byte[] packet = TestPackets.udp("10.0.0.5", 5000, "8.8.8.8", 53, "q");
        IPPacket.writeShort(packet, 20 + IPPacket.UDP_CHECKSUM_OFFSET, 0);

        byte[] rewritten = nat.toTunnel(packet, uk);

        assertEquals(0, IPPacket.readShort(rewritten, 20 + IPPacket.UDP_CHECKSUM_OFFSET));
        assertTrue(ChecksumEngine.verify(rewritten, 0, 20));
    }

    @Test
    void inconsistentUdpLengthKeepsTransportChecksum() {
        byte[] packet = TestPackets.udp("10.0.0.5", 5000, "8.8.8.8", 53, "q");
        IPPacket.writeShort(packet, 20 + IPPacket.UDP_LENGTH_OFFSET, 200);
        int before = IPPacket.readShort(packet, 20 + IPPacket.UDP_CHECKSUM_OFFSET);

        byte[] rewritten = nat.toTunnel(packet, uk);

        assertEquals(TestPackets.ip("10.5.0.2"), IPPacket.getSourceIP(rewritten));
        assertTrue(ChecksumEngine.verify(rewritten, 0, 20));
        assertEquals(before, IPPacket.readShort(rewritten, 20 + IPPacket.UDP_CHECKSUM_OFFSET));
    }

    @Test
    void truncatedTcpKeepsTransportChecksum() {
        byte[] full = TestPackets.tcp("10.0.0.5", 40000, "1.2.3.4", 443, "");
        byte[] truncated = new byte[30];
        System.arraycopy(full, 0, truncated, 0, truncated.length);
        IPPacket.writeShort(truncated, IPPacket.TOTAL_LENGTH_OFFSET, truncated.length);

        byte[] rewritten = nat.toTunnel(truncated, uk);

        assertEquals(TestPackets.ip("10.5.0.2"), IPPacket.getSourceIP(rewritten));
        assertTrue(ChecksumEngine.verify(rewritten, 0, 20));
        assertArrayEquals(Arrays.copyOfRange(truncated, 20, 30),
                Arrays.copyOfRange(rewritten, 20, 30));
    }

    @Test
    void fragmentKeepsTransportChecksum() {
        byte[] packet = TestPackets.udp("10.0.0.5", 5000, "8.8.8.8", 53, "q");
        packet[IPPacket.FLAGS_OFFSET] = 0x20;
        int before = IPPacket.readShort(packet, 20 + IPPacket.UDP_CHECKSUM_OFFSET);

        byte[] rewritten = nat.toTunnel(packet, uk);

        assertTrue(ChecksumEngine.verify(rewritten, 0, 20));
        assertEquals(before, IPPacket.readShort(rewritten, 20 + IPPacket.UDP_CHECKSUM_OFFSET));
    }

    @Test
    void unparseablePacketsPassThrough() {
        byte[] garbage = {0x45, 0x00, 0x01};
        byte[] ipv6 = TestPackets.mappedIpv6Udp("10.0.0.5", 1, "9.9.9.9", 53);

        assertSame(garbage, nat.toTunnel(garbage, uk));
        assertSame(ipv6, nat.toTunnel(ipv6, uk));
    }
}
