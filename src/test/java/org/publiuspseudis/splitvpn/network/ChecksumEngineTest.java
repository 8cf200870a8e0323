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

import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChecksumEngineTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 2, 20, 64, 1500})
    void appendedChecksumVerifies(int length) {
        Random random = new Random(length);
        byte[] data = new byte[length + 2];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) random.nextInt(256);
        }
        int checksum = ChecksumEngine.checksum(data, 0, length);
        IPPacket.writeShort(data, length, checksum);

        assertTrue(ChecksumEngine.verify(data, 0, data.length));
    }

    @Test
    void knownHeaderChecksum() {
        // RFC 1071 style example header 4500 0073 0000 4000 4011 ---- c0a8 0001 c0a8 00c7
        byte[] header = {
            0x45, 0x00, 0x00, 0x73, 0x00, 0x00, 0x40, 0x00, 0x40, 0x11, 0x00, 0x00,
            (byte) 0xc0, (byte) 0xa8, 0x00, 0x01, (byte) 0xc0, (byte) 0xa8, 0x00, (byte) 0xc7
        };

        assertEquals(0xb861, ChecksumEngine.ipv4HeaderChecksum(header, 20));
    }

    @Test
    void corruptedDataFailsVerification() {
        byte[] data = {0x12, 0x34, 0x56, 0x78, 0, 0};
        IPPacket.writeShort(data, 4, ChecksumEngine.checksum(data, 0, 4));
        data[1] ^= 0x01;

        assertFalse(ChecksumEngine.verify(data, 0, data.length));
    }

    @Test
    void oddLengthPadsWithZero() {
        byte[] odd = {0x01, 0x02, 0x03};
        byte[] padded = {0x01, 0x02, 0x03, 0x00};

        assertEquals(ChecksumEngine.checksum(padded, 0, 4), ChecksumEngine.checksum(odd, 0, 3));
    }

    @Test
    void foldCarriesEndAround() {
        assertEquals(0x0001, ChecksumEngine.fold(0x10000L));
        assertEquals(0xFFFF, ChecksumEngine.fold(0x1FFFEL));
        assertEquals(0x0000, ChecksumEngine.finalizeSum(0xFFFFL));
    }

    @Test
    void pseudoHeaderCoversAddressesProtocolAndLength() {
        int src = IPPacket.parseIP("10.0.0.1");
        int dst = IPPacket.parseIP("10.0.0.2");

        long sum = ChecksumEngine.pseudoHeaderChecksum(src, dst, IPPacket.PROTO_UDP, 12);

        assertEquals(0x0a00 + 0x0001 + 0x0a00 + 0x0002 + 17 + 12, sum);
    }

    @Test
    void rangeArgumentsAreRespected() {
        byte[] data = {(byte) 0xFF, (byte) 0xFF, 0x12, 0x34, (byte) 0xFF};

        assertEquals(ChecksumEngine.checksum(new byte[] {0x12, 0x34}, 0, 2), ChecksumEngine.checksum(data, 2, 2));
    }
}
