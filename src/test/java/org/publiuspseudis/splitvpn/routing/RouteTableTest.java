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

import java.net.InetAddress;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.publiuspseudis.splitvpn.TestPackets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RouteTableTest {

    private RouteTable table;

    @BeforeEach
    void setUp() {
        table = new RouteTable();
    }

    @Test
    void longestPrefixWins() {
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "T1");
        table.addRoute(TestPackets.ip("10.1.0.0"), 16, "T2");

        assertEquals("T2", table.lookup(TestPackets.ip("10.1.2.3")));
        assertEquals("T1", table.lookup(TestPackets.ip("10.2.0.1")));
    }

    @Test
    void mostRecentWinsOnEqualPrefix() {
        table.addRoute(TestPackets.ip("192.168.0.0"), 24, "old");
        table.addRoute(TestPackets.ip("192.168.0.0"), 24, "new");

        assertEquals("new", table.lookup(TestPackets.ip("192.168.0.7")));

        table.addRoute(TestPackets.ip("192.168.0.0"), 24, "old");

        assertEquals("old", table.lookup(TestPackets.ip("192.168.0.7")));
        assertEquals(2, table.size());
    }

    @Test
    void noMatchReturnsNull() {
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "T1");

        assertNull(table.lookup(TestPackets.ip("11.0.0.1")));
    }

    @Test
    void defaultRouteMatchesEverything() {
        table.addRoute(0, 0, "all");
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "ten");

        assertEquals("all", table.lookup(TestPackets.ip("8.8.8.8")));
        assertEquals("ten", table.lookup(TestPackets.ip("10.8.8.8")));
    }

    @Test
    void hostBitsAreMasked() {
        RouteEntry entry = table.addRoute(TestPackets.ip("10.1.2.3"), 16, "T");

        assertEquals("10.1.0.0/16", entry.getCidr());
        assertEquals("T", table.lookup(TestPackets.ip("10.1.200.1")));
    }

    @Test
    void duplicateRouteIsReplaced() {
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "T1");
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "T1");

        assertEquals(1, table.size());
    }

    @Test
    void removeRoutesForTunnelRemovesOnlyThatTunnel() {
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "T1");
        table.addRoute(TestPackets.ip("172.16.0.0"), 12, "T1");
        table.addRoute(TestPackets.ip("10.1.0.0"), 16, "T2");

        assertEquals(2, table.removeRoutesForTunnel("T1"));

        assertEquals(List.of(), table.routesForTunnel("T1"));
        assertEquals(1, table.routesForTunnel("T2").size());
        assertNull(table.lookup(TestPackets.ip("10.2.0.1")));
    }

    @Test
    void invalidRoutesFromBackendsAreIgnored() throws Exception {
        assertNull(table.addRoute(InetAddress.getByName("2001:db8::"), 32, "T"));
        assertNull(table.addRoute(InetAddress.getByName("10.0.0.0"), 33, "T"));
        assertEquals(0, table.size());

        assertThrows(IllegalArgumentException.class, () -> table.addRoute(0, -1, "T"));
    }

    @Test
    void clearEmptiesTable() {
        table.addRoute(TestPackets.ip("10.0.0.0"), 8, "T1");

        table.clear();

        assertEquals(0, table.size());
        assertNull(table.lookup(TestPackets.ip("10.0.0.1")));
    }
}
