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

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.publiuspseudis.splitvpn.MutableClock;
import org.publiuspseudis.splitvpn.TestPackets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionTrackerTest {

    private static final long TTL = 300_000;

    private MutableClock clock;
    private ConnectionTracker tracker;
    private final int src = TestPackets.ip("10.0.0.5");

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new ConnectionTracker(TTL, 10_000, clock);
    }

    @Test
    void entryLivesUntilTtl() {
        tracker.registerConnection(src, 40000, "com.app.a", "uk");

        clock.advance(TTL - 1);
        ConnectionEntry entry = tracker.lookupConnection(src, 40000);
        assertNotNull(entry);
        assertEquals("uk", entry.tunnelId());

        clock.advance(2);
        assertNull(tracker.lookupConnection(src, 40000));
        assertEquals(0, tracker.size());
    }

    @Test
    void directEntriesAreRemembered() {
        tracker.registerConnection(src, 40000, "com.app.b", null);

        ConnectionEntry entry = tracker.lookupConnection(src, 40000);

        assertTrue(entry.isDirect());
    }

    @Test
    void registerOverwrites() {
        tracker.registerConnection(src, 40000, "a", "uk");
        tracker.registerConnection(src, 40000, "a", "fr");

        assertEquals("fr", tracker.lookupConnection(src, 40000).tunnelId());
        assertEquals(1, tracker.size());
    }

    @Test
    void fullTableEvictsStaleEntriesFirst() {
        ConnectionTracker small = new ConnectionTracker(TTL, 2, clock);
        small.registerConnection(src, 1, "a", "uk");
        small.registerConnection(src, 2, "a", "uk");
        clock.advance(TTL + 1);

        small.registerConnection(src, 3, "a", "uk");

        assertEquals(1, small.size());
        assertNotNull(small.lookupConnection(src, 3));
    }

    @Test
    void fullTableStillAcceptsWhenNothingIsStale() {
        ConnectionTracker small = new ConnectionTracker(TTL, 2, clock);
        small.registerConnection(src, 1, "a", "uk");
        small.registerConnection(src, 2, "a", "uk");

        small.registerConnection(src, 3, "a", "uk");

        assertEquals(3, small.size());
    }

    @Test
    void addressSeenWithTwoTunnelsIsAmbiguous() {
        int dst = TestPackets.ip("1.2.3.4");
        tracker.setTunnelForAddress(dst, "uk");
        assertEquals("uk", tracker.getTunnelForAddress(dst));

        tracker.setTunnelForAddress(dst, "fr");

        assertNull(tracker.getTunnelForAddress(dst));
        assertNull(tracker.getTunnelForAddress(TestPackets.ip("9.9.9.9")));
    }

    @Test
    void clearForTunnelRemovesEveryTable() {
        int dst = TestPackets.ip("1.2.3.4");
        tracker.registerConnection(src, 1, "a", "uk");
        tracker.registerConnection(src, 2, "b", "fr");
        tracker.setIdentityToTunnel("a", "uk");
        tracker.setIdentityToTunnel("b", "fr");
        tracker.setTunnelForAddress(dst, "uk");
        tracker.setTunnelForAddress(dst, "fr");

        assertEquals(1, tracker.clearForTunnel("uk"));

        assertNull(tracker.lookupConnection(src, 1));
        assertNotNull(tracker.lookupConnection(src, 2));
        assertNull(tracker.getTunnelForIdentity("a"));
        assertEquals("fr", tracker.getTunnelForIdentity("b"));
        assertEquals("fr", tracker.getTunnelForAddress(dst));
    }

    @Test
    void clearForIdentityRemovesItsFlowsAndBinding() {
        tracker.registerConnection(src, 1, "a", "uk");
        tracker.registerConnection(src, 2, "a", "uk");
        tracker.registerConnection(src, 3, "b", "uk");
        tracker.setIdentityToTunnel("a", "uk");

        assertEquals(2, tracker.clearForIdentity("a"));

        assertNull(tracker.getTunnelForIdentity("a"));
        assertNotNull(tracker.lookupConnection(src, 3));
    }

    @Test
    void transientClearKeepsIdentityBindings() {
        tracker.registerConnection(src, 1, "a", "uk");
        tracker.setIdentityToTunnel("a", "uk");
        tracker.setTunnelForAddress(src, "uk");

        tracker.clearTransientMappings();

        assertEquals(0, tracker.size());
        assertNull(tracker.getTunnelForAddress(src));
        assertEquals(Map.of("a", "uk"), tracker.getIdentityMappings());

        tracker.clearAll();
        assertTrue(tracker.getIdentityMappings().isEmpty());
    }

    @Test
    void nullTunnelUnbindsIdentity() {
        tracker.setIdentityToTunnel("a", "uk");

        tracker.setIdentityToTunnel("a", null);

        assertNull(tracker.getTunnelForIdentity("a"));
    }

    @Test
    void evictStaleRemovesOnlyOldEntries() {
        tracker.registerConnection(src, 1, "a", "uk");
        clock.advance(TTL / 2);
        tracker.registerConnection(src, 2, "a", "uk");
        clock.advance(TTL / 2 + 1);

        assertEquals(1, tracker.evictStale());
        assertFalse(tracker.removeConnection(src, 1));
        assertTrue(tracker.removeConnection(src, 2));
    }

    @Test
    void statsReportTableSizes() {
        tracker.registerConnection(src, 1, "a", "uk");
        tracker.setIdentityToTunnel("a", "uk");

        Map<String, Object> stats = tracker.getStats();

        assertEquals(1, stats.get("connectionCount"));
        assertEquals(1, stats.get("identityCount"));
        assertEquals(0, stats.get("addressCount"));
    }

    @Test
    void portsAndAddressesDoNotCollide() {
        tracker.registerConnection(TestPackets.ip("10.0.0.1"), 2, "a", "uk");

        assertNull(tracker.lookupConnection(TestPackets.ip("10.0.0.2"), 1));
        assertNull(tracker.lookupConnection(TestPackets.ip("10.0.0.1"), 3));
    }

    @Test
    void addressRowsExpireAndAreSwept() {
        for (int i = 0; i < 500; i++) {
            tracker.setTunnelForAddress(TestPackets.ip("1.2.0.0") + i, "uk");
        }
        assertEquals("uk", tracker.getTunnelForAddress(TestPackets.ip("1.2.0.7")));

        clock.advance(TTL + 1);

        assertNull(tracker.getTunnelForAddress(TestPackets.ip("1.2.0.7")));
        tracker.evictStale();
        assertEquals(0, tracker.getStats().get("addressCount"));
    }

    @Test
    void staleAddressRowDoesNotMakeAddressAmbiguous() {
        int server = TestPackets.ip("1.2.3.4");
        tracker.setTunnelForAddress(server, "uk");
        clock.advance(TTL + 1);

        tracker.setTunnelForAddress(server, "fr");

        assertEquals("fr", tracker.getTunnelForAddress(server));
    }

    @Test
    void seeingAnAddressAgainRefreshesItsRow() {
        int server = TestPackets.ip("1.2.3.4");
        tracker.setTunnelForAddress(server, "uk");
        clock.advance(TTL - 1);
        tracker.setTunnelForAddress(server, "uk");
        clock.advance(TTL - 1);

        tracker.evictStale();

        assertEquals("uk", tracker.getTunnelForAddress(server));
    }

    @Test
    void fullAddressCacheEvictsStaleRows() {
        ConnectionTracker small = new ConnectionTracker(TTL, 2, clock);
        small.setTunnelForAddress(TestPackets.ip("1.1.1.1"), "uk");
        small.setTunnelForAddress(TestPackets.ip("2.2.2.2"), "uk");
        clock.advance(TTL + 1);

        small.setTunnelForAddress(TestPackets.ip("3.3.3.3"), "fr");

        assertEquals(1, small.getStats().get("addressCount"));
        assertEquals("fr", small.getTunnelForAddress(TestPackets.ip("3.3.3.3")));
    }
}
