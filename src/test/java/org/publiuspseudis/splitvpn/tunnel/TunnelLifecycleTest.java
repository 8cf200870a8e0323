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
package org.publiuspseudis.splitvpn.tunnel;

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.publiuspseudis.splitvpn.TestPackets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TunnelLifecycleTest {

    private TunnelLifecycle lifecycle;
    private final List<String> transitions = new ArrayList<>();
    private List<InetAddress> dns;

    @BeforeEach
    void setUp() throws Exception {
        lifecycle = new TunnelLifecycle();
        lifecycle.addListener((tunnel, previous, current) ->
                transitions.add(tunnel.getId() + ":" + previous + "->" + current));
        dns = List.of(InetAddress.getByName("10.5.0.1"));
    }

    private TunnelBackend connecting(String id) {
        TunnelBackend backend = mock(TunnelBackend.class);
        lifecycle.create(id, backend);
        assertTrue(lifecycle.connect(id, mock(TunnelCallback.class)));
        return backend;
    }

    @Test
    void readyNeedsAddressAndDnsInAnyOrder() {
        connecting("a");
        connecting("b");
        lifecycle.connected("a");
        lifecycle.connected("b");

        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        assertEquals(TunnelState.CONNECTED, lifecycle.getState("a"));
        lifecycle.dnsConfigured("a", dns);

        lifecycle.dnsConfigured("b", dns);
        assertEquals(TunnelState.CONNECTED, lifecycle.getState("b"));
        lifecycle.addressAssigned("b", TestPackets.ip("10.6.0.2"), 16);

        assertTrue(lifecycle.isReady("a"));
        assertTrue(lifecycle.isReady("b"));
    }

    @Test
    void configurationBeforeConnectedIsKept() {
        connecting("a");
        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        lifecycle.dnsConfigured("a", dns);
        assertEquals(TunnelState.CONNECTING, lifecycle.getState("a"));

        lifecycle.connected("a");

        assertEquals(TunnelState.READY, lifecycle.getState("a"));
        assertEquals(List.of("a:DISCONNECTED->CONNECTING", "a:CONNECTING->READY"), transitions);
    }

    @Test
    void repeatedReportsAreIdempotent() {
        connecting("a");
        lifecycle.connected("a");
        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        lifecycle.dnsConfigured("a", dns);
        int events = transitions.size();

        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        lifecycle.dnsConfigured("a", dns);
        lifecycle.connected("a");

        assertEquals(events, transitions.size());
        assertEquals(TunnelState.READY, lifecycle.getState("a"));
    }

    @Test
    void disconnectClearsSessionAndRecordsError() {
        connecting("a");
        lifecycle.connected("a");
        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        lifecycle.dnsConfigured("a", dns);
        lifecycle.routePushed("a", TestPackets.ip("10.0.0.0"), 8);

        lifecycle.disconnected("a", TunnelError.fromReason("AUTH_FAILED: bad password", "a"));

        Tunnel tunnel = lifecycle.getTunnel("a");
        assertEquals(TunnelState.DISCONNECTED, tunnel.getState());
        assertFalse(tunnel.hasAssignedAddress());
        assertFalse(tunnel.isDnsConfigured());
        assertTrue(tunnel.getPushedRoutes().isEmpty());
        assertEquals(TunnelError.Type.AUTHENTICATION_FAILED, tunnel.getLastError().getType());
    }

    @Test
    void reconnectNeedsFreshConfiguration() {
        connecting("a");
        lifecycle.connected("a");
        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        lifecycle.dnsConfigured("a", dns);
        lifecycle.disconnected("a", null);

        assertTrue(lifecycle.connect("a", mock(TunnelCallback.class)));
        lifecycle.connected("a");
        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.9"), 16);

        assertEquals(TunnelState.CONNECTED, lifecycle.getState("a"));
    }

    @Test
    void reportsWhileDisconnectedAreIgnored() {
        lifecycle.create("a", mock(TunnelBackend.class));

        lifecycle.addressAssigned("a", TestPackets.ip("10.5.0.2"), 16);
        lifecycle.dnsConfigured("a", dns);

        assertFalse(lifecycle.getTunnel("a").hasAssignedAddress());
        assertFalse(lifecycle.routePushed("a", 0, 0));
    }

    @Test
    void closeRemovesTunnelAndDisconnectsBackend() {
        TunnelBackend backend = connecting("a");

        assertTrue(lifecycle.close("a"));

        verify(backend).disconnect();
        assertNull(lifecycle.getTunnel("a"));
        assertNull(lifecycle.getState("a"));
        assertEquals("a:CONNECTING->CLOSED", transitions.get(transitions.size() - 1));
        assertFalse(lifecycle.close("a"));
    }

    @Test
    void failedConnectLeavesTunnelDisconnected() throws Exception {
        TunnelBackend backend = mock(TunnelBackend.class);
        doThrow(new IOException("Connection refused")).when(backend).connect(any());
        lifecycle.create("a", backend);

        assertFalse(lifecycle.connect("a", mock(TunnelCallback.class)));

        Tunnel tunnel = lifecycle.getTunnel("a");
        assertEquals(TunnelState.DISCONNECTED, tunnel.getState());
        assertEquals(TunnelError.Type.CONNECTION_FAILED, tunnel.getLastError().getType());
        assertEquals(List.of("a:DISCONNECTED->CONNECTING", "a:CONNECTING->DISCONNECTED"), transitions);
    }

    @Test
    void duplicateOrBlankIdsAreRejected() {
        lifecycle.create("a", mock(TunnelBackend.class));

        assertThrows(IllegalStateException.class, () -> lifecycle.create("a", mock(TunnelBackend.class)));
        assertThrows(IllegalArgumentException.class, () -> lifecycle.create(" ", mock(TunnelBackend.class)));
        assertThrows(NullPointerException.class, () -> lifecycle.create(null, mock(TunnelBackend.class)));
        assertThrows(IllegalArgumentException.class, () -> lifecycle.connect("missing", mock(TunnelCallback.class)));
    }

    @Test
    void firstClaimerOfSubnetIsPrimaryAndNextIsPromoted() {
        connecting("first");
        connecting("second");
        lifecycle.addressAssigned("first", TestPackets.ip("10.8.0.2"), 24);
        lifecycle.addressAssigned("second", TestPackets.ip("10.8.0.2"), 24);

        assertTrue(lifecycle.isPrimary("first"));
        assertFalse(lifecycle.isPrimary("second"));
        assertEquals("first", lifecycle.getPrimaryForSubnet("10.8.0.0/24"));

        lifecycle.disconnected("first", TunnelError.fromReason("connection reset", "first"));

        assertTrue(lifecycle.isPrimary("second"));
        assertEquals("second", lifecycle.getPrimaryForSubnet("10.8.0.0/24"));
    }

    @Test
    void tunnelsAreListedInCreationOrder() {
        lifecycle.create("z", mock(TunnelBackend.class));
        lifecycle.create("a", mock(TunnelBackend.class));
        lifecycle.create("m", mock(TunnelBackend.class));

        List<String> ids = new ArrayList<>();
        lifecycle.getTunnels().forEach(t -> ids.add(t.getId()));

        assertEquals(List.of("z", "a", "m"), ids);
    }

    @Test
    void eventsForUnknownTunnelsAreIgnored() {
        lifecycle.connected("ghost");
        lifecycle.disconnected("ghost", null);
        lifecycle.addressAssigned("ghost", 1, 24);

        assertTrue(transitions.isEmpty());
    }

    @Test
    void failingListenerDoesNotBreakOthers() {
        List<TunnelState> seen = new ArrayList<>();
        lifecycle.addListener((tunnel, previous, current) -> {
            throw new IllegalStateException("boom");
        });
        lifecycle.addListener((tunnel, previous, current) -> seen.add(current));

        connecting("a");

        assertEquals(List.of(TunnelState.CONNECTING), seen);
    }
}
