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

import java.net.InetAddress;
import java.util.List;

/**
 * Events a {@link TunnelBackend} reports about its session. The router supplies one callback per
 * tunnel, already bound to the tunnel's id. Every method is safe to call from any thread and is
 * idempotent for repeated identical reports.
 *
 * @author
 * Publius Pseudis
 */
public interface TunnelCallback {

    /**
     * The session is established.
     */
    void onConnected();

    /**
     * The session dropped or could not be established.
     *
     * @param reason human readable reason, may be {@code null}
     */
    void onDisconnected(String reason);

    /**
     * The remote end assigned the tunnel an address.
     *
     * @param address      assigned IPv4 address
     * @param prefixLength prefix length of the assigned network
     */
    void onAddressAssigned(InetAddress address, int prefixLength);

    /**
     * The remote end pushed DNS servers.
     *
     * @param servers DNS server addresses
     */
    void onDnsConfigured(List<InetAddress> servers);

    /**
     * The remote end pushed a route that should go through this tunnel.
     *
     * @param network      network address
     * @param prefixLength prefix length
     */
    void onRoutePushed(InetAddress network, int prefixLength);

    /**
     * A decrypted datagram arrived from the tunnel.
     *
     * @param packet raw IP bytes; ownership passes to the router
     */
    void onReceive(byte[] packet);
}
