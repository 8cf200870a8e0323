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

/**
 * <p>
 * The {@code TunnelBackend} interface is the capability boundary to one encrypted tunnel
 * implementation (OpenVPN-, WireGuard- or otherwise-backed). The router never looks inside a
 * backend; it only connects, disconnects, asks for readiness and hands over packets.
 * </p>
 *
 * <p>
 * A backend reports everything that happens to its session through the {@link TunnelCallback}
 * passed to {@link #connect(TunnelCallback)}. Callbacks may arrive on any thread and in any order.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public interface TunnelBackend {

    /**
     * Starts establishing the session. The call may return before the session is up; progress is
     * reported through {@code callback}.
     *
     * @param callback receiver for connection, configuration and inbound packet events
     * @throws IOException if the connection attempt cannot even be started
     */
    void connect(TunnelCallback callback) throws IOException;

    /**
     * Tears the session down. Must not block on the network for long and must not throw.
     */
    void disconnect();

    /**
     * @return {@code true} if the backend can accept packets right now
     */
    boolean isReady();

    /**
     * Encrypts and sends one IP datagram through the tunnel.
     *
     * @param packet the datagram; the backend takes ownership of the array
     * @return {@code true} if the packet was accepted
     */
    boolean send(byte[] packet);
}
