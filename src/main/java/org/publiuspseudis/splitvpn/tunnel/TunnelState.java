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

/**
 * <p>
 * The {@code TunnelState} enum represents the stages a tunnel goes through between creation and
 * explicit close.
 * </p>
 *
 * <p>
 * The typical sequence is as follows:</p>
 * <ol>
 *   <li>{@link #DISCONNECTED}: created, or dropped by its backend.</li>
 *   <li>{@link #CONNECTING}: the backend has been asked to connect.</li>
 *   <li>{@link #CONNECTED}: the backend reports an established session.</li>
 *   <li>{@link #READY}: connected, with both an assigned address and DNS configuration.</li>
 * </ol>
 *
 * <p>
 * {@link #CONNECTING}, {@link #CONNECTED} and {@link #READY} fall back to {@link #DISCONNECTED} on
 * failure. {@link #CLOSED} is terminal and only reached through an explicit close.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public enum TunnelState {

    /**
     * No session. Either freshly created or dropped by the backend; the tunnel's last error
     * explains why.
     */
    DISCONNECTED,

    /**
     * The backend has been asked to connect and is mid-handshake.
     */
    CONNECTING,

    /**
     * The backend reports an established session, but the address or DNS configuration has not
     * been reported yet.
     */
    CONNECTED,

    /**
     * Connected and fully configured. Only tunnels in this state carry traffic.
     */
    READY,

    /**
     * Explicitly closed. The tunnel is gone from the lifecycle.
     */
    CLOSED;

    /**
     * @return {@code true} for the states in which the backend is mid-handshake
     */
    public boolean isHandshaking() {
        return this == CONNECTING || this == CONNECTED;
    }

    /**
     * @return {@code true} while a session exists or is being established
     */
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED || this == READY;
    }
}
