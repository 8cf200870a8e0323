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

import java.util.Objects;

/**
 * <p>
 * The {@code RoutingDecision} class is the outcome of routing one outbound packet.
 * </p>
 * <ul>
 *   <li>{@link Action#FORWARD}: send {@link #getPacket()} (already rewritten) through the tunnel.</li>
 *   <li>{@link Action#QUEUE}: the tunnel was chosen but is not ready; hold the packet.</li>
 *   <li>{@link Action#DIRECT}: hand the packet back to the capture edge untouched.</li>
 *   <li>{@link Action#DROP}: the packet could not be parsed or routing failed.</li>
 * </ul>
 *
 * @author
 * Publius Pseudis
 */
public final class RoutingDecision {

    public enum Action {
        FORWARD,
        QUEUE,
        DIRECT,
        DROP
    }

    public static final String REASON_ROUTE_TABLE = "route-table";
    public static final String REASON_ADDRESS_CACHE = "address-cache";
    public static final String REASON_CONNECTION = "connection";
    public static final String REASON_DNS = "dns";
    public static final String REASON_POLICY = "policy";
    public static final String REASON_NO_MATCH = "no-match";
    public static final String REASON_MALFORMED = "malformed";
    public static final String REASON_UNSUPPORTED = "unsupported";
    public static final String REASON_ERROR = "error";

    private final Action action;
    private final String tunnelId;
    private final byte[] packet;
    private final String reason;

    private RoutingDecision(Action action, String tunnelId, byte[] packet, String reason) {
        this.action = action;
        this.tunnelId = tunnelId;
        this.packet = packet;
        this.reason = reason;
    }

    public static RoutingDecision forward(String tunnelId, byte[] packet, String reason) {
        return new RoutingDecision(Action.FORWARD, Objects.requireNonNull(tunnelId, "tunnelId"), packet, reason);
    }

    public static RoutingDecision queue(String tunnelId, byte[] packet, String reason) {
        return new RoutingDecision(Action.QUEUE, Objects.requireNonNull(tunnelId, "tunnelId"), packet, reason);
    }

    public static RoutingDecision direct(byte[] packet, String reason) {
        return new RoutingDecision(Action.DIRECT, null, packet, reason);
    }

    public static RoutingDecision drop(byte[] packet, String reason) {
        return new RoutingDecision(Action.DROP, null, packet, reason);
    }

    public Action getAction() {
        return action;
    }

    /**
     * @return the chosen tunnel for {@code FORWARD} and {@code QUEUE}, otherwise {@code null}
     */
    public String getTunnelId() {
        return tunnelId;
    }

    /**
     * @return the packet to emit; rewritten for {@code FORWARD}, as received otherwise
     */
    public byte[] getPacket() {
        return packet;
    }

    /**
     * @return which routing step produced the decision
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return action + (tunnelId != null ? "(" + tunnelId + ")" : "") + " [" + reason + "]";
    }
}
