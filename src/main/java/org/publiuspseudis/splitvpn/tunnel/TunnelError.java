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

import java.util.Locale;

/**
 * <p>
 * The {@code TunnelError} class describes why a tunnel ended up {@link TunnelState#DISCONNECTED}.
 * Backends only hand over a free-form reason string or an exception; this class sorts those into a
 * small set of categories so a user interface can say something more useful than the raw text.
 * </p>
 *
 * <p>
 * Classification is keyword based and case insensitive. The first category whose keywords match
 * wins, checked in the order authentication, connection, configuration, interface, tunnel.
 * </p>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public final class TunnelError {

    /**
     * Broad failure categories.
     */
    public enum Type {
        /** Credentials rejected by the remote end. */
        AUTHENTICATION_FAILED,
        /** Server unreachable, timed out or the session dropped. */
        CONNECTION_FAILED,
        /** The tunnel configuration could not be used. */
        CONFIG_ERROR,
        /** The local capture interface could not be set up. */
        INTERFACE_ERROR,
        /** Any other tunnel-level failure. */
        TUNNEL_ERROR,
        /** Nothing recognisable in the reason. */
        UNKNOWN
    }

    private final Type type;
    private final String message;
    private final String tunnelId;
    private final long timestamp;

    /**
     * Creates an error with an explicit category.
     *
     * @param type     category
     * @param message  raw reason text
     * @param tunnelId tunnel the error belongs to, may be {@code null}
     */
    public TunnelError(Type type, String message, String tunnelId) {
        this.type = type == null ? Type.UNKNOWN : type;
        this.message = message == null ? "Unknown error" : message;
        this.tunnelId = tunnelId;
        this.timestamp = System.currentTimeMillis();
    }

    /**
     * Classifies a free-form disconnect reason.
     *
     * @param reason   reason reported by the backend, may be {@code null}
     * @param tunnelId tunnel the reason belongs to
     * @return the classified error
     */
    public static TunnelError fromReason(String reason, String tunnelId) {
        return new TunnelError(classify(reason), reason, tunnelId);
    }

    /**
     * Classifies an exception thrown by a backend.
     *
     * @param e        the failure
     * @param tunnelId tunnel the failure belongs to
     * @return the classified error
     */
    public static TunnelError fromException(Throwable e, String tunnelId) {
        String text = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new TunnelError(classify(text), text, tunnelId);
    }

    static Type classify(String reason) {
        if (reason == null || reason.isBlank()) {
            return Type.UNKNOWN;
        }
        String text = reason.toLowerCase(Locale.ROOT);
        if (containsAny(text, "auth", "credential", "password", "username")) {
            return Type.AUTHENTICATION_FAILED;
        }
        if (containsAny(text, "connection", "timeout", "timed out", "unreachable", "refused", "reset")) {
            return Type.CONNECTION_FAILED;
        }
        if (containsAny(text, "config", "parse")) {
            return Type.CONFIG_ERROR;
        }
        if (containsAny(text, "interface", "permission")) {
            return Type.INTERFACE_ERROR;
        }
        if (text.contains("tunnel")) {
            return Type.TUNNEL_ERROR;
        }
        return Type.UNKNOWN;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders a short explanation with a hint on what to try next.
     *
     * @return user facing text
     */
    public String getUserMessage() {
        String hint = switch (type) {
            case AUTHENTICATION_FAILED -> "Authentication failed. Check the credentials configured for this tunnel.";
            case CONNECTION_FAILED -> "Could not reach the VPN server. Check the network connection or try another server.";
            case CONFIG_ERROR -> "The tunnel configuration is invalid or outdated. Re-import it and try again.";
            case INTERFACE_ERROR -> "The VPN interface could not be set up. Make sure no other VPN holds it.";
            case TUNNEL_ERROR -> "The tunnel could not be established.";
            case UNKNOWN -> "An unexpected error occurred.";
        };
        return hint + " (" + message + ")";
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public String getTunnelId() {
        return tunnelId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "TunnelError{" + type + ", tunnel=" + tunnelId + ", message='" + message + "'}";
    }
}
