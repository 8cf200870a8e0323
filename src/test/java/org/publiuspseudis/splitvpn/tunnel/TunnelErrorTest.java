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

import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TunnelErrorTest {

    @ParameterizedTest
    @CsvSource({
        "AUTH_FAILED, AUTHENTICATION_FAILED",
        "bad username or password, AUTHENTICATION_FAILED",
        "Connection refused, CONNECTION_FAILED",
        "handshake timed out, CONNECTION_FAILED",
        "network unreachable, CONNECTION_FAILED",
        "could not parse profile, CONFIG_ERROR",
        "permission denied on tun0, INTERFACE_ERROR",
        "tunnel collapsed, TUNNEL_ERROR",
        "something odd, UNKNOWN"
    })
    void classifiesReasons(String reason, TunnelError.Type expected) {
        assertEquals(expected, TunnelError.fromReason(reason, "uk").getType());
    }

    @Test
    void authenticationWinsOverConnectionKeywords() {
        assertEquals(TunnelError.Type.AUTHENTICATION_FAILED,
                TunnelError.classify("connection closed: auth rejected"));
    }

    @Test
    void missingReasonIsUnknown() {
        TunnelError error = TunnelError.fromReason(null, "uk");

        assertEquals(TunnelError.Type.UNKNOWN, error.getType());
        assertEquals("Unknown error", error.getMessage());
        assertEquals(TunnelError.Type.UNKNOWN, TunnelError.classify("   "));
    }

    @Test
    void exceptionWithoutMessageUsesClassName() {
        TunnelError error = TunnelError.fromException(new SocketTimeoutException(), "fr");

        assertEquals("SocketTimeoutException", error.getMessage());
        assertEquals(TunnelError.Type.CONNECTION_FAILED, error.getType());
        assertEquals("fr", error.getTunnelId());
    }

    @Test
    void userMessageCarriesHintAndReason() {
        String text = TunnelError.fromReason("AUTH_FAILED", "uk").getUserMessage();

        assertTrue(text.startsWith("Authentication failed."));
        assertTrue(text.endsWith("(AUTH_FAILED)"));
    }
}
