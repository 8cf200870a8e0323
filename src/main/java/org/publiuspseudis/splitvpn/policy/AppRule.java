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
package org.publiuspseudis.splitvpn.policy;

import java.util.Objects;

/**
 * A policy binding an app identity to a tunnel.
 *
 * @param identity opaque app identity, unique within a rule set
 * @param tunnelId tunnel the app's traffic goes through, {@code null} for no VPN
 *
 * @author
 * Publius Pseudis
 */
public record AppRule(String identity, String tunnelId) {

    public AppRule {
        Objects.requireNonNull(identity, "identity");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("Rule identity must not be blank");
        }
    }

    /**
     * @return {@code true} if the app's traffic should bypass every tunnel
     */
    public boolean isDirect() {
        return tunnelId == null;
    }
}
