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

/**
 * Finds the app that owns a connection, typically through an OS connection-owner lookup.
 * Implementations must answer from local state; a failure is treated as "unknown".
 *
 * @author
 * Publius Pseudis
 */
@FunctionalInterface
public interface IdentityResolver {

    /**
     * A resolver that never knows the owner.
     */
    IdentityResolver UNKNOWN = (srcAddr, srcPort, dstAddr, dstPort, protocol) -> null;

    /**
     * @param srcAddr  source IPv4 address as an int
     * @param srcPort  source port
     * @param dstAddr  destination IPv4 address as an int
     * @param dstPort  destination port
     * @param protocol IP protocol number
     * @return the owning identity, or {@code null} if unknown
     */
    String resolveOwner(int srcAddr, int srcPort, int dstAddr, int dstPort, int protocol);
}
