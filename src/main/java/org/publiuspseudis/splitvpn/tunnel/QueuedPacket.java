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
 * A packet waiting for its tunnel to become ready, stamped with the time it was queued.
 *
 * @param packet   raw IP bytes, owned by the queue
 * @param queuedAt enqueue time in milliseconds of the queue's clock
 *
 * @author
 * Publius Pseudis
 */
public record QueuedPacket(byte[] packet, long queuedAt) {

    /**
     * @param now     current time in milliseconds
     * @param timeout maximum age in milliseconds
     * @return {@code true} if the packet has waited longer than {@code timeout}
     */
    public boolean isExpired(long now, long timeout) {
        return now - queuedAt > timeout;
    }
}
