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
package org.publiuspseudis.splitvpn.core;

import java.io.IOException;

/**
 * The single point where device traffic enters and leaves the router. The owner of the edge
 * reads outbound packets from it and the router writes direct and reply traffic back.
 *
 * @author
 * Publius Pseudis
 */
public interface CaptureEdge {

    /**
     * Reads the next outbound packet.
     *
     * @return raw IP bytes, or {@code null} if nothing arrived within the edge's poll interval
     * @throws IOException          if the edge is broken
     * @throws InterruptedException if interrupted while waiting
     */
    byte[] readPacket() throws IOException, InterruptedException;

    /**
     * Writes a packet back towards the device.
     *
     * @param packet raw IP bytes
     * @throws IOException if the edge is broken
     */
    void writePacket(byte[] packet) throws IOException;
}
