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
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code VirtualInterface} class is a {@link CaptureEdge} that lives entirely in memory. The
 * device side injects packets with {@link #injectPacket(byte[])} and picks up what the router
 * wrote back with {@link #receivePacket(long, TimeUnit)}; the router side uses
 * {@link #readPacket()} and {@link #writePacket(byte[])}.
 * </p>
 *
 * <p>
 * It is what an embedding application plugs in when the real interface is owned elsewhere, and
 * what the tests drive the router with.
 * </p>
 *
 * <p>
 * <strong>Thread Safety:</strong> both directions are {@link LinkedBlockingQueue}s and the running
 * flag is an {@link AtomicBoolean}, so producers and consumers on either side may run on
 * different threads.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class VirtualInterface implements CaptureEdge, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VirtualInterface.class);

    /**
     * How long a read waits for a packet before returning {@code null}.
     */
    private static final long POLL_TIMEOUT_MS = 100;

    private final String name;
    private final int mtu;
    private final BlockingQueue<byte[]> fromDevice;
    private final BlockingQueue<byte[]> toDevice;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong oversizeDrops = new AtomicLong();

    /**
     * @param name     interface name, for logging
     * @param mtu      largest packet accepted in either direction
     * @param capacity capacity of each direction's queue
     */
    public VirtualInterface(String name, int mtu, int capacity) {
        if (mtu < 20) {
            throw new IllegalArgumentException("MTU too small: " + mtu);
        }
        this.name = name;
        this.mtu = mtu;
        this.fromDevice = new LinkedBlockingQueue<>(capacity);
        this.toDevice = new LinkedBlockingQueue<>(capacity);
    }

    public VirtualInterface(String name, int mtu) {
        this(name, mtu, 4096);
    }

    /**
     * Device side: submits a packet as if an app had sent it. The bytes are copied.
     *
     * @param packet raw IP bytes
     * @return {@code true} if the packet was accepted
     */
    public boolean injectPacket(byte[] packet) {
        if (!running.get() || packet == null || packet.length == 0) {
            return false;
        }
        if (packet.length > mtu) {
            oversizeDrops.incrementAndGet();
            log.warn("{}: dropping {} byte packet above MTU {}", name, packet.length, mtu);
            return false;
        }
        boolean accepted = fromDevice.offer(packet.clone());
        if (!accepted) {
            log.warn("{}: ingress queue full", name);
        }
        return accepted;
    }

    /**
     * Device side: waits for a packet the router wrote back.
     *
     * @param timeout maximum wait
     * @param unit    unit of {@code timeout}
     * @return the packet, or {@code null} on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public byte[] receivePacket(long timeout, TimeUnit unit) throws InterruptedException {
        return toDevice.poll(timeout, unit);
    }

    @Override
    public byte[] readPacket() throws InterruptedException {
        if (!running.get()) {
            return null;
        }
        return fromDevice.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }

    /**
     * Router side: hands a packet to the device.
     *
     * @param packet raw IP bytes
     * @throws IOException if the interface is closed, the packet exceeds the MTU, or the device
     *                     did not make room in time
     */
    @Override
    public void writePacket(byte[] packet) throws IOException {
        if (!running.get()) {
            throw new IOException("Interface " + name + " is closed");
        }
        if (packet == null || packet.length == 0) {
            return;
        }
        if (packet.length > mtu) {
            oversizeDrops.incrementAndGet();
            throw new IOException(name + ": " + packet.length + " byte packet above MTU " + mtu);
        }
        try {
            if (!toDevice.offer(packet, POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                throw new IOException(name + ": write timed out after " + POLL_TIMEOUT_MS + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted writing to " + name, e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    public int getMtu() {
        return mtu;
    }

    /**
     * @return packets waiting for the router to read them
     */
    public int pendingIngress() {
        return fromDevice.size();
    }

    /**
     * @return packets waiting for the device to pick them up
     */
    public int pendingEgress() {
        return toDevice.size();
    }

    public long getOversizeDrops() {
        return oversizeDrops.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            fromDevice.clear();
            toDevice.clear();
            log.info("Virtual interface {} closed", name);
        }
    }
}
