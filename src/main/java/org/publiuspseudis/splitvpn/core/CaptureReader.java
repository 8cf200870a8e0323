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
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.publiuspseudis.splitvpn.routing.Router;
import org.publiuspseudis.splitvpn.tunnel.ReadinessCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code CaptureReader} class owns the read side of a {@link CaptureEdge}: it pulls outbound
 * packets and hands each one to {@link Router#handleOutbound(byte[])}.
 * </p>
 *
 * <p>
 * While the router's {@link ReadinessCoordinator} reports a pause (a tunnel is mid-handshake),
 * the reader stops pulling packets and waits for the resume signal.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class CaptureReader implements Runnable, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CaptureReader.class);

    private final CaptureEdge edge;
    private final Router router;
    private final ReadinessCoordinator coordinator;
    private final AtomicLong packetsRead = new AtomicLong();
    private volatile boolean running;
    private volatile Thread thread;

    public CaptureReader(CaptureEdge edge, Router router) {
        this.edge = Objects.requireNonNull(edge, "edge");
        this.router = Objects.requireNonNull(router, "router");
        this.coordinator = router.getReadinessCoordinator();
    }

    /**
     * Connects the edge to the router and starts reading on a daemon thread.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        router.setCaptureEdge(edge);
        thread = new Thread(this, "capture-reader");
        thread.setDaemon(true);
        thread.start();
        log.info("Capture reader started");
    }

    @Override
    public void run() {
        int emptyCount = 0;
        while (running) {
            try {
                if (coordinator.isPaused()) {
                    coordinator.awaitResumed(100, TimeUnit.MILLISECONDS);
                    continue;
                }
                byte[] packet = edge.readPacket();
                if (packet != null) {
                    packetsRead.incrementAndGet();
                    router.handleOutbound(packet);
                    emptyCount = 0;
                } else {
                    emptyCount++;
                    // backoff capped at 100ms
                    Thread.sleep(Math.min(1L * emptyCount, 100L));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (IOException e) {
                log.error("Capture edge failed, stopping reader: {}", e.getMessage());
                running = false;
            } catch (RuntimeException e) {
                log.error("Error processing outbound packet", e);
            }
        }
        log.debug("Capture reader stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public long getPacketsRead() {
        return packetsRead.get();
    }

    @Override
    public synchronized void close() {
        running = false;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
    }
}
