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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.publiuspseudis.splitvpn.routing.Router;
import org.publiuspseudis.splitvpn.tunnel.Tunnel;
import org.publiuspseudis.splitvpn.tunnel.TunnelLifecycle;
import org.publiuspseudis.splitvpn.tunnel.TunnelState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code InboundDispatcher} class takes decrypted packets off the tunnel backends' threads
 * and processes them on one single-threaded executor per tunnel. Packets of one tunnel stay in
 * order; a slow tunnel never holds up another one.
 * </p>
 *
 * <p>
 * It also runs {@link Router#sweep()} on a fixed interval so stale flows and expired queued
 * packets are removed even when no traffic arrives.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class InboundDispatcher implements Router.InboundHandler, TunnelLifecycle.Listener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InboundDispatcher.class);

    private final Router router;
    private final long sweepIntervalMillis;
    private final Map<String, ExecutorService> executors = new ConcurrentHashMap<>();
    private final ScheduledExecutorService maintenance;
    private volatile boolean running;

    /**
     * @param router              the router to feed
     * @param sweepIntervalMillis interval between maintenance sweeps
     */
    public InboundDispatcher(Router router, long sweepIntervalMillis) {
        this.router = Objects.requireNonNull(router, "router");
        if (sweepIntervalMillis <= 0) {
            throw new IllegalArgumentException("sweepIntervalMillis must be positive: " + sweepIntervalMillis);
        }
        this.sweepIntervalMillis = sweepIntervalMillis;
        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "router-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Installs the dispatcher on the router and starts the maintenance schedule.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        router.setInboundHandler(this);
        router.getLifecycle().addListener(this);
        maintenance.scheduleAtFixedRate(this::runSweep, sweepIntervalMillis, sweepIntervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("Inbound dispatcher started, sweeping every {}ms", sweepIntervalMillis);
    }

    @Override
    public void onInbound(String tunnelId, byte[] packet) {
        if (!running || router.getTunnelState(tunnelId) == null) {
            // closed tunnels get no executor, the router drops and counts the packet
            router.handleInbound(tunnelId, packet);
            return;
        }
        ExecutorService executor = executors.computeIfAbsent(tunnelId, this::newExecutor);
        try {
            executor.execute(() -> router.handleInbound(tunnelId, packet));
        } catch (RejectedExecutionException e) {
            log.warn("Inbound executor of tunnel {} is shut down, dropping packet", tunnelId);
        }
    }

    @Override
    public void onStateChanged(Tunnel tunnel, TunnelState previous, TunnelState current) {
        if (current == TunnelState.CLOSED) {
            ExecutorService executor = executors.remove(tunnel.getId());
            if (executor != null) {
                executor.shutdown();
            }
        }
    }

    private ExecutorService newExecutor(String tunnelId) {
        log.debug("Starting inbound executor for tunnel {}", tunnelId);
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "inbound-" + tunnelId);
            t.setDaemon(true);
            return t;
        });
    }

    private void runSweep() {
        try {
            router.sweep();
        } catch (RuntimeException e) {
            log.error("Maintenance sweep failed", e);
        }
    }

    /**
     * @return the number of tunnels with an inbound executor
     */
    public int getExecutorCount() {
        return executors.size();
    }

    /**
     * Stops the maintenance schedule and the per-tunnel executors, letting queued packets finish
     * for a short grace period.
     */
    @Override
    public synchronized void close() {
        if (!running) {
            maintenance.shutdownNow();
            return;
        }
        running = false;
        router.setInboundHandler(null);
        router.getLifecycle().removeListener(this);
        maintenance.shutdownNow();
        for (ExecutorService executor : executors.values()) {
            executor.shutdown();
        }
        try {
            for (ExecutorService executor : executors.values()) {
                if (!executor.awaitTermination(500, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executors.values().forEach(ExecutorService::shutdownNow);
        }
        executors.clear();
        log.info("Inbound dispatcher stopped");
    }
}
