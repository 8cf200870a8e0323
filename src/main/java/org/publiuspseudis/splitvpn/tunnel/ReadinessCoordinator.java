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

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code ReadinessCoordinator} decides when packet capture must pause. While any tunnel is
 * mid-handshake ({@link TunnelState#CONNECTING} or connected but not yet ready) the backend may
 * need exclusive use of the capture interface, so the capture reader stops pulling packets.
 * Capture resumes as soon as no tunnel is handshaking.
 * </p>
 *
 * <p>
 * Listeners only hear about edges: one pause when the first tunnel starts a handshake, one resume
 * when the last one finishes, whichever way it finished. Lifecycle notifications are delivered
 * outside the tunnel lock and may overtake each other, so membership is decided from the tunnel's
 * state at the time a notification is handled rather than from the state it reports.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class ReadinessCoordinator implements TunnelLifecycle.Listener {
    private static final Logger log = LoggerFactory.getLogger(ReadinessCoordinator.class);

    /**
     * Receives capture pause and resume signals.
     */
    public interface Listener {
        void onCaptureStateChanged(boolean paused);
    }

    private final Set<String> handshaking = ConcurrentHashMap.newKeySet();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();
    private boolean paused;

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onStateChanged(Tunnel tunnel, TunnelState previous, TunnelState current) {
        boolean edge;
        boolean nowPaused;
        synchronized (monitor) {
            // notifications may arrive out of order, the tunnel's own state is authoritative
            if (tunnel.getState().isHandshaking()) {
                handshaking.add(tunnel.getId());
            } else {
                handshaking.remove(tunnel.getId());
            }
            nowPaused = !handshaking.isEmpty();
            edge = nowPaused != paused;
            paused = nowPaused;
            if (edge && !nowPaused) {
                monitor.notifyAll();
            }
        }
        if (edge) {
            log.info("Capture {} ({} tunnels handshaking)", nowPaused ? "paused" : "resumed", handshaking.size());
            for (Listener listener : listeners) {
                try {
                    listener.onCaptureStateChanged(nowPaused);
                } catch (RuntimeException e) {
                    log.error("Capture listener failed", e);
                }
            }
        }
    }

    public boolean isPaused() {
        synchronized (monitor) {
            return paused;
        }
    }

    /**
     * Blocks until capture is not paused or the timeout elapses.
     *
     * @param timeout maximum wait
     * @param unit    unit of {@code timeout}
     * @return {@code true} if capture is running on return
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitResumed(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (monitor) {
            while (paused) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
            return true;
        }
    }

    /**
     * @return ids of the tunnels currently handshaking
     */
    public Set<String> getHandshakingTunnels() {
        return Set.copyOf(handshaking);
    }
}
