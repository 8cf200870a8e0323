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

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code PacketQueue} class holds outbound packets for tunnels that have been chosen by the
 * router but are not ready yet. There is one bounded FIFO per tunnel.
 * </p>
 *
 * <p>
 * <strong>Key Functionalities:</strong>
 * </p>
 * <ul>
 *   <li><strong>Bounded:</strong> a full queue rejects the new packet; packets already queued are
 *       never displaced.</li>
 *   <li><strong>Timed:</strong> packets older than the timeout are dropped lazily on enqueue, on
 *       flush and on {@link #sweepExpired()}.</li>
 *   <li><strong>Open/Sealed:</strong> a queue only accepts packets between {@link #open(String)}
 *       and {@link #seal(String)}. Sealing discards whatever is queued, so nothing is ever
 *       delivered after the tunnel dropped.</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Safety:</strong> each per-tunnel queue has its own lock. Queues of different
 * tunnels never contend.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class PacketQueue {
    private static final Logger log = LoggerFactory.getLogger(PacketQueue.class);

    /**
     * Outcome of {@link #enqueue(String, byte[])}.
     */
    public enum EnqueueResult {
        /** The packet is queued. */
        ACCEPTED,
        /** The queue is at capacity; the packet was dropped. */
        FULL,
        /** The tunnel has no open queue; the packet was dropped. */
        CLOSED
    }

    private static final class TunnelQueue {
        private final ArrayDeque<QueuedPacket> packets = new ArrayDeque<>();
        private boolean open;
    }

    private final Map<String, TunnelQueue> queues = new ConcurrentHashMap<>();
    private final int maxPackets;
    private final long timeoutMillis;
    private final Clock clock;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong overflowed = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong rejectedClosed = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    /**
     * @param maxPackets    capacity of each per-tunnel queue
     * @param timeoutMillis maximum time a packet may wait
     * @param clock         time source
     */
    public PacketQueue(int maxPackets, long timeoutMillis, Clock clock) {
        if (maxPackets <= 0) {
            throw new IllegalArgumentException("maxPackets must be positive: " + maxPackets);
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
        this.maxPackets = maxPackets;
        this.timeoutMillis = timeoutMillis;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens (or reopens) the queue of a tunnel so it accepts packets.
     *
     * @param tunnelId tunnel id
     */
    public void open(String tunnelId) {
        TunnelQueue queue = queues.computeIfAbsent(tunnelId, id -> new TunnelQueue());
        synchronized (queue) {
            if (!queue.open) {
                queue.open = true;
                log.debug("Queue for tunnel {} opened", tunnelId);
            }
        }
    }

    /**
     * Queues a packet for a tunnel.
     *
     * @param tunnelId tunnel id
     * @param packet   raw IP bytes; the queue keeps the reference
     * @return what happened to the packet
     */
    public EnqueueResult enqueue(String tunnelId, byte[] packet) {
        Objects.requireNonNull(packet, "packet");
        TunnelQueue queue = queues.get(tunnelId);
        if (queue == null) {
            rejectedClosed.incrementAndGet();
            return EnqueueResult.CLOSED;
        }
        long now = clock.millis();
        synchronized (queue) {
            if (!queue.open) {
                rejectedClosed.incrementAndGet();
                return EnqueueResult.CLOSED;
            }
            dropExpiredHead(queue, now);
            if (queue.packets.size() >= maxPackets) {
                overflowed.incrementAndGet();
                log.warn("Queue for tunnel {} full ({} packets), dropping packet", tunnelId, maxPackets);
                return EnqueueResult.FULL;
            }
            queue.packets.addLast(new QueuedPacket(packet, now));
        }
        accepted.incrementAndGet();
        return EnqueueResult.ACCEPTED;
    }

    /**
     * Drains the queue of a tunnel. Expired packets are dropped, the rest are returned in the
     * order they were queued. The queue stays open.
     *
     * @param tunnelId tunnel id
     * @return the live packets, oldest first
     */
    public List<byte[]> flush(String tunnelId) {
        TunnelQueue queue = queues.get(tunnelId);
        if (queue == null) {
            return Collections.emptyList();
        }
        long now = clock.millis();
        List<byte[]> live = new ArrayList<>();
        int dropped = 0;
        synchronized (queue) {
            QueuedPacket queued;
            while ((queued = queue.packets.pollFirst()) != null) {
                if (queued.isExpired(now, timeoutMillis)) {
                    dropped++;
                } else {
                    live.add(queued.packet());
                }
            }
        }
        if (dropped > 0) {
            expired.addAndGet(dropped);
            log.warn("Dropped {} expired packets while flushing tunnel {}", dropped, tunnelId);
        }
        log.debug("Flushed {} packets for tunnel {}", live.size(), tunnelId);
        return live;
    }

    /**
     * Closes the queue of a tunnel and discards everything in it.
     *
     * @param tunnelId tunnel id
     * @return the number of packets discarded
     */
    public int seal(String tunnelId) {
        TunnelQueue queue = queues.get(tunnelId);
        if (queue == null) {
            return 0;
        }
        int count;
        synchronized (queue) {
            queue.open = false;
            count = queue.packets.size();
            queue.packets.clear();
        }
        if (count > 0) {
            discarded.addAndGet(count);
            log.warn("Discarded {} queued packets for tunnel {}", count, tunnelId);
        }
        return count;
    }

    /**
     * Seals the queue of a tunnel and forgets it.
     *
     * @param tunnelId tunnel id
     * @return the number of packets discarded
     */
    public int remove(String tunnelId) {
        int count = seal(tunnelId);
        queues.remove(tunnelId);
        return count;
    }

    /**
     * Drops expired packets from every queue.
     *
     * @return the number of packets dropped
     */
    public int sweepExpired() {
        long now = clock.millis();
        int total = 0;
        for (Map.Entry<String, TunnelQueue> entry : queues.entrySet()) {
            TunnelQueue queue = entry.getValue();
            int dropped;
            synchronized (queue) {
                dropped = 0;
                Iterator<QueuedPacket> it = queue.packets.iterator();
                while (it.hasNext()) {
                    if (it.next().isExpired(now, timeoutMillis)) {
                        it.remove();
                        dropped++;
                    }
                }
            }
            if (dropped > 0) {
                log.warn("Expired {} queued packets for tunnel {}", dropped, entry.getKey());
                total += dropped;
            }
        }
        expired.addAndGet(total);
        return total;
    }

    public boolean isOpen(String tunnelId) {
        TunnelQueue queue = queues.get(tunnelId);
        if (queue == null) {
            return false;
        }
        synchronized (queue) {
            return queue.open;
        }
    }

    public int size(String tunnelId) {
        TunnelQueue queue = queues.get(tunnelId);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.packets.size();
        }
    }

    public long getExpiredCount() {
        return expired.get();
    }

    public long getOverflowCount() {
        return overflowed.get();
    }

    public long getRejectedClosedCount() {
        return rejectedClosed.get();
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        Map<String, Integer> sizes = new HashMap<>();
        queues.keySet().forEach(id -> sizes.put(id, size(id)));
        stats.put("queueSizes", sizes);
        stats.put("accepted", accepted.get());
        stats.put("overflowed", overflowed.get());
        stats.put("expired", expired.get());
        stats.put("rejectedClosed", rejectedClosed.get());
        stats.put("discarded", discarded.get());
        return stats;
    }

    private void dropExpiredHead(TunnelQueue queue, long now) {
        int dropped = 0;
        QueuedPacket head;
        while ((head = queue.packets.peekFirst()) != null && head.isExpired(now, timeoutMillis)) {
            queue.packets.pollFirst();
            dropped++;
        }
        if (dropped > 0) {
            expired.addAndGet(dropped);
        }
    }
}
