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
package org.publiuspseudis.splitvpn.routing;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code ConnectionTracker} class remembers routing outcomes so that later packets of a flow
 * follow the first one. It keeps three tables:
 * </p>
 * <ul>
 *   <li><strong>Flow cache:</strong> (source address, source port) to {@link ConnectionEntry},
 *       expiring after a fixed TTL.</li>
 *   <li><strong>Identity map:</strong> app identity to tunnel id, the policy fallback used when a
 *       flow has no entry yet.</li>
 *   <li><strong>Address cache:</strong> address to the tunnels it was seen with, each row
 *       expiring after the same TTL. An address seen with more than one tunnel is ambiguous and
 *       resolves to nothing.</li>
 * </ul>
 *
 * <p>
 * The flow and address caches are soft-bounded: when one reaches its limit, stale entries are
 * evicted before the insert, and the insert goes ahead even if nothing was stale.
 * </p>
 *
 * <p>
 * <strong>Thread Safety:</strong> one read/write lock guards all three tables, so the removal
 * operations are atomic with respect to lookups.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class ConnectionTracker {
    private static final Logger log = LoggerFactory.getLogger(ConnectionTracker.class);

    private final Map<Long, ConnectionEntry> flows = new HashMap<>();
    private final Map<String, String> identityToTunnel = new HashMap<>();
    /**
     * Address cache: address to the tunnels it was seen with, each with the time it was last seen.
     */
    private final Map<Integer, Map<String, Long>> addressToTunnels = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final long ttlMillis;
    private final int maxEntries;
    private final Clock clock;

    /**
     * @param ttlMillis  flow entry lifetime
     * @param maxEntries soft limit of the flow cache
     * @param clock      time source
     */
    public ConnectionTracker(long ttlMillis, int maxEntries, Clock clock) {
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("ttlMillis must be positive: " + ttlMillis);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.ttlMillis = ttlMillis;
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private static long flowKey(int addr, int port) {
        return ((addr & 0xFFFFFFFFL) << 16) | (port & 0xFFFF);
    }

    /**
     * Records the outcome for a flow, replacing any previous one.
     *
     * @param srcAddr  source address
     * @param srcPort  source port
     * @param identity owning identity, may be {@code null}
     * @param tunnelId tunnel id, {@code null} for direct
     * @return the stored entry
     */
    public ConnectionEntry registerConnection(int srcAddr, int srcPort, String identity, String tunnelId) {
        ConnectionEntry entry = new ConnectionEntry(srcAddr, srcPort, identity, tunnelId, clock.millis());
        lock.writeLock().lock();
        try {
            if (flows.size() >= maxEntries) {
                int evicted = evictStaleLocked(entry.createdAt());
                log.debug("Flow cache at {} entries, evicted {} stale", maxEntries, evicted);
            }
            flows.put(flowKey(srcAddr, srcPort), entry);
        } finally {
            lock.writeLock().unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Registered flow {}", entry);
        }
        return entry;
    }

    /**
     * Looks up a flow. An expired entry is removed and reported as absent.
     *
     * @param srcAddr source address
     * @param srcPort source port
     * @return the live entry, or {@code null}
     */
    public ConnectionEntry lookupConnection(int srcAddr, int srcPort) {
        long key = flowKey(srcAddr, srcPort);
        long now = clock.millis();
        ConnectionEntry entry;
        lock.readLock().lock();
        try {
            entry = flows.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null || !entry.isExpired(now, ttlMillis)) {
            return entry;
        }
        lock.writeLock().lock();
        try {
            flows.remove(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Flow {} expired", entry);
        }
        return null;
    }

    /**
     * Forgets one flow.
     *
     * @param srcAddr source address
     * @param srcPort source port
     * @return {@code true} if an entry was removed
     */
    public boolean removeConnection(int srcAddr, int srcPort) {
        lock.writeLock().lock();
        try {
            return flows.remove(flowKey(srcAddr, srcPort)) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Binds an identity to a tunnel. A {@code null} tunnel removes the binding.
     *
     * @param identity app identity
     * @param tunnelId tunnel id or {@code null}
     */
    public void setIdentityToTunnel(String identity, String tunnelId) {
        Objects.requireNonNull(identity, "identity");
        lock.writeLock().lock();
        try {
            if (tunnelId == null) {
                identityToTunnel.remove(identity);
            } else {
                identityToTunnel.put(identity, tunnelId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Identity {} bound to {}", identity, tunnelId);
    }

    public String getTunnelForIdentity(String identity) {
        if (identity == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            return identityToTunnel.get(identity);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return a snapshot of the identity map
     */
    public Map<String, String> getIdentityMappings() {
        lock.readLock().lock();
        try {
            return new HashMap<>(identityToTunnel);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records that an address was seen with a tunnel. Rows expire with the same TTL as flows and
     * share the flow cache's soft limit.
     *
     * @param address  IPv4 address
     * @param tunnelId tunnel id
     */
    public void setTunnelForAddress(int address, String tunnelId) {
        Objects.requireNonNull(tunnelId, "tunnelId");
        long now = clock.millis();
        lock.writeLock().lock();
        try {
            if (addressToTunnels.size() >= maxEntries && !addressToTunnels.containsKey(address)) {
                int evicted = evictStaleAddressesLocked(now);
                log.debug("Address cache at {} entries, evicted {} stale", maxEntries, evicted);
            }
            addressToTunnels.computeIfAbsent(address, a -> new HashMap<>()).put(tunnelId, now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param address IPv4 address
     * @return the single tunnel the address was seen with within the TTL, or {@code null} if none
     *         or ambiguous
     */
    public String getTunnelForAddress(int address) {
        long now = clock.millis();
        lock.readLock().lock();
        try {
            Map<String, Long> tunnels = addressToTunnels.get(address);
            if (tunnels == null) {
                return null;
            }
            String found = null;
            for (Map.Entry<String, Long> row : tunnels.entrySet()) {
                if (now - row.getValue() > ttlMillis) {
                    continue;
                }
                if (found != null) {
                    return null;
                }
                found = row.getKey();
            }
            return found;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes an identity binding and every flow owned by that identity.
     *
     * @param identity app identity
     * @return the number of flows removed
     */
    public int clearForIdentity(String identity) {
        int removed = 0;
        lock.writeLock().lock();
        try {
            identityToTunnel.remove(identity);
            Iterator<ConnectionEntry> it = flows.values().iterator();
            while (it.hasNext()) {
                if (Objects.equals(it.next().identity(), identity)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Cleared identity {} ({} flows)", identity, removed);
        return removed;
    }

    /**
     * Removes everything that points at a tunnel: its flows, the identities bound to it and its
     * address cache rows.
     *
     * @param tunnelId tunnel id
     * @return the number of flows removed
     */
    public int clearForTunnel(String tunnelId) {
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<ConnectionEntry> it = flows.values().iterator();
            while (it.hasNext()) {
                if (tunnelId.equals(it.next().tunnelId())) {
                    it.remove();
                    removed++;
                }
            }
            identityToTunnel.values().removeIf(tunnelId::equals);
            Iterator<Map<String, Long>> rows = addressToTunnels.values().iterator();
            while (rows.hasNext()) {
                Map<String, Long> tunnels = rows.next();
                tunnels.remove(tunnelId);
                if (tunnels.isEmpty()) {
                    rows.remove();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Cleared tracking state of tunnel {} ({} flows)", tunnelId, removed);
        return removed;
    }

    /**
     * Clears the flow and address caches but keeps identity bindings, which come from policy.
     */
    public void clearTransientMappings() {
        lock.writeLock().lock();
        try {
            flows.clear();
            addressToTunnels.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearAll() {
        lock.writeLock().lock();
        try {
            flows.clear();
            addressToTunnels.clear();
            identityToTunnel.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes flows and address cache rows older than the TTL.
     *
     * @return the number of flows removed
     */
    public int evictStale() {
        long now = clock.millis();
        lock.writeLock().lock();
        try {
            int addresses = evictStaleAddressesLocked(now);
            if (addresses > 0) {
                log.debug("Evicted {} stale address cache rows", addresses);
            }
            return evictStaleLocked(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int evictStaleLocked(long now) {
        int before = flows.size();
        flows.values().removeIf(entry -> entry.isExpired(now, ttlMillis));
        return before - flows.size();
    }

    private int evictStaleAddressesLocked(long now) {
        int removed = 0;
        Iterator<Map<String, Long>> rows = addressToTunnels.values().iterator();
        while (rows.hasNext()) {
            Map<String, Long> tunnels = rows.next();
            int before = tunnels.size();
            tunnels.values().removeIf(lastSeen -> now - lastSeen > ttlMillis);
            removed += before - tunnels.size();
            if (tunnels.isEmpty()) {
                rows.remove();
            }
        }
        return removed;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return flows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        lock.readLock().lock();
        try {
            stats.put("connectionCount", flows.size());
            stats.put("identityCount", identityToTunnel.size());
            stats.put("addressCount", addressToTunnels.size());
        } finally {
            lock.readLock().unlock();
        }
        stats.put("ttlMillis", ttlMillis);
        return stats;
    }

    @Override
    public String toString() {
        return "ConnectionTracker{flows=" + size() + ", ttl=" + ttlMillis + "ms}";
    }
}
