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

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.publiuspseudis.splitvpn.network.IPPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code RouteTable} class maps destination networks to tunnels. Routes are pushed by tunnel
 * servers when a session comes up and removed as a group when the tunnel goes away.
 * </p>
 *
 * <p>
 * <strong>Lookup:</strong> longest prefix wins. Among routes with the same prefix length, the
 * most recently added one wins. A {@code /0} route is an ordinary default route.
 * </p>
 *
 * <p>
 * <strong>Thread Safety:</strong> lookups take a shared read lock; adds and removals take the
 * write lock. Tables are small (tens of routes), so lookup is a linear scan.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class RouteTable {
    private static final Logger log = LoggerFactory.getLogger(RouteTable.class);

    private final List<RouteEntry> routes = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Adds a route. Adding the same network, prefix and tunnel again refreshes its position in
     * the tie-break order instead of creating a duplicate.
     *
     * @param network      network address as an int; host bits are ignored
     * @param prefixLength prefix length, 0 to 32
     * @param tunnelId     tunnel carrying the route
     * @return the stored entry
     * @throws IllegalArgumentException if the prefix length is out of range
     */
    public RouteEntry addRoute(int network, int prefixLength, String tunnelId) {
        RouteEntry entry = new RouteEntry(network, prefixLength, tunnelId, sequence.getAndIncrement());
        lock.writeLock().lock();
        try {
            routes.removeIf(r -> r.sameRoute(network, prefixLength, tunnelId));
            routes.add(entry);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Route {} added", entry);
        return entry;
    }

    /**
     * Adds a route given as an {@link InetAddress}. Non-IPv4 networks and invalid prefixes are
     * rejected with a warning.
     *
     * @param network      network address
     * @param prefixLength prefix length
     * @param tunnelId     tunnel carrying the route
     * @return the stored entry, or {@code null} if the route was rejected
     */
    public RouteEntry addRoute(InetAddress network, int prefixLength, String tunnelId) {
        if (!(network instanceof Inet4Address)) {
            log.warn("Ignoring non-IPv4 route {}/{} for tunnel {}", network, prefixLength, tunnelId);
            return null;
        }
        if (prefixLength < 0 || prefixLength > 32) {
            log.warn("Ignoring route {}/{} for tunnel {}: invalid prefix length",
                    network.getHostAddress(), prefixLength, tunnelId);
            return null;
        }
        return addRoute(IPPacket.toInt(network), prefixLength, tunnelId);
    }

    /**
     * Removes every route that belongs to a tunnel.
     *
     * @param tunnelId tunnel id
     * @return the number of routes removed
     */
    public int removeRoutesForTunnel(String tunnelId) {
        int removed;
        lock.writeLock().lock();
        try {
            int before = routes.size();
            routes.removeIf(r -> r.getTunnelId().equals(tunnelId));
            removed = before - routes.size();
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.info("Removed {} routes of tunnel {}", removed, tunnelId);
        }
        return removed;
    }

    /**
     * Finds the tunnel for a destination.
     *
     * @param destination IPv4 address as an int
     * @return the tunnel id of the best matching route, or {@code null} if none matches
     */
    public String lookup(int destination) {
        RouteEntry best = lookupEntry(destination);
        return best == null ? null : best.getTunnelId();
    }

    /**
     * Finds the best matching route for a destination.
     *
     * @param destination IPv4 address as an int
     * @return the best route, or {@code null}
     */
    public RouteEntry lookupEntry(int destination) {
        lock.readLock().lock();
        try {
            RouteEntry best = null;
            for (RouteEntry route : routes) {
                if (!route.matches(destination)) {
                    continue;
                }
                if (best == null
                        || route.getPrefixLength() > best.getPrefixLength()
                        || (route.getPrefixLength() == best.getPrefixLength()
                            && route.getSequence() > best.getSequence())) {
                    best = route;
                }
            }
            return best;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param tunnelId tunnel id
     * @return the routes of one tunnel
     */
    public List<RouteEntry> routesForTunnel(String tunnelId) {
        lock.readLock().lock();
        try {
            List<RouteEntry> result = new ArrayList<>();
            for (RouteEntry route : routes) {
                if (route.getTunnelId().equals(tunnelId)) {
                    result.add(route);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RouteEntry> getRoutes() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(routes);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return routes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            routes.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Route table cleared");
    }
}
