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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Packet counters of a {@link Router}.
 *
 * @author
 * Publius Pseudis
 */
public class RouterStats {
    final AtomicLong forwarded = new AtomicLong();
    final AtomicLong queued = new AtomicLong();
    final AtomicLong direct = new AtomicLong();
    final AtomicLong droppedMalformed = new AtomicLong();
    final AtomicLong droppedError = new AtomicLong();
    final AtomicLong queueOverflow = new AtomicLong();
    final AtomicLong queueRejectedClosed = new AtomicLong();
    final AtomicLong inboundDelivered = new AtomicLong();
    final AtomicLong inboundDropped = new AtomicLong();
    final AtomicLong sendFailures = new AtomicLong();
    final AtomicLong droppedTunnelDown = new AtomicLong();

    public long getForwarded() {
        return forwarded.get();
    }

    public long getQueued() {
        return queued.get();
    }

    public long getDirect() {
        return direct.get();
    }

    public long getDroppedMalformed() {
        return droppedMalformed.get();
    }

    public long getDroppedError() {
        return droppedError.get();
    }

    public long getQueueOverflow() {
        return queueOverflow.get();
    }

    public long getQueueRejectedClosed() {
        return queueRejectedClosed.get();
    }

    public long getInboundDelivered() {
        return inboundDelivered.get();
    }

    public long getInboundDropped() {
        return inboundDropped.get();
    }

    public long getSendFailures() {
        return sendFailures.get();
    }

    /**
     * @return forwards dropped because the tunnel stopped being ready after the decision
     */
    public long getDroppedTunnelDown() {
        return droppedTunnelDown.get();
    }

    /**
     * @param queueExpired expired count reported by the packet queue
     * @return all counters by name
     */
    public Map<String, Object> toMap(long queueExpired) {
        Map<String, Object> stats = new HashMap<>();
        stats.put("forwarded", forwarded.get());
        stats.put("queued", queued.get());
        stats.put("direct", direct.get());
        stats.put("droppedMalformed", droppedMalformed.get());
        stats.put("droppedError", droppedError.get());
        stats.put("queueOverflow", queueOverflow.get());
        stats.put("queueExpired", queueExpired);
        stats.put("queueRejectedClosed", queueRejectedClosed.get());
        stats.put("inboundDelivered", inboundDelivered.get());
        stats.put("inboundDropped", inboundDropped.get());
        stats.put("sendFailures", sendFailures.get());
        stats.put("droppedTunnelDown", droppedTunnelDown.get());
        return stats;
    }
}
