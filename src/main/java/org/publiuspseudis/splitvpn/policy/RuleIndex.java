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
package org.publiuspseudis.splitvpn.policy;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.publiuspseudis.splitvpn.routing.ConnectionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The {@code RuleIndex} class is the router's in-memory view of the {@link PolicyStore}. Every
 * emission from the store replaces the whole index in one step, so a lookup sees either the old
 * rule set or the new one, never a mix.
 * </p>
 *
 * <p>
 * The index also keeps the identity map of the {@link ConnectionTracker} in line with the rules:
 * identities that gained a tunnel are bound, identities whose rule disappeared or lost its tunnel
 * are unbound.
 * </p>
 *
 * @author
 * Publius Pseudis
 */
public class RuleIndex implements PolicyStore.Listener {
    private static final Logger log = LoggerFactory.getLogger(RuleIndex.class);

    private final ConnectionTracker tracker;
    private volatile Map<String, AppRule> rules = Collections.emptyMap();
    private PolicyStore.Subscription subscription;

    public RuleIndex(ConnectionTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
    }

    /**
     * Subscribes to a store, replacing any earlier subscription.
     *
     * @param store the policy source
     */
    public synchronized void start(PolicyStore store) {
        stop();
        subscription = store.subscribe(this);
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    @Override
    public synchronized void onRulesChanged(Collection<AppRule> newRules) {
        Map<String, AppRule> next = new HashMap<>();
        for (AppRule rule : newRules) {
            if (next.put(rule.identity(), rule) != null) {
                log.warn("Duplicate rule for identity {}, keeping the last one", rule.identity());
            }
        }

        Map<String, AppRule> previous = rules;
        rules = Collections.unmodifiableMap(next);

        for (AppRule old : previous.values()) {
            AppRule now = next.get(old.identity());
            if (!old.isDirect() && (now == null || now.isDirect())) {
                tracker.clearForIdentity(old.identity());
            }
        }
        for (AppRule rule : next.values()) {
            if (!rule.isDirect()) {
                AppRule old = previous.get(rule.identity());
                if (old != null && !rule.tunnelId().equals(old.tunnelId())) {
                    tracker.clearForIdentity(rule.identity());
                }
                tracker.setIdentityToTunnel(rule.identity(), rule.tunnelId());
            }
        }
        log.info("Rule index refreshed: {} rules", next.size());
    }

    /**
     * @param identity app identity
     * @return the rule for the identity, or {@code null}
     */
    public AppRule lookup(String identity) {
        return identity == null ? null : rules.get(identity);
    }

    public int size() {
        return rules.size();
    }

    /**
     * Empties the index and unbinds every identity it had bound.
     */
    public synchronized void clear() {
        for (AppRule rule : rules.values()) {
            if (!rule.isDirect()) {
                tracker.clearForIdentity(rule.identity());
            }
        }
        rules = Collections.emptyMap();
    }
}
