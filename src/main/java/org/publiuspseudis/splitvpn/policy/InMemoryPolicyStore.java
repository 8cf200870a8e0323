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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PolicyStore} kept in memory. Used when rules are managed by the embedding application
 * rather than loaded from persistent storage.
 *
 * @author
 * Publius Pseudis
 */
public class InMemoryPolicyStore implements PolicyStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPolicyStore.class);

    private final Map<String, AppRule> rules = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(Listener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        listener.onRulesChanged(snapshot());
        return () -> listeners.remove(listener);
    }

    /**
     * Adds or replaces the rule for an identity.
     *
     * @param rule the rule
     */
    public void put(AppRule rule) {
        rules.put(rule.identity(), rule);
        publish();
    }

    /**
     * Removes the rule for an identity.
     *
     * @param identity app identity
     * @return {@code true} if a rule was removed
     */
    public boolean remove(String identity) {
        boolean removed = rules.remove(identity) != null;
        if (removed) {
            publish();
        }
        return removed;
    }

    /**
     * Replaces the whole rule set.
     *
     * @param newRules the new rules
     */
    public void replaceAll(Collection<AppRule> newRules) {
        rules.clear();
        newRules.forEach(rule -> rules.put(rule.identity(), rule));
        publish();
    }

    public Collection<AppRule> snapshot() {
        return new ArrayList<>(rules.values());
    }

    private void publish() {
        Collection<AppRule> current = snapshot();
        for (Listener listener : listeners) {
            try {
                listener.onRulesChanged(current);
            } catch (RuntimeException e) {
                log.error("Policy listener failed", e);
            }
        }
    }
}
