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

/**
 * A reactive source of {@link AppRule}s. Subscribers receive the complete current rule set right
 * away and again after every change. Nothing on the packet path ever queries a store directly.
 *
 * @author
 * Publius Pseudis
 */
public interface PolicyStore {

    /**
     * Receives complete rule sets.
     */
    interface Listener {
        void onRulesChanged(Collection<AppRule> rules);
    }

    /**
     * Handle for an active subscription.
     */
    interface Subscription extends AutoCloseable {
        /**
         * Stops delivery to the listener.
         */
        @Override
        void close();
    }

    /**
     * Subscribes to rule changes.
     *
     * @param listener receiver of rule sets
     * @return the subscription handle
     */
    Subscription subscribe(Listener listener);
}
