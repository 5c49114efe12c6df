/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventledger.subscription.inmemory;

import org.eventledger.subscription.api.SubscriptionPositionStorage;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.eventledger.eventstore.api.internal.EventValidator.validateSubscriptionId;

/**
 * Keeps subscription positions in memory, useful for tests.
 */
public class InMemorySubscriptionPositionStorage implements SubscriptionPositionStorage {

    private final ConcurrentMap<String, Long> positions = new ConcurrentHashMap<>();

    @Override
    public long read(String subscriptionId) {
        validateSubscriptionId(subscriptionId);
        return positions.getOrDefault(subscriptionId, 0L);
    }

    @Override
    public boolean save(String subscriptionId, long globalPosition) {
        validateSubscriptionId(subscriptionId);
        if (globalPosition < 0) {
            throw new IllegalArgumentException("Global position cannot be negative, was " + globalPosition);
        }
        AtomicBoolean changed = new AtomicBoolean();
        positions.compute(subscriptionId, (__, current) -> {
            if (current == null || globalPosition > current) {
                changed.set(true);
                return globalPosition;
            }
            return current;
        });
        return changed.get();
    }

    @Override
    public void delete(String subscriptionId) {
        validateSubscriptionId(subscriptionId);
        positions.remove(subscriptionId);
    }

    @Override
    public boolean exists(String subscriptionId) {
        validateSubscriptionId(subscriptionId);
        return positions.containsKey(subscriptionId);
    }
}
