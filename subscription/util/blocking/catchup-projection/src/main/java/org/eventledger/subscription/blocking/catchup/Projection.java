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

package org.eventledger.subscription.blocking.catchup;

import org.eventledger.eventstore.api.Event;

/**
 * A read model that is derived from events. A projection must be idempotent: an event can be applied more than once
 * if the process stops after the event was applied but before the position was stored.
 */
@FunctionalInterface
public interface Projection {

    void apply(Event event);

    /**
     * Clear the read model before it's rebuilt from the beginning of the global feed.
     */
    default void reset() {
    }
}
