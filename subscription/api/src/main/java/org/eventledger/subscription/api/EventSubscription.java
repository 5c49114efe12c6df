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

package org.eventledger.subscription.api;

import org.jspecify.annotations.NullMarked;

/**
 * A handler registration returned by {@link EventPublisher#subscribe(String, EventHandler)}.
 */
@NullMarked
public interface EventSubscription {

    /**
     * @return The event type the handler is registered for, or {@link EventPublisher#WILDCARD}
     */
    String eventType();

    /**
     * Remove the handler from the publisher. Events published after this call returns are not delivered to the handler.
     * Calling {@code cancel} more than once has no effect.
     */
    void cancel();

    boolean isActive();
}
