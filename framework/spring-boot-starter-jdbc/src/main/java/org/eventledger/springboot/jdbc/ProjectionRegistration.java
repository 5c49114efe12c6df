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

package org.eventledger.springboot.jdbc;

import org.eventledger.subscription.blocking.catchup.Projection;

import java.util.Objects;
import java.util.Set;

/**
 * Declare a bean of this type to have the projection registered with the auto-configured
 * {@link org.eventledger.subscription.blocking.catchup.CatchupProjectionRunner}.
 *
 * @param subscriptionId The id the position of the projection is stored under
 * @param eventTypes     The event types to project, empty means all
 * @param projection     The projection
 */
public record ProjectionRegistration(String subscriptionId, Set<String> eventTypes, Projection projection) {

    public ProjectionRegistration {
        Objects.requireNonNull(subscriptionId, "Subscription id cannot be null");
        Objects.requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static ProjectionRegistration of(String subscriptionId, Projection projection, String... eventTypes) {
        return new ProjectionRegistration(subscriptionId, Set.of(eventTypes), projection);
    }
}
