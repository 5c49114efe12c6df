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

/**
 * Stores the last acknowledged global position of a subscription, so that a consumer of the global feed can continue
 * where it left off after a restart.
 * <br><br>
 * A stored position never moves backward. Saving a position that is lower than or equal to the stored one is silently
 * ignored, which makes {@link #save(String, long)} safe to call with duplicate or out-of-order positions. Use
 * {@link #delete(String)} to start over.
 */
public interface SubscriptionPositionStorage {

    /**
     * @param subscriptionId The id of the subscription
     * @return The last acknowledged global position, {@code 0} if nothing has been stored for the subscription
     */
    long read(String subscriptionId);

    /**
     * Create the position for {@code subscriptionId} or advance it to {@code globalPosition} if it's greater than the stored one.
     *
     * @param subscriptionId The id of the subscription
     * @param globalPosition The global position of the last event that the subscription has processed
     * @return {@code true} if the position was created or advanced, {@code false} if it was ignored
     */
    boolean save(String subscriptionId, long globalPosition);

    /**
     * Delete the stored position of {@code subscriptionId}, the next {@link #read(String)} returns {@code 0} and the next
     * {@link #save(String, long)} creates the position anew. This is the only way to move a position backward.
     *
     * @param subscriptionId The id of the subscription to delete the position for
     */
    void delete(String subscriptionId);

    /**
     * @return {@code true} if a position is stored for {@code subscriptionId}, {@code false} otherwise.
     */
    boolean exists(String subscriptionId);
}
