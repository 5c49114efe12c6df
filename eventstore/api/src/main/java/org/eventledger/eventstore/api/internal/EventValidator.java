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

package org.eventledger.eventstore.api.internal;

import org.eventledger.eventstore.api.EventValidationException;
import org.eventledger.eventstore.api.PendingEvent;

import java.util.List;

/**
 * Validates stream ids and pending events against the limits of the persisted layout.
 */
public class EventValidator {
    public static final int MAX_STREAM_ID_LENGTH = 255;
    public static final int MAX_EVENT_TYPE_LENGTH = 100;
    public static final int MAX_SUBSCRIPTION_ID_LENGTH = 100;

    public static void validateStreamId(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new EventValidationException("Stream id cannot be null or blank");
        } else if (streamId.length() > MAX_STREAM_ID_LENGTH) {
            throw new EventValidationException("Stream id cannot be longer than " + MAX_STREAM_ID_LENGTH + " characters");
        }
    }

    public static void validateEvents(List<PendingEvent> events) {
        if (events == null) {
            throw new EventValidationException("Events cannot be null");
        }
        for (int i = 0; i < events.size(); i++) {
            PendingEvent event = events.get(i);
            if (event == null) {
                throw new EventValidationException("Event at index " + i + " is null");
            } else if (event.eventType().length() > MAX_EVENT_TYPE_LENGTH) {
                throw new EventValidationException("Event type " + event.eventType() + " is longer than " + MAX_EVENT_TYPE_LENGTH + " characters");
            }
        }
    }

    public static void validateSubscriptionId(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new IllegalArgumentException("Subscription id cannot be null or blank");
        } else if (subscriptionId.length() > MAX_SUBSCRIPTION_ID_LENGTH) {
            throw new IllegalArgumentException("Subscription id cannot be longer than " + MAX_SUBSCRIPTION_ID_LENGTH + " characters");
        }
    }

    public static void validateReadRange(long fromVersion, long toVersion, int limit) {
        if (fromVersion < 0) {
            throw new IllegalArgumentException("fromVersion must be greater than or equal to 0, was " + fromVersion);
        } else if (toVersion < fromVersion) {
            throw new IllegalArgumentException("toVersion (" + toVersion + ") cannot be less than fromVersion (" + fromVersion + ")");
        } else if (limit < 1) {
            throw new IllegalArgumentException("limit must be greater than 0, was " + limit);
        }
    }

    public static void validateFeedPosition(long afterGlobalPosition, int batchSize) {
        if (afterGlobalPosition < 0) {
            throw new IllegalArgumentException("afterGlobalPosition must be greater than or equal to 0, was " + afterGlobalPosition);
        } else if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be greater than 0, was " + batchSize);
        }
    }
}
