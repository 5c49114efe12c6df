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

import org.eventledger.eventstore.api.Event;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.PendingEvent;
import org.eventledger.eventstore.api.WriteResult;
import org.eventledger.eventstore.inmemory.InMemoryEventStore;
import org.eventledger.subscription.api.EventSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventPublisherTest {

    private CopyOnWriteArrayList<Throwable> handlerErrors;
    private InMemoryEventPublisher publisher;

    @BeforeEach
    void create_publisher() {
        handlerErrors = new CopyOnWriteArrayList<>();
        publisher = new InMemoryEventPublisher((event, error) -> handlerErrors.add(error));
    }

    @Nested
    @DisplayName("dispatch")
    class DispatchTest {

        @Test
        void handlers_for_the_event_type_run_before_wildcard_handlers_in_registration_order() {
            // Given
            CopyOnWriteArrayList<String> invocations = new CopyOnWriteArrayList<>();
            publisher.subscribeAll(e -> invocations.add("wildcard-1"));
            publisher.subscribe("TaskCreated", e -> invocations.add("specific-1"));
            publisher.subscribe("TaskCompleted", e -> invocations.add("other-type"));
            publisher.subscribe("TaskCreated", e -> invocations.add("specific-2"));
            publisher.subscribeAll(e -> invocations.add("wildcard-2"));

            // When
            publisher.publish(event(1, "TaskCreated"));

            // Then
            assertThat(invocations).containsExactly("specific-1", "specific-2", "wildcard-1", "wildcard-2");
        }

        @Test
        void failing_handler_does_not_prevent_other_handlers_from_running() {
            // Given
            CopyOnWriteArrayList<Event> handled = new CopyOnWriteArrayList<>();
            publisher.subscribe("TaskCreated", e -> {
                throw new IllegalStateException("expected");
            });
            publisher.subscribe("TaskCreated", handled::add);
            publisher.subscribeAll(handled::add);
            Event event = event(1, "TaskCreated");

            // When
            publisher.publish(event);

            // Then
            assertAll(
                    () -> assertThat(handled).containsExactly(event, event),
                    () -> assertThat(handlerErrors).singleElement().isInstanceOf(IllegalStateException.class)
            );
        }

        @Test
        void cancelled_handlers_are_not_invoked() {
            // Given
            CopyOnWriteArrayList<Event> handled = new CopyOnWriteArrayList<>();
            EventSubscription subscription = publisher.subscribe("TaskCreated", handled::add);

            // When
            subscription.cancel();
            subscription.cancel();
            publisher.publish(event(1, "TaskCreated"));

            // Then
            assertAll(
                    () -> assertThat(subscription.isActive()).isFalse(),
                    () -> assertThat(handled).isEmpty()
            );
        }

        @Test
        void publishing_an_event_without_handlers_does_nothing() {
            publisher.publish(event(1, "Unknown"));

            assertThat(handlerErrors).isEmpty();
        }
    }

    @Nested
    @DisplayName("as after commit listener of an event store")
    class AfterCommitTest {

        @Test
        void committed_events_are_published_in_append_order() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore(publisher);
            CopyOnWriteArrayList<Long> positions = new CopyOnWriteArrayList<>();
            publisher.subscribeAll(e -> positions.add(e.globalPosition()));

            // When
            WriteResult writeResult = eventStore.append("task-1", ExpectedVersion.noStream(), List.of(PendingEvent.of("TaskCreated", Map.of()), PendingEvent.of("TaskCompleted", Map.of())));

            // Then
            assertThat(positions).containsExactlyElementsOf(writeResult.getGlobalPositions());
        }

        @Test
        void failing_handler_never_reaches_the_caller_of_append() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore(publisher);
            publisher.subscribeAll(e -> {
                throw new IllegalStateException("expected");
            });

            // When
            long globalPosition = eventStore.appendEvent("task-1", ExpectedVersion.noStream(), PendingEvent.of("TaskCreated", Map.of()));

            // Then
            assertAll(
                    () -> assertThat(globalPosition).isEqualTo(1),
                    () -> assertThat(eventStore.exists("task-1")).isTrue(),
                    () -> assertThat(handlerErrors).hasSize(1)
            );
        }
    }

    private static Event event(long globalPosition, String eventType) {
        return new Event(globalPosition, "task-1", globalPosition - 1, eventType, Map.of(), Map.of(), null, OffsetDateTime.now(ZoneOffset.UTC));
    }
}
