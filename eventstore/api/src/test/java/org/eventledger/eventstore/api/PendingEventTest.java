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

package org.eventledger.eventstore.api;

import org.eventledger.eventstore.api.internal.EventValidator;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class PendingEventTest {

    @Test
    void metadata_defaults_to_an_empty_document() {
        PendingEvent event = new PendingEvent("TaskCreated", Map.of("title", "Write docs"), null, null);

        assertThat(event.metadata()).isEmpty();
    }

    @Test
    void payload_is_copied_so_that_later_changes_to_the_source_are_not_visible() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put("title", "Write docs");
        PendingEvent event = PendingEvent.of("TaskCreated", payload);

        // When
        payload.put("title", "Changed");

        // Then
        assertThat(event.payload()).containsEntry("title", "Write docs");
    }

    @Test
    void numbers_are_normalized_to_long_and_double_at_every_depth() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put("count", 5);
        payload.put("huge", new BigInteger("123456789012345678901234567890"));
        payload.put("price", new BigDecimal("9.75"));
        payload.put("nested", Map.of("sizes", new Object[]{(short) 1, 2.5f}));

        // When
        PendingEvent event = PendingEvent.of("TaskCreated", payload, Map.of("attempt", new AtomicInteger(2)));

        // Then
        assertAll(
                () -> assertThat(event.payload()).containsEntry("count", 5L),
                () -> assertThat(event.payload()).containsEntry("huge", new BigInteger("123456789012345678901234567890")),
                () -> assertThat(event.payload()).containsEntry("price", 9.75d),
                () -> assertThat(event.payload()).containsEntry("nested", Map.of("sizes", List.of(1L, 2.5d))),
                () -> assertThat(event.metadata()).isEqualTo(Map.of("attempt", 2L))
        );
    }

    @Test
    void values_that_have_no_json_representation_are_rejected_with_their_path() {
        Throwable throwable = catchThrowable(() -> PendingEvent.of("TaskCreated", Map.of("schedule", Map.of("due", List.of(LocalDate.of(2024, 3, 1))))));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class)
                .hasMessageContaining("schedule.due[0]")
                .hasMessageContaining("payload of event TaskCreated");
    }

    @Test
    void not_a_number_is_rejected() {
        Throwable throwable = catchThrowable(() -> PendingEvent.of("TaskCreated", Map.of("ratio", Double.NaN)));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class);
    }

    @Test
    void nested_documents_must_have_string_keys() {
        Throwable throwable = catchThrowable(() -> PendingEvent.of("TaskCreated", Map.of("byId", Map.of(1, "one"))));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class).hasMessageContaining("byId");
    }

    @Test
    void nested_documents_are_immutable() {
        PendingEvent event = PendingEvent.of("TaskCreated", Map.of("tags", new ArrayList<>(List.of("a"))));

        @SuppressWarnings("unchecked")
        List<Object> tags = (List<Object>) event.payload().get("tags");
        Throwable throwable = catchThrowable(() -> tags.add("b"));

        assertThat(throwable).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void blank_event_type_is_rejected() {
        Throwable throwable = catchThrowable(() -> PendingEvent.of(" ", Map.of()));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class);
    }

    @Test
    void null_payload_is_rejected() {
        Throwable throwable = catchThrowable(() -> PendingEvent.of("TaskCreated", null));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class).hasMessageContaining("TaskCreated");
    }

    @Test
    void event_types_longer_than_the_column_are_rejected() {
        List<PendingEvent> events = List.of(PendingEvent.of("x".repeat(101), Map.of()));

        Throwable throwable = catchThrowable(() -> EventValidator.validateEvents(events));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class);
    }

    @Test
    void null_events_in_the_list_are_rejected() {
        Throwable throwable = catchThrowable(() -> EventValidator.validateEvents(Arrays.asList(PendingEvent.of("TaskCreated", Map.of()), null)));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class).hasMessage("Event at index 1 is null");
    }

    @Test
    void blank_stream_id_is_rejected() {
        Throwable throwable = catchThrowable(() -> EventValidator.validateStreamId(""));

        assertThat(throwable).isExactlyInstanceOf(EventValidationException.class);
    }
}
