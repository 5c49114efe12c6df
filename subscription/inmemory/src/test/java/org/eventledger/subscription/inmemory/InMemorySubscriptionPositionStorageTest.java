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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemorySubscriptionPositionStorageTest {

    private final InMemorySubscriptionPositionStorage storage = new InMemorySubscriptionPositionStorage();

    @Test
    void position_of_an_unknown_subscription_is_zero() {
        assertAll(
                () -> assertThat(storage.read("projection")).isZero(),
                () -> assertThat(storage.exists("projection")).isFalse()
        );
    }

    @Test
    void position_never_moves_backward() {
        // When
        boolean created = storage.save("projection", 10);
        boolean lowered = storage.save("projection", 5);
        boolean repeated = storage.save("projection", 10);
        boolean advanced = storage.save("projection", 12);

        // Then
        assertAll(
                () -> assertThat(created).isTrue(),
                () -> assertThat(lowered).isFalse(),
                () -> assertThat(repeated).isFalse(),
                () -> assertThat(advanced).isTrue(),
                () -> assertThat(storage.read("projection")).isEqualTo(12)
        );
    }

    @Test
    void deleted_position_starts_over_from_zero() {
        // Given
        storage.save("projection", 10);

        // When
        storage.delete("projection");
        boolean recreated = storage.save("projection", 2);

        // Then
        assertAll(
                () -> assertThat(recreated).isTrue(),
                () -> assertThat(storage.read("projection")).isEqualTo(2)
        );
    }
}
