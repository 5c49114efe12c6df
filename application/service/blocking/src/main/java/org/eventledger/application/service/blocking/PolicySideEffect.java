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

package org.eventledger.application.service.blocking;

import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A side effect that runs policies for the events that were appended by an {@link ApplicationService}.
 *
 * <pre>
 * applicationService.execute(streamId, domainFunction, executePolicy(AccountOpened.class, welcomeMails::send));
 * </pre>
 * <p>
 * The policy is only invoked for the new events that are instances of the given type.
 *
 * @param <T> The type of your domain events
 */
@NullMarked
@FunctionalInterface
public interface PolicySideEffect<T> extends Consumer<List<T>> {

    static <T, E extends T> PolicySideEffect<T> executePolicy(Class<E> eventType, Consumer<E> policy) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(policy, "Policy cannot be null");
        return events -> events.stream()
                .filter(eventType::isInstance)
                .map(eventType::cast)
                .forEach(policy);
    }

    /**
     * Compose this policy with another one, the other policy runs after this one.
     */
    default <E extends T> PolicySideEffect<T> andThenExecuteAnotherPolicy(Class<E> eventType, Consumer<E> policy) {
        PolicySideEffect<T> next = executePolicy(eventType, policy);
        return events -> {
            accept(events);
            next.accept(events);
        };
    }
}
