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

/**
 * Base class for storage failures that are not related to the version check.
 *
 * @see TransientStorageException
 * @see FatalStorageException
 */
public abstract class EventStoreException extends RuntimeException {

    protected EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} if the operation may succeed if it's retried (with backoff), {@code false} otherwise.
     */
    public abstract boolean isRetryable();
}
