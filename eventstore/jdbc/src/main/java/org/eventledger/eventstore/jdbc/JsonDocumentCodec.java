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

package org.eventledger.eventstore.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.eventledger.eventstore.api.EventValidationException;
import org.eventledger.eventstore.api.FatalStorageException;

import java.util.Map;

/**
 * Converts payload and metadata documents to and from their JSON text representation.
 */
class JsonDocumentCodec {
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader documentReader;

    JsonDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // Same number types as the documents of a PendingEvent
        this.documentReader = objectMapper.readerFor(DOCUMENT)
                .with(DeserializationFeature.USE_LONG_FOR_INTS)
                .without(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    String serialize(String eventType, String field, Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("The " + field + " of event " + eventType + " cannot be serialized to JSON", e);
        }
    }

    Map<String, Object> deserialize(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return documentReader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new FatalStorageException("Failed to parse stored JSON document", e);
        }
    }
}
