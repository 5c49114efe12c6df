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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Makes immutable copies of payload and metadata documents. Values are normalized to the types that a document has
 * after it's been stored as JSON and read back, so every integral number becomes a {@link Long} (or a {@link BigInteger}
 * if it doesn't fit), every decimal number a {@link Double}, every collection or array a {@link List} and every nested
 * object a {@link Map} with string keys. Anything else is rejected.
 */
public class Documents {

    public static Map<String, Object> immutableCopyOf(Map<String, Object> document, String description) {
        return copyOfObject(document, description, "");
    }

    private static Map<String, Object> copyOfObject(Map<?, ?> document, String description, String path) {
        Map<String, Object> copy = new LinkedHashMap<>(document.size());
        document.forEach((key, value) -> {
            if (!(key instanceof String name)) {
                throw new EventValidationException("Key " + key + " at " + pathOrRoot(path) + " of " + description + " is not a string");
            }
            String fieldPath = path.isEmpty() ? name : path + "." + name;
            copy.put(name, normalize(value, description, fieldPath));
        });
        return Collections.unmodifiableMap(copy);
    }

    private static List<Object> copyOfArray(Iterable<?> elements, String description, String path) {
        List<Object> copy = new ArrayList<>();
        int index = 0;
        for (Object element : elements) {
            copy.add(normalize(element, description, path + "[" + index++ + "]"));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Object normalize(Object value, String description, String path) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return ((Number) value).longValue();
        } else if (value instanceof BigInteger bigInteger) {
            return bigInteger.bitLength() < 64 ? (Object) bigInteger.longValue() : bigInteger;
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double decimal = ((Number) value).doubleValue();
            if (Double.isNaN(decimal) || Double.isInfinite(decimal)) {
                throw new EventValidationException("Number " + value + " at " + path + " of " + description + " cannot be represented in JSON");
            }
            return decimal;
        } else if (value instanceof Map<?, ?> map) {
            return copyOfObject(map, description, path);
        } else if (value instanceof Collection<?> collection) {
            return copyOfArray(collection, description, path);
        } else if (value instanceof Object[] array) {
            return copyOfArray(Arrays.asList(array), description, path);
        }
        throw new EventValidationException("Value of type " + value.getClass().getName() + " at " + path + " of " + description + " is not a JSON value");
    }

    private static String pathOrRoot(String path) {
        return path.isEmpty() ? "the root" : path;
    }
}
