package io.github.goodees.aggregates.core.serialization;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.store.RecordedEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads events and their metadata from the log into their newest in-memory shape.
 */
public class EventDeserializer {
    private final Serializer serializer;
    private final EventContractRegistry registry;

    public EventDeserializer(Serializer serializer, EventContractRegistry registry) {
        this.serializer = Objects.requireNonNull(serializer, "Serializer must be provided");
        this.registry = Objects.requireNonNull(registry, "Registry must be provided");
    }

    /**
     * Deserialize an event as the type registered for its wire type, then upgrade it.
     * @param event recorded event
     * @return the upgraded event
     * @throws UnknownEventTypeException when the event type is not registered
     */
    public Object deserialize(RecordedEvent event) {
        EventContractRegistry.Registration<?> registration = registry.findByWireType(event.getEventType())
                .orElseThrow(() -> new UnknownEventTypeException(event.getEventType()));
        Object payload = serializer.deserialize(event.getData(), registration.getType());
        return registry.upgrade(payload);
    }

    /**
     * Deserialize an event that must be of given type.
     * @param event recorded event
     * @param type expected type
     * @param <E> expected type
     * @return the upgraded event
     * @throws SerializationException when the event is of other type
     */
    public <E> E deserialize(RecordedEvent event, Class<E> type) {
        Object result = deserialize(event);
        if (!type.isInstance(result)) {
            throw new SerializationException("Event " + event + " was read as " + result.getClass().getName()
                    + ", which is not " + type.getName());
        }
        return type.cast(result);
    }

    /**
     * @param event recorded event
     * @return metadata of the event, empty when the event has none
     */
    public Map<String, Object> deserializeMetadata(RecordedEvent event) {
        byte[] metadata = event.getMetadata();
        if (metadata.length == 0) {
            return Collections.emptyMap();
        }
        Map<?, ?> raw = serializer.deserialize(metadata, Map.class);
        if (raw == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(String.valueOf(k), v));
        return Collections.unmodifiableMap(result);
    }
}
