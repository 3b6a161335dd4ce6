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

import io.github.goodees.aggregates.core.Aggregate;
import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.contract.EventType;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.saga.LinkedEvent;
import io.github.goodees.aggregates.core.store.EventData;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Prepares changes of aggregates for append. One instance serves single commit, as it tracks the offset of every
 * event relative to the version its aggregate was loaded at.
 * <p>Changes of sagas ({@link LinkedEvent}) are written as link events pointing to the original event.</p>
 */
public class EventDataFactory {
    private final Serializer serializer;
    private final EventContractRegistry registry;
    private final Map<AggregateIdentifier, Integer> offsets = new HashMap<>();

    public EventDataFactory(Serializer serializer, EventContractRegistry registry) {
        this.serializer = Objects.requireNonNull(serializer, "Serializer must be provided");
        this.registry = Objects.requireNonNull(registry, "Registry must be provided");
    }

    /**
     * Create event data for a change. The change contributes its metadata to the scope before the metadata of the
     * event is captured.
     * @param aggregate aggregate the change belongs to
     * @param change the event, or {@link LinkedEvent}
     * @param metadata metadata scope of the commit
     * @return data to append
     */
    public EventData create(Aggregate aggregate, Object change, MetadataScope metadata) {
        AggregateIdentifier identifier = aggregate.getIdentifier();
        int offset = offsets.merge(identifier, 1, Integer::sum) - 1;
        if (change instanceof LinkedEvent) {
            LinkedEvent link = (LinkedEvent) change;
            byte[] data = link.toLinkData().getBytes(StandardCharsets.UTF_8);
            metadata.contributeFrom(link.getEvent());
            UUID eventId = EventIdentity.create(identifier, aggregate.getRoot().getVersion(), offset, data,
                    EventType.defaultTypeName(link.getEvent().getClass()));
            return new EventData(eventId, EventData.LINK_EVENT_TYPE, data, serializer.serialize(metadata.toMap()));
        }
        byte[] data = serializer.serialize(change);
        metadata.contributeFrom(change);
        UUID eventId = EventIdentity.create(identifier, aggregate.getRoot().getVersion(), offset, data,
                EventType.defaultTypeName(change.getClass()));
        return new EventData(eventId, registry.wireTypeOf(change), data, serializer.serialize(metadata.toMap()));
    }
}
