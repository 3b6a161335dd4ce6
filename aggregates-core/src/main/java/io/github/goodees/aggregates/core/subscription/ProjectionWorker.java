package io.github.goodees.aggregates.core.subscription;

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

import io.github.goodees.aggregates.core.AggregatesOptions;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.contract.SubscriptionContract;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.projection.Projection;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.store.PersistentSubscriptions;
import io.github.goodees.aggregates.core.store.ResolvedEvent;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Applies events to a projection, and commits the result before acknowledging the event.
 * @param <E> type of consumed events
 */
public class ProjectionWorker<E> extends SubscriptionWorker<E> {
    private final Supplier<? extends Projection<E>> projections;

    /**
     * Create worker.
     * @param contract subscription contract
     * @param eventType consumed event type
     * @param projections provides projection instance for every event and for probing
     * @param subscriptions persistent subscriptions of the log
     * @param registry known event types
     * @param deserializer event deserializer
     * @param options options
     */
    public ProjectionWorker(SubscriptionContract contract, Class<E> eventType,
            Supplier<? extends Projection<E>> projections, PersistentSubscriptions subscriptions,
            EventContractRegistry registry, EventDeserializer deserializer, AggregatesOptions options) {
        super(contract, eventType, subscriptions, registry, deserializer, options);
        this.projections = Objects.requireNonNull(projections, "Projection supplier must be provided");
    }

    @Override
    protected void probe(E sample) {
        projections.get().apply(sample, Collections.emptyMap());
    }

    @Override
    protected void dispatch(E event, Map<String, Object> metadata, MetadataScope scope, ResolvedEvent resolved)
            throws Exception {
        projections.get().apply(event, metadata).commit();
    }
}
