package io.github.goodees.aggregates.core.store;

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

import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.AggregateVersion;
import io.github.goodees.aggregates.core.BaseRepository;
import io.github.goodees.aggregates.core.State;
import io.github.goodees.aggregates.core.entity.EntityRoot;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.uow.UnitOfWork;

import java.util.Objects;
import java.util.Optional;

/**
 * Replays entity roots from their streams in the event log.
 * @param <S> type of the state
 * @param <E> type of the events
 */
public class EventStoreRepository<S extends State<S, E>, E> extends BaseRepository<EntityRoot<S, E>> {
    private final EventStore eventStore;
    private final EventDeserializer deserializer;
    private final S initialState;
    private final Class<E> eventType;

    public EventStoreRepository(UnitOfWork unitOfWork, EventStore eventStore, EventDeserializer deserializer,
            S initialState, Class<E> eventType) {
        super(unitOfWork);
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be provided");
        this.deserializer = Objects.requireNonNull(deserializer, "Deserializer must be provided");
        this.initialState = Objects.requireNonNull(initialState, "Initial state must be provided");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be provided");
    }

    @Override
    protected Optional<EntityRoot<S, E>> load(AggregateIdentifier identifier) throws EventStoreException {
        try (EventStore.StoredEvents events = eventStore.readStreamForwards(identifier.value(), false)) {
            Replay<S> replay = events.reduce(new Replay<>(initialState),
                    (r, e) -> r.next(r.state.apply(deserializer.deserialize(e.getEvent(), eventType))));
            return Optional.of(new EntityRoot<>(replay.state, AggregateVersion.afterReplayOf(replay.count)));
        } catch (EventStoreException e) {
            if (e.getFault() == EventStoreException.Fault.STREAM_NOT_FOUND) {
                return Optional.empty();
            }
            throw e;
        }
    }

    static final class Replay<S> {
        final S state;
        final long count;

        Replay(S state) {
            this(state, 0);
        }

        private Replay(S state, long count) {
            this.state = state;
            this.count = count;
        }

        Replay<S> next(S newState) {
            return new Replay<>(newState, count + 1);
        }
    }
}
