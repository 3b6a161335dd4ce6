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
import io.github.goodees.aggregates.core.AggregateRootNotFoundException;
import io.github.goodees.aggregates.core.AggregateVersion;
import io.github.goodees.aggregates.core.MockEventStore;
import io.github.goodees.aggregates.core.TestSerializer;
import io.github.goodees.aggregates.core.contract.EventContract;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.entity.EntityRoot;
import io.github.goodees.aggregates.core.example.cart.CartCleared;
import io.github.goodees.aggregates.core.example.cart.CartEvent;
import io.github.goodees.aggregates.core.example.cart.CartState;
import io.github.goodees.aggregates.core.example.cart.ItemAdded;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.saga.SagaRoot;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventStoreRepositoryTest {
    private final TestSerializer serializer = new TestSerializer();
    private MockEventStore eventStore;
    private EventDeserializer deserializer;
    private UnitOfWork unitOfWork;
    private EventStoreRepository<CartState, CartEvent> repository;

    @Before
    public void setUp() {
        eventStore = new MockEventStore();
        EventContractRegistry registry = new EventContractRegistry();
        registry.register(ItemAdded.class, EventContract.of("ItemAdded", 1));
        registry.register(CartCleared.class, EventContract.of("CartCleared", 1));
        deserializer = new EventDeserializer(serializer, registry);
        unitOfWork = new UnitOfWork();
        repository = new EventStoreRepository<>(unitOfWork, eventStore, deserializer, CartState.EMPTY,
                CartEvent.class);
    }

    private EventData data(String type, Object event) {
        return new EventData(UUID.randomUUID(), type, serializer.serialize(event),
                serializer.serialize(MetadataScope.empty().toMap()));
    }

    @Test
    public void root_is_replayed_from_stream() throws EventStoreException {
        eventStore.appendToStream("cart-1", ExpectedVersion.NO_STREAM, Arrays.asList(
                data("ItemAdded@v1", new ItemAdded("apple", 1)),
                data("ItemAdded@v1", new ItemAdded("apple", 2))));

        EntityRoot<CartState, CartEvent> root = repository.get(AggregateIdentifier.of("cart-1"));
        assertThat(root.getVersion(), is(AggregateVersion.of(1)));
        assertThat(root.getState().getItems(), hasEntry("apple", 3));
        assertTrue(unitOfWork.get(AggregateIdentifier.of("cart-1")).isPresent());
    }

    @Test
    public void attached_root_is_returned_without_reading() throws EventStoreException {
        EntityRoot<CartState, CartEvent> added = EntityRoot.create(CartState.EMPTY);
        repository.add(AggregateIdentifier.of("cart-2"), added);
        assertThat(repository.get(AggregateIdentifier.of("cart-2")), sameInstance(added));
    }

    @Test
    public void root_attached_by_other_repository_is_rejected() throws EventStoreException {
        EventStoreSagaRepository<CartState, CartEvent> sagas = new EventStoreSagaRepository<>(unitOfWork,
                eventStore, deserializer, CartState.EMPTY, CartEvent.class);
        sagas.add(AggregateIdentifier.of("saga-2"), SagaRoot.create(CartState.EMPTY));
        try {
            repository.get(AggregateIdentifier.of("saga-2"));
            fail("Saga root must not be returned as entity root");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("saga-2"));
        }
    }

    @Test
    public void missing_stream_is_empty() throws EventStoreException {
        assertFalse(repository.tryGet(AggregateIdentifier.of("cart-3")).isPresent());
        assertTrue(unitOfWork.isEmpty());
    }

    @Test(expected = AggregateRootNotFoundException.class)
    public void get_of_missing_stream_fails() throws EventStoreException {
        repository.get(AggregateIdentifier.of("cart-4"));
    }

    @Test(expected = IllegalStateException.class)
    public void system_streams_cannot_be_loaded() throws EventStoreException {
        repository.tryGet(AggregateIdentifier.of("$all"));
    }

    @Test
    public void saga_is_replayed_through_links() throws EventStoreException {
        eventStore.appendToStream("cart-5", ExpectedVersion.NO_STREAM, Arrays.asList(
                data("ItemAdded@v1", new ItemAdded("apple", 1)),
                data("CartCleared@v1", new CartCleared("done"))));
        eventStore.appendToStream("saga-1", ExpectedVersion.NO_STREAM, Arrays.asList(
                new EventData(UUID.randomUUID(), EventData.LINK_EVENT_TYPE, "0@cart-5".getBytes(), new byte[0]),
                new EventData(UUID.randomUUID(), EventData.LINK_EVENT_TYPE, "1@cart-5".getBytes(), new byte[0])));

        EventStoreSagaRepository<CartState, CartEvent> sagas = new EventStoreSagaRepository<>(new UnitOfWork(),
                eventStore, deserializer, CartState.EMPTY, CartEvent.class);
        Optional<SagaRoot<CartState, CartEvent>> saga = sagas.tryGet(AggregateIdentifier.of("saga-1"));
        assertThat(saga.get().getVersion(), is(AggregateVersion.of(1)));
        assertThat(saga.get().getState().getApplied(), is(2));
        assertTrue(saga.get().getState().isEmpty());
    }
}
