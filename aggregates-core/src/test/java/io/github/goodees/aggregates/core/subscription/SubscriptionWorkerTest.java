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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.goodees.aggregates.core.AggregatesOptions;
import io.github.goodees.aggregates.core.TestSerializer;
import io.github.goodees.aggregates.core.contract.EventContract;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.contract.SubscriptionContract;
import io.github.goodees.aggregates.core.example.cart.CartCleared;
import io.github.goodees.aggregates.core.example.cart.CartEvent;
import io.github.goodees.aggregates.core.example.cart.ItemAdded;
import io.github.goodees.aggregates.core.example.cart.ItemRemoved;
import io.github.goodees.aggregates.core.projection.Commit;
import io.github.goodees.aggregates.core.projection.Projection;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.store.EventStoreException;
import io.github.goodees.aggregates.core.store.Position;
import io.github.goodees.aggregates.core.store.RecordedEvent;
import io.github.goodees.aggregates.core.store.ResolvedEvent;
import io.github.goodees.aggregates.core.store.SubscriptionMessage;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertTrue;

public class SubscriptionWorkerTest {
    private static final SubscriptionContract CARTS = SubscriptionContract.of("Projections", "Carts", 1);

    private final TestSerializer serializer = new TestSerializer();
    private MockSubscriptions subscriptions;
    private EventContractRegistry registry;
    private List<String> projected;
    private RuntimeException failure;

    static class Unrelated {
    }

    class CartProjection implements Projection<CartEvent> {
        @Override
        public Commit apply(CartEvent event, Map<String, Object> metadata) {
            if (failure != null) {
                throw failure;
            }
            if (event instanceof ItemAdded) {
                return () -> projected.add(((ItemAdded) event).getItem() + " " + metadata.get("User"));
            }
            if (event instanceof CartCleared) {
                return () -> projected.add("cleared");
            }
            throw new IllegalArgumentException("Unsupported event " + event);
        }
    }

    @Before
    public void setUp() {
        subscriptions = new MockSubscriptions();
        registry = new EventContractRegistry();
        registry.register(ItemAdded.class, EventContract.of("Projections.Tests", "EventType1", 1));
        registry.register(Unrelated.class, EventContract.of("Projections.Tests", "Unrelated", 1));
        registry.register(CartCleared.class, EventContract.of("Projections.Tests", "EventType2", 1));
        registry.register(ItemRemoved.class, EventContract.of("Projections.Tests", "EventType3", 1));
        projected = new CopyOnWriteArrayList<>();
    }

    private ProjectionWorker<CartEvent> worker(SubscriptionContract contract) {
        return new ProjectionWorker<>(contract, CartEvent.class, CartProjection::new, subscriptions, registry,
                new EventDeserializer(serializer, registry), new AggregatesOptions());
    }

    private ResolvedEvent event(long position, Object payload) {
        return ResolvedEvent.of(new RecordedEvent(UUID.randomUUID(), "cart-1", position, registry.wireTypeOf(payload),
                serializer.serialize(payload), serializer.serialize(Collections.singletonMap("User", "alice")),
                Position.of(position), Instant.now()));
    }

    private static SubscriptionMessage appeared(ResolvedEvent event, int retryCount) {
        return new SubscriptionMessage.EventAppeared(event, retryCount);
    }

    @Test
    public void filter_selects_contracts_consumer_accepts() throws EventStoreException {
        worker(CARTS).bootstrap();

        assertThat(subscriptions.createdFilter,
                is("^(?:Projections\\.Tests\\.EventType1@v1|Projections\\.Tests\\.EventType2@v1)$"));
        assertThat(subscriptions.createdFrom, is(Position.START));
        assertThat(subscriptions.calls, contains("listAll", "create Projections.Carts@v1"));
    }

    @Test
    public void existing_subscription_is_reused() throws EventStoreException {
        subscriptions.exists("Projections.Carts@v1", Position.of(12));
        ProjectionWorker<CartEvent> worker = worker(CARTS);
        worker.bootstrap();

        assertThat(subscriptions.calls, contains("listAll"));
        assertThat(worker.getSkipPosition(), nullValue());
    }

    @Test
    public void new_version_continues_from_predecessor() throws EventStoreException {
        subscriptions.exists("Projections.Carts@v1", Position.of(42));
        ProjectionWorker<CartEvent> worker = worker(SubscriptionContract.of("Projections", "Carts", 2));
        worker.bootstrap();

        assertThat(subscriptions.createdFrom, is(Position.of(42)));
        assertThat(worker.getSkipPosition(), is(Position.of(42)));
        assertThat(subscriptions.calls,
                contains("listAll", "create Projections.Carts@v2", "delete Projections.Carts@v1"));
    }

    @Test
    public void predecessor_without_position_starts_from_beginning() throws EventStoreException {
        subscriptions.exists("Projections.Carts@v1", null);
        ProjectionWorker<CartEvent> worker = worker(SubscriptionContract.of("Projections", "Carts", 2));
        worker.bootstrap();

        assertThat(subscriptions.createdFrom, is(Position.START));
        assertThat(worker.getSkipPosition(), nullValue());
        assertThat(subscriptions.calls.get(2), is("delete Projections.Carts@v1"));
    }

    @Test
    public void missing_predecessor_is_ignored() throws EventStoreException {
        worker(SubscriptionContract.of("Projections", "Carts", 2).startingFromEnd()).bootstrap();
        assertThat(subscriptions.createdFrom, is(Position.END));
        assertThat(subscriptions.calls, contains("listAll", "create Projections.Carts@v2"));
    }

    @Test
    public void event_is_projected_then_acked() throws EventStoreException {
        ProjectionWorker<CartEvent> worker = worker(CARTS);
        MockSubscriptions.Connection connection = subscriptions.connection();
        worker.handle(connection, appeared(event(3, new ItemAdded("apple", 1)), 0));

        assertThat(projected, contains("apple alice"));
        assertThat(subscriptions.acked, contains("cart-1/3"));
        assertThat(subscriptions.naks, empty());
    }

    @Test
    public void event_at_skip_position_is_acked_without_dispatch() throws EventStoreException {
        subscriptions.exists("Projections.Carts@v1", Position.of(42));
        ProjectionWorker<CartEvent> worker = worker(SubscriptionContract.of("Projections", "Carts", 2));
        worker.bootstrap();
        MockSubscriptions.Connection connection = subscriptions.connection();

        worker.handle(connection, appeared(event(42, new ItemAdded("apple", 1)), 0));
        worker.handle(connection, appeared(event(43, new ItemAdded("pear", 1)), 0));

        assertThat(projected, contains("pear alice"));
        assertThat(subscriptions.acked, contains("cart-1/42", "cart-1/43"));
    }

    @Test
    public void failed_event_is_retried_until_max_retries_then_parked() throws EventStoreException {
        ProjectionWorker<CartEvent> worker = worker(CARTS);
        MockSubscriptions.Connection connection = subscriptions.connection();
        failure = new IllegalStateException("database down");

        worker.handle(connection, appeared(event(3, new ItemAdded("apple", 1)), 4));
        worker.handle(connection, appeared(event(3, new ItemAdded("apple", 1)), 5));

        assertThat(subscriptions.naks, contains("RETRY database down", "PARK database down"));
        assertThat(subscriptions.acked, empty());
    }

    @Test
    public void unknown_event_type_is_negatively_acknowledged() throws EventStoreException {
        ProjectionWorker<CartEvent> worker = worker(CARTS);
        ResolvedEvent unknown = ResolvedEvent.of(new RecordedEvent(UUID.randomUUID(), "cart-1", 0, "Nobody@v1",
                new byte[0], new byte[0], Position.START, Instant.now()));
        worker.handle(subscriptions.connection(), appeared(unknown, 0));

        assertThat(subscriptions.naks, contains("RETRY No contract found for event type Nobody@v1"));
    }

    @Test
    public void confirmation_is_not_acknowledged() throws EventStoreException {
        worker(CARTS).handle(subscriptions.connection(), new SubscriptionMessage.Confirmation("Projections.Carts@v1"));
        assertThat(subscriptions.acked, empty());
        assertThat(subscriptions.naks, empty());
    }

    @Test
    public void ended_subscription_is_reopened() throws InterruptedException {
        ProjectionWorker<CartEvent> worker = worker(CARTS);
        projected = new CopyOnWriteArrayList<String>() {
            @Override
            public boolean add(String s) {
                if (size() == 1) {
                    worker.stop();
                }
                return super.add(s);
            }
        };
        subscriptions.connection(new SubscriptionMessage.Confirmation("first"),
                appeared(event(0, new ItemAdded("apple", 1)), 0));
        subscriptions.connection(new SubscriptionMessage.Confirmation("second"),
                appeared(event(1, new ItemAdded("pear", 1)), 0),
                appeared(event(2, new ItemAdded("plum", 1)), 0));

        worker.consume();

        assertThat(subscriptions.subscribeCalls, is(2));
        assertThat(projected, contains("apple alice", "pear alice"));
        assertTrue(subscriptions.acked.contains("cart-1/1"));
    }

    @Test
    public void dropped_subscription_is_reported_as_warning_and_reopened() throws InterruptedException {
        ProjectionWorker<CartEvent> worker = worker(CARTS);
        projected = new CopyOnWriteArrayList<String>() {
            @Override
            public boolean add(String s) {
                worker.stop();
                return super.add(s);
            }
        };
        Logger workerLogger = (Logger) LoggerFactory.getLogger(ProjectionWorker.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        workerLogger.addAppender(appender);
        try {
            subscriptions.dropConnection();
            subscriptions.connection(appeared(event(0, new ItemAdded("apple", 1)), 0));

            worker.consume();
        } finally {
            workerLogger.detachAppender(appender);
        }

        assertThat(subscriptions.subscribeCalls, is(2));
        assertThat(projected, contains("apple alice"));
        List<Level> levels = appender.list.stream().map(ILoggingEvent::getLevel).collect(Collectors.toList());
        assertTrue(levels.contains(Level.WARN));
        assertThat(levels, not(hasItem(Level.ERROR)));
    }
}
