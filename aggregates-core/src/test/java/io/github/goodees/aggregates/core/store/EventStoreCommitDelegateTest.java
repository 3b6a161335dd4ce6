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

import io.github.goodees.aggregates.core.Aggregate;
import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.AggregateVersion;
import io.github.goodees.aggregates.core.MockEventStore;
import io.github.goodees.aggregates.core.TestSerializer;
import io.github.goodees.aggregates.core.contract.EventContract;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.entity.EntityRoot;
import io.github.goodees.aggregates.core.example.cart.AddItems;
import io.github.goodees.aggregates.core.example.cart.CartEvent;
import io.github.goodees.aggregates.core.example.cart.CartState;
import io.github.goodees.aggregates.core.example.cart.ItemAdded;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class EventStoreCommitDelegateTest {
    @Rule
    public TestName testName = new TestName();

    private MockEventStore eventStore;
    private EventContractRegistry registry;
    private List<Long> pauses;
    private EventStoreCommitDelegate delegate;

    @Before
    public void setUp() {
        eventStore = new MockEventStore();
        registry = new EventContractRegistry();
        registry.register(ItemAdded.class, EventContract.of("Cart", "ItemAdded", 1));
        pauses = new ArrayList<>();
        delegate = new EventStoreCommitDelegate(eventStore, new TestSerializer(), registry,
                CommitRetryStrategy.growingBackoff(3, Duration.ofMillis(100))) {
            @Override
            protected void pause(long millis, EventStoreException failure) {
                pauses.add(millis);
            }
        };
    }

    private UnitOfWork changedWork(AggregateVersion version, String... items) {
        EntityRoot<CartState, CartEvent> root = new EntityRoot<>(CartState.EMPTY, version);
        root.accept(new AddItems(testName.getMethodName(), items), MetadataScope.empty());
        UnitOfWork unitOfWork = new UnitOfWork();
        unitOfWork.attach(Aggregate.of(AggregateIdentifier.of(testName.getMethodName()), root));
        return unitOfWork;
    }

    @Test
    public void changes_are_appended_to_stream_of_aggregate() throws EventStoreException {
        delegate.commit(changedWork(AggregateVersion.NONE, "apple", "pear"), MetadataScope.empty());

        List<RecordedEvent> stream = eventStore.stream(testName.getMethodName());
        assertThat(stream.size(), is(2));
        assertThat(stream.get(0).getEventType(), is("Cart.ItemAdded@v1"));
        assertThat(stream.get(1).getEventNumber(), is(1L));
    }

    @Test
    public void unchanged_work_appends_nothing() throws EventStoreException {
        delegate.commit(new UnitOfWork(), MetadataScope.empty());
        assertThat(eventStore.getAppendCalls(), is(0));
    }

    @Test
    public void version_conflict_fails_without_retry() throws EventStoreException {
        delegate.commit(changedWork(AggregateVersion.NONE, "apple"), MetadataScope.empty());
        try {
            delegate.commit(changedWork(AggregateVersion.NONE, "pear"), MetadataScope.empty());
            fail("Second creation of the stream should fail");
        } catch (EventStoreException e) {
            assertThat(e.getFault(), is(EventStoreException.Fault.OPTIMISTIC_LOCK));
        }
        assertThat(eventStore.getAppendCalls(), is(2));
        assertThat(pauses.size(), is(0));
    }

    @Test
    public void transient_failure_is_retried_with_same_events() throws EventStoreException {
        eventStore.throwExceptionAfterAppendOnce(EventStoreException.deadlineExceeded("append", null));
        delegate.commit(changedWork(AggregateVersion.NONE, "apple", "pear"), MetadataScope.empty());

        assertThat(eventStore.stream(testName.getMethodName()).size(), is(2));
        assertThat(eventStore.getAppendCalls(), is(2));
        assertThat(pauses, contains(100L));
    }

    @Test
    public void retries_are_bounded() {
        eventStore.throwExceptionOnce(EventStoreException.unknown("append", null));
        EventStoreCommitDelegate impatient = new EventStoreCommitDelegate(eventStore, new TestSerializer(), registry,
                CommitRetryStrategy.NO_RETRIES);
        try {
            impatient.commit(changedWork(AggregateVersion.NONE, "apple"), MetadataScope.empty());
            fail("Commit should fail");
        } catch (EventStoreException e) {
            assertThat(e.getFault(), is(EventStoreException.Fault.UNKNOWN));
        }
        assertThat(eventStore.stream(testName.getMethodName()).size(), is(0));
    }

    @Test
    public void existing_stream_is_appended_at_expected_version() throws EventStoreException {
        delegate.commit(changedWork(AggregateVersion.NONE, "apple"), MetadataScope.empty());
        delegate.commit(changedWork(AggregateVersion.of(0), "pear", "plum"), MetadataScope.empty());
        assertThat(eventStore.stream(testName.getMethodName()).size(), is(3));
    }
}
