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

import io.github.goodees.aggregates.core.store.EventStoreException;
import io.github.goodees.aggregates.core.store.NakAction;
import io.github.goodees.aggregates.core.store.PersistentSubscription;
import io.github.goodees.aggregates.core.store.PersistentSubscriptionInfo;
import io.github.goodees.aggregates.core.store.PersistentSubscriptions;
import io.github.goodees.aggregates.core.store.Position;
import io.github.goodees.aggregates.core.store.ResolvedEvent;
import io.github.goodees.aggregates.core.store.SubscriptionMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subscriptions replaying scripted messages, recording every call.
 */
class MockSubscriptions implements PersistentSubscriptions {
    final List<PersistentSubscriptionInfo> existing = new CopyOnWriteArrayList<>();
    final List<String> calls = new CopyOnWriteArrayList<>();
    final List<String> acked = new CopyOnWriteArrayList<>();
    final List<String> naks = new CopyOnWriteArrayList<>();
    final Deque<List<SubscriptionMessage>> connections = new ArrayDeque<>();
    String createdFilter;
    Position createdFrom;
    int subscribeCalls;
    int droppedConnections;

    void exists(String groupName, Position lastKnown) {
        existing.add(new PersistentSubscriptionInfo(groupName, lastKnown, 0, 0));
    }

    /**
     * Next connection is dropped on first read.
     */
    synchronized void dropConnection() {
        droppedConnections++;
    }

    /**
     * Script messages of next connection. The connection ends when they are consumed.
     */
    synchronized void connection(SubscriptionMessage... messages) {
        List<SubscriptionMessage> list = new ArrayList<>();
        Collections.addAll(list, messages);
        connections.add(list);
    }

    @Override
    public List<PersistentSubscriptionInfo> listAll() {
        calls.add("listAll");
        return new ArrayList<>(existing);
    }

    @Override
    public void create(String groupName, String eventTypeFilter, Position startFrom) throws EventStoreException {
        calls.add("create " + groupName);
        if (existing.stream().anyMatch(i -> i.getGroupName().equals(groupName))) {
            throw EventStoreException.subscriptionExists(groupName);
        }
        createdFilter = eventTypeFilter;
        createdFrom = startFrom;
        existing.add(new PersistentSubscriptionInfo(groupName, null, 0, 0));
    }

    @Override
    public void delete(String groupName) throws EventStoreException {
        calls.add("delete " + groupName);
        if (!existing.removeIf(i -> i.getGroupName().equals(groupName))) {
            throw EventStoreException.subscriptionNotFound(groupName);
        }
    }

    @Override
    public synchronized PersistentSubscription subscribe(String groupName) {
        subscribeCalls++;
        calls.add("subscribe " + groupName);
        if (droppedConnections > 0) {
            droppedConnections--;
            Connection dropped = new Connection(Collections.emptyList());
            dropped.dropCause = EventStoreException.subscriptionDropped(groupName, null);
            return dropped;
        }
        List<SubscriptionMessage> messages = connections.poll();
        return new Connection(messages == null ? Collections.emptyList() : messages);
    }

    Connection connection() {
        return new Connection(Collections.emptyList());
    }

    class Connection implements PersistentSubscription {
        private final Deque<SubscriptionMessage> messages;
        boolean closed;
        EventStoreException dropCause;

        Connection(List<SubscriptionMessage> messages) {
            this.messages = new ArrayDeque<>(messages);
        }

        @Override
        public SubscriptionMessage next() throws EventStoreException {
            if (dropCause != null) {
                throw dropCause;
            }
            return closed ? null : messages.poll();
        }

        @Override
        public void ack(ResolvedEvent event) {
            acked.add(event.getOriginalEvent().getStreamId() + "/" + event.getOriginalEvent().getEventNumber());
        }

        @Override
        public void nak(NakAction action, String reason, ResolvedEvent event) {
            naks.add(action + " " + reason);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
