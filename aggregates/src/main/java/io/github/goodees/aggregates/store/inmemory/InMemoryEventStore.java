package io.github.goodees.aggregates.store.inmemory;

/*-
 * #%L
 * aggregates
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

import io.github.goodees.aggregates.core.store.EventData;
import io.github.goodees.aggregates.core.store.EventStore;
import io.github.goodees.aggregates.core.store.EventStoreException;
import io.github.goodees.aggregates.core.store.ExpectedVersion;
import io.github.goodees.aggregates.core.store.NakAction;
import io.github.goodees.aggregates.core.store.PersistentSubscription;
import io.github.goodees.aggregates.core.store.PersistentSubscriptionInfo;
import io.github.goodees.aggregates.core.store.PersistentSubscriptions;
import io.github.goodees.aggregates.core.store.Position;
import io.github.goodees.aggregates.core.store.RecordedEvent;
import io.github.goodees.aggregates.core.store.ResolvedEvent;
import io.github.goodees.aggregates.core.store.SubscriptionMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Event log held in memory, with persistent subscriptions to all streams.
 * <p>The commit position of an event is its index in the log. Subscriptions deliver events whose type matches their
 * filter, in log order, starting at their start position inclusively. Negatively acknowledged events are delivered
 * again before any new event, with increased retry count, or parked.</p>
 */
public class InMemoryEventStore implements EventStore, PersistentSubscriptions {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Object lock = new Object();
    private final List<RecordedEvent> log = new ArrayList<>();
    private final Map<String, List<RecordedEvent>> streams = new HashMap<>();
    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public StoredEvents readStreamForwards(String streamId, boolean resolveLinks) throws EventStoreException {
        List<ResolvedEvent> events = new ArrayList<>();
        synchronized (lock) {
            List<RecordedEvent> stream = streams.get(streamId);
            if (stream == null) {
                throw EventStoreException.streamNotFound(streamId);
            }
            for (RecordedEvent event : stream) {
                events.add(resolveLinks ? resolve(event) : ResolvedEvent.of(event));
            }
        }
        return new ListStoredEvents(events);
    }

    @Override
    public long appendToStream(String streamId, long expectedVersion, List<EventData> events)
            throws EventStoreException {
        synchronized (lock) {
            List<RecordedEvent> stream = streams.get(streamId);
            long current = stream == null ? ExpectedVersion.NO_STREAM : stream.size() - 1;
            if (stream != null && isRepeatedAppend(stream, expectedVersion, events)) {
                logger.debug("Events {} are already present in {}", events, streamId);
                return current;
            }
            if (expectedVersion != current) {
                throw EventStoreException.optimisticLock(streamId, expectedVersion, current);
            }
            if (stream == null) {
                stream = new ArrayList<>();
                streams.put(streamId, stream);
            }
            for (EventData data : events) {
                RecordedEvent recorded = new RecordedEvent(data.getEventId(), streamId, stream.size(), data.getType(),
                        data.getData(), data.getMetadata(), Position.of(log.size()), clock.instant());
                stream.add(recorded);
                log.add(recorded);
            }
            lock.notifyAll();
            return stream.size() - 1;
        }
    }

    private static boolean isRepeatedAppend(List<RecordedEvent> stream, long expectedVersion, List<EventData> events) {
        if (events.isEmpty()) {
            return false;
        }
        int first = (int) (expectedVersion + 1);
        if (first < 0 || first + events.size() > stream.size()) {
            return false;
        }
        for (int i = 0; i < events.size(); i++) {
            if (!stream.get(first + i).getEventId().equals(events.get(i).getEventId())) {
                return false;
            }
        }
        return true;
    }

    private ResolvedEvent resolve(RecordedEvent event) {
        if (!EventData.LINK_EVENT_TYPE.equals(event.getEventType())) {
            return ResolvedEvent.of(event);
        }
        String reference = new String(event.getData(), StandardCharsets.UTF_8);
        int at = reference.indexOf('@');
        if (at > 0) {
            List<RecordedEvent> target = streams.get(reference.substring(at + 1));
            long number = Long.parseLong(reference.substring(0, at));
            if (target != null && number < target.size()) {
                return new ResolvedEvent(target.get((int) number), event);
            }
        }
        logger.warn("Link {} points to missing event {}", event, reference);
        return ResolvedEvent.of(event);
    }

    /**
     * @return number of events in the whole log
     */
    public long size() {
        synchronized (lock) {
            return log.size();
        }
    }

    @Override
    public List<PersistentSubscriptionInfo> listAll() throws EventStoreException {
        synchronized (lock) {
            List<PersistentSubscriptionInfo> result = new ArrayList<>();
            for (Group group : groups.values()) {
                result.add(new PersistentSubscriptionInfo(group.name, group.lastKnownEventPosition, group.processed,
                        group.parked.size()));
            }
            return result;
        }
    }

    @Override
    public void create(String groupName, String eventTypeFilter, Position startFrom) throws EventStoreException {
        synchronized (lock) {
            if (groups.containsKey(groupName)) {
                throw EventStoreException.subscriptionExists(groupName);
            }
            long cursor = startFrom.isEnd() ? log.size() : startFrom.getCommitPosition();
            groups.put(groupName, new Group(groupName, Pattern.compile(eventTypeFilter), cursor));
        }
    }

    @Override
    public void delete(String groupName) throws EventStoreException {
        synchronized (lock) {
            Group group = groups.remove(groupName);
            if (group == null) {
                throw EventStoreException.subscriptionNotFound(groupName);
            }
            group.deleted = true;
            lock.notifyAll();
        }
    }

    @Override
    public PersistentSubscription subscribe(String groupName) throws EventStoreException {
        synchronized (lock) {
            Group group = groups.get(groupName);
            if (group == null) {
                throw EventStoreException.subscriptionNotFound(groupName);
            }
            Connection connection = new Connection(group);
            group.connections.add(connection);
            return connection;
        }
    }

    /**
     * Drop all open connections of a subscription, as when the connection to a remote log fails.
     * @param groupName the subscription
     */
    public void dropConnections(String groupName) {
        synchronized (lock) {
            Group group = groups.get(groupName);
            if (group != null) {
                group.connections.forEach(c -> c.dropped = true);
                lock.notifyAll();
            }
        }
    }

    /**
     * @param groupName the subscription
     * @return events parked by the subscription
     */
    public List<ResolvedEvent> parkedEvents(String groupName) {
        synchronized (lock) {
            Group group = groups.get(groupName);
            return group == null ? Collections.emptyList() : new ArrayList<>(group.parked);
        }
    }

    /**
     * @param groupName the subscription
     * @return filter of the subscription, or null if it does not exist
     */
    public String filterOf(String groupName) {
        synchronized (lock) {
            Group group = groups.get(groupName);
            return group == null ? null : group.filter.pattern();
        }
    }

    private static final class Group {
        final String name;
        final Pattern filter;
        final Deque<SubscriptionMessage.EventAppeared> redeliveries = new ArrayDeque<>();
        final Map<UUID, Integer> retryCounts = new HashMap<>();
        final List<ResolvedEvent> parked = new ArrayList<>();
        final List<Connection> connections = new ArrayList<>();
        long cursor;
        long processed;
        Position lastKnownEventPosition;
        boolean deleted;

        Group(String name, Pattern filter, long cursor) {
            this.name = name;
            this.filter = filter;
            this.cursor = cursor;
        }

        void checkpoint(ResolvedEvent event) {
            Position position = event.getOriginalPosition();
            if (lastKnownEventPosition == null || position.compareTo(lastKnownEventPosition) > 0) {
                lastKnownEventPosition = position;
            }
            retryCounts.remove(event.getOriginalEvent().getEventId());
        }
    }

    private final class Connection implements PersistentSubscription {
        private final Group group;
        private boolean confirmed;
        private boolean closed;
        private boolean dropped;

        Connection(Group group) {
            this.group = group;
        }

        @Override
        public SubscriptionMessage next() throws InterruptedException, EventStoreException {
            synchronized (lock) {
                while (true) {
                    if (closed) {
                        return null;
                    }
                    if (dropped || group.deleted) {
                        closed = true;
                        group.connections.remove(this);
                        throw EventStoreException.subscriptionDropped(group.name, null);
                    }
                    if (!confirmed) {
                        confirmed = true;
                        return new SubscriptionMessage.Confirmation(group.name + "::" + System.identityHashCode(this));
                    }
                    SubscriptionMessage.EventAppeared redelivery = group.redeliveries.poll();
                    if (redelivery != null) {
                        return redelivery;
                    }
                    while (group.cursor < log.size()) {
                        RecordedEvent event = log.get((int) group.cursor++);
                        if (group.filter.matcher(event.getEventType()).matches()) {
                            return new SubscriptionMessage.EventAppeared(ResolvedEvent.of(event), 0);
                        }
                    }
                    lock.wait();
                }
            }
        }

        @Override
        public void ack(ResolvedEvent event) {
            synchronized (lock) {
                group.processed++;
                group.checkpoint(event);
            }
        }

        @Override
        public void nak(NakAction action, String reason, ResolvedEvent event) {
            synchronized (lock) {
                if (action == NakAction.RETRY) {
                    int count = group.retryCounts.merge(event.getOriginalEvent().getEventId(), 1, Integer::sum);
                    group.redeliveries.add(new SubscriptionMessage.EventAppeared(event, count));
                    logger.debug("Retrying {} in {} ({}): {}", event, group.name, count, reason);
                } else {
                    group.parked.add(event);
                    group.checkpoint(event);
                    logger.warn("Parked {} in {}: {}", event, group.name, reason);
                }
                lock.notifyAll();
            }
        }

        @Override
        public void close() {
            synchronized (lock) {
                closed = true;
                group.connections.remove(this);
                lock.notifyAll();
            }
        }
    }

    static final class ListStoredEvents implements StoredEvents {
        private final List<ResolvedEvent> events;
        private boolean stop;

        ListStoredEvents(List<ResolvedEvent> events) {
            this.events = events;
        }

        @Override
        public void foreach(Consumer<? super ResolvedEvent> consumer) {
            for (ResolvedEvent event : events) {
                if (stop) {
                    break;
                }
                consumer.accept(event);
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super ResolvedEvent, R> reducer) {
            R result = initial;
            for (ResolvedEvent event : events) {
                if (stop) {
                    break;
                }
                result = reducer.apply(result, event);
            }
            return result;
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
        }
    }
}
