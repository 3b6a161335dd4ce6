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
import io.github.goodees.aggregates.core.contract.EventContract;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.contract.SubscriptionContract;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.store.EventStoreException;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds events of a persistent subscription to a consumer.
 * <p>At start the worker bootstraps its subscription. An existing subscription named after the contract is reused.
 * Otherwise the worker probes which registered contracts its consumer accepts, and creates the subscription with
 * a filter for them. When the contract's predecessor subscription exists, the new subscription starts at the
 * predecessor's last known position, the event at that position is acknowledged without dispatch, and the
 * predecessor is deleted.</p>
 * <p>Then the worker consumes the subscription until it is {@linkplain #stop() stopped}. Each event is dispatched
 * in a metadata scope seeded with the event's metadata, and acknowledged. Failed events are negatively acknowledged,
 * to be retried while their retry count is below {@link AggregatesOptions#getMaxDeliveryRetries()}, and parked
 * afterwards. When the subscription fails or ends, the worker opens it again, without delay.</p>
 * @param <E> type of consumed events
 */
public abstract class SubscriptionWorker<E> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final SubscriptionContract contract;
    protected final Class<E> eventType;
    private final PersistentSubscriptions subscriptions;
    private final EventContractRegistry registry;
    private final EventDeserializer deserializer;
    private final int maxDeliveryRetries;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopping;
    private volatile WorkerState state = WorkerState.NEW;
    private volatile PersistentSubscription current;
    private volatile Future<?> future;
    private volatile Position skipPosition;

    protected SubscriptionWorker(SubscriptionContract contract, Class<E> eventType,
            PersistentSubscriptions subscriptions, EventContractRegistry registry, EventDeserializer deserializer,
            AggregatesOptions options) {
        this.contract = Objects.requireNonNull(contract, "Contract must be provided");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be provided");
        this.subscriptions = Objects.requireNonNull(subscriptions, "Subscriptions must be provided");
        this.registry = Objects.requireNonNull(registry, "Registry must be provided");
        this.deserializer = Objects.requireNonNull(deserializer, "Deserializer must be provided");
        this.maxDeliveryRetries = Objects.requireNonNull(options, "Options must be provided").getMaxDeliveryRetries();
    }

    /**
     * Start the worker on a thread of the executor.
     * @param executor executor to run on. The worker occupies one of its threads until stopped.
     * @return future completing when the worker stops, exceptionally when bootstrap failed
     */
    public Future<?> start(ExecutorService executor) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker " + contract + " was already started");
        }
        Future<?> f = executor.submit(() -> {
            run();
            return null;
        });
        this.future = f;
        return f;
    }

    /**
     * Signal the worker to stop. Waiting for next message is interrupted, dispatch in progress is allowed to finish.
     */
    public void stop() {
        stopping = true;
        PersistentSubscription subscription = current;
        if (subscription != null) {
            subscription.close();
        }
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
    }

    public WorkerState getState() {
        return state;
    }

    public String getSubscriptionName() {
        return contract.qualifiedName();
    }

    /**
     * Bootstrap and consume, until stopped.
     * @throws EventStoreException when bootstrap fails
     */
    protected void run() throws EventStoreException {
        try {
            bootstrap();
            consume();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            transition(WorkerState.STOPPED);
        }
    }

    void bootstrap() throws EventStoreException {
        transition(WorkerState.BOOTSTRAPPING);
        String name = contract.qualifiedName();
        List<PersistentSubscriptionInfo> existing = subscriptions.listAll();
        if (existing.stream().anyMatch(info -> info.getGroupName().equals(name))) {
            logger.info("Subscription {} exists", name);
            skipPosition = null;
            return;
        }
        String filter = EventTypeFilter.matching(probeContracts());
        Position start = contract.isStartFromEnd() ? Position.END : Position.START;
        Position skip = null;
        Optional<PersistentSubscriptionInfo> predecessor = contract.predecessor()
                .flatMap(p -> existing.stream().filter(info -> info.getGroupName().equals(p)).findFirst());
        if (predecessor.isPresent()) {
            skip = predecessor.get().getLastKnownEventPosition().orElse(null);
            if (skip != null) {
                start = skip;
            }
        }
        subscriptions.create(name, filter, start);
        logger.info("Created subscription {} from {} with filter {}", name, start, filter);
        if (predecessor.isPresent()) {
            subscriptions.delete(predecessor.get().getGroupName());
            logger.info("Subscription {} continues from {}, which was deleted", name,
                    predecessor.get().getGroupName());
        }
        skipPosition = skip;
    }

    List<EventContract> probeContracts() {
        List<EventContract> result = new ArrayList<>();
        for (EventContractRegistry.Registration<?> registration : registry.contractsAssignableTo(eventType)) {
            try {
                probe(eventType.cast(registration.createProbe()));
                registration.getContract().ifPresent(result::add);
            } catch (Exception e) {
                logger.debug("{} does not consume {}: {}", contract, registration.wireType(), e.toString());
            }
        }
        return result;
    }

    Position getSkipPosition() {
        return skipPosition;
    }

    void consume() throws InterruptedException {
        boolean reconnecting = false;
        while (!isStopping()) {
            transition(reconnecting ? WorkerState.RECONNECTING : WorkerState.SUBSCRIBED);
            reconnecting = true;
            String name = contract.qualifiedName();
            try (PersistentSubscription subscription = subscriptions.subscribe(name)) {
                current = subscription;
                if (stopping) {
                    break;
                }
                transition(WorkerState.PROCESSING);
                SubscriptionMessage message;
                while (!isStopping() && (message = subscription.next()) != null) {
                    handle(subscription, message);
                }
            } catch (EventStoreException | RuntimeException e) {
                if (!isStopping()) {
                    logger.warn("Subscription {} failed. {}", name, e.getMessage(), e);
                }
            } finally {
                current = null;
            }
            if (!isStopping()) {
                transition(WorkerState.DROPPED);
                logger.warn("Subscription {} has ended or has been dropped. Reconnecting.", name);
            }
        }
    }

    void handle(PersistentSubscription subscription, SubscriptionMessage message) throws EventStoreException {
        if (message instanceof SubscriptionMessage.Confirmation) {
            logger.info("Subscription to {} has been confirmed",
                    ((SubscriptionMessage.Confirmation) message).getSubscriptionId());
            return;
        }
        SubscriptionMessage.EventAppeared appeared = (SubscriptionMessage.EventAppeared) message;
        ResolvedEvent event = appeared.getEvent();
        Position skip = skipPosition;
        if (skip != null && skip.equals(event.getOriginalPosition())) {
            logger.debug("Skipping {} at {}, it was handled by predecessor", event, skip);
            subscription.ack(event);
            return;
        }
        try {
            RecordedEvent recorded = event.getEvent();
            E payload = deserializer.deserialize(recorded, eventType);
            Map<String, Object> metadata = deserializer.deserializeMetadata(recorded);
            dispatch(payload, metadata, MetadataScope.of(metadata), event);
            subscription.ack(event);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            NakAction action = appeared.getRetryCount() < maxDeliveryRetries ? NakAction.RETRY : NakAction.PARK;
            logger.warn("Handling of {} in {} failed, {} it", event, contract, action, e);
            subscription.nak(action, e.getMessage() != null ? e.getMessage() : e.toString(), event);
        }
    }

    private boolean isStopping() {
        return stopping || Thread.currentThread().isInterrupted();
    }

    private void transition(WorkerState newState) {
        WorkerState old = this.state;
        this.state = newState;
        if (old != newState) {
            logger.info("Worker {} {} -> {}", contract, old, newState);
        }
    }

    /**
     * Try the consumer with an empty instance of a registered event type. Throwing excludes the type from the
     * subscription filter. Must not have side effects.
     * @param sample empty event instance
     * @throws Exception when the consumer does not accept the type
     */
    protected abstract void probe(E sample) throws Exception;

    /**
     * Pass event to the consumer.
     * @param event the event
     * @param metadata the event's metadata
     * @param scope metadata scope seeded with event's metadata
     * @param resolved the event as delivered by the subscription
     * @throws Exception when the event cannot be handled now
     */
    protected abstract void dispatch(E event, Map<String, Object> metadata, MetadataScope scope, ResolvedEvent resolved)
            throws Exception;
}
