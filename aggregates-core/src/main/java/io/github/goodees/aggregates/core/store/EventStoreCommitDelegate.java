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
import io.github.goodees.aggregates.core.AggregatesOptions;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.serialization.EventDataFactory;
import io.github.goodees.aggregates.core.serialization.Serializer;
import io.github.goodees.aggregates.core.uow.CommitDelegate;
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends changes of the changed aggregate of a unit of work to its stream.
 * <p>Event data is prepared once, so every retried append carries the same event ids, and the log can recognize
 * repeated appends. Retries follow the {@link CommitRetryStrategy}.</p>
 */
public class EventStoreCommitDelegate implements CommitDelegate {
    private static final Logger logger = LoggerFactory.getLogger(EventStoreCommitDelegate.class);

    private final EventStore eventStore;
    private final Serializer serializer;
    private final EventContractRegistry registry;
    private final CommitRetryStrategy retryStrategy;

    /**
     * Delegate retrying transient failures as many times and with base backoff given by the options.
     * @param eventStore the log
     * @param serializer serializer of events and metadata
     * @param registry known event types
     * @param options options
     */
    public EventStoreCommitDelegate(EventStore eventStore, Serializer serializer, EventContractRegistry registry,
            AggregatesOptions options) {
        this(eventStore, serializer, registry,
                CommitRetryStrategy.growingBackoff(options.getCommitAttempts(), options.getCommitBackoff()));
    }

    public EventStoreCommitDelegate(EventStore eventStore, Serializer serializer, EventContractRegistry registry,
            CommitRetryStrategy retryStrategy) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be provided");
        this.serializer = Objects.requireNonNull(serializer, "Serializer must be provided");
        this.registry = Objects.requireNonNull(registry, "Registry must be provided");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be provided");
    }

    @Override
    public void commit(UnitOfWork unitOfWork, MetadataScope metadata) throws EventStoreException {
        Aggregate changed = unitOfWork.getChanged();
        if (changed.isNone()) {
            logger.debug("Nothing to commit");
            return;
        }
        String streamId = changed.getIdentifier().value();
        EventDataFactory factory = new EventDataFactory(serializer, registry);
        List<EventData> events = new ArrayList<>();
        for (Object change : changed.getRoot().getChanges()) {
            events.add(factory.create(changed, change, metadata));
        }
        long expectedVersion = ExpectedVersion.of(changed.getRoot().getVersion());
        for (int attempt = 1; ; attempt++) {
            try {
                long version = eventStore.appendToStream(streamId, expectedVersion, events);
                logger.debug("Appended {} events to {}, now at version {}", events.size(), streamId, version);
                return;
            } catch (EventStoreException e) {
                long delay = retryStrategy.retryDelay(streamId, e, attempt);
                if (delay < 0) {
                    throw e;
                }
                logger.warn("Append to {} failed on attempt {}, retrying in {} ms. {}", streamId, attempt, delay,
                        e.getMessage());
                pause(delay, e);
            }
        }
    }

    /**
     * Wait before next attempt.
     * @param millis delay
     * @param failure failure of last attempt
     * @throws EventStoreException the failure, when the thread is interrupted while waiting
     */
    protected void pause(long millis, EventStoreException failure) throws EventStoreException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(e);
            throw failure;
        }
    }
}
