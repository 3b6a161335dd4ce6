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

import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.AggregatesOptions;
import io.github.goodees.aggregates.core.Repository;
import io.github.goodees.aggregates.core.State;
import io.github.goodees.aggregates.core.command.CommandHandlerProvider;
import io.github.goodees.aggregates.core.command.RepositoryFactory;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.contract.SubscriptionContract;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.saga.SagaReaction;
import io.github.goodees.aggregates.core.saga.SagaRoot;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.store.PersistentSubscriptions;
import io.github.goodees.aggregates.core.store.RecordedEvent;
import io.github.goodees.aggregates.core.store.ResolvedEvent;
import io.github.goodees.aggregates.core.uow.CommitDelegate;
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import io.github.goodees.aggregates.core.uow.UnitOfWorkScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes consumed events to sagas correlated by metadata.
 * <p>The saga id is read from the event's metadata under {@link AggregatesOptions#getSagaIdKey()}; events without it
 * are acknowledged without effect. The saga is loaded, or started when it has no history, accepts the event, and
 * the commands it issues are handled each by a new handler. Finally the saga's stream is appended with a link to
 * the event.</p>
 * @param <S> state of the saga
 * @param <E> type of consumed events
 * @param <C> type of issued commands
 */
public class SagaWorker<S extends State<S, E>, E, C> extends SubscriptionWorker<E> {
    private final S initialState;
    private final SagaReaction<S, E, C> reaction;
    private final RepositoryFactory<SagaRoot<S, E>> sagaRepositories;
    private final CommitDelegate commitDelegate;
    private final CommandHandlerProvider<? super C> commandHandlers;
    private final String sagaIdKey;

    public SagaWorker(SubscriptionContract contract, Class<E> eventType, S initialState,
            SagaReaction<S, E, C> reaction, RepositoryFactory<SagaRoot<S, E>> sagaRepositories,
            CommitDelegate commitDelegate, CommandHandlerProvider<? super C> commandHandlers,
            PersistentSubscriptions subscriptions, EventContractRegistry registry, EventDeserializer deserializer,
            AggregatesOptions options) {
        super(contract, eventType, subscriptions, registry, deserializer, options);
        this.initialState = Objects.requireNonNull(initialState, "Initial state must be provided");
        this.reaction = Objects.requireNonNull(reaction, "Reaction must be provided");
        this.sagaRepositories = Objects.requireNonNull(sagaRepositories, "Saga repository factory must be provided");
        this.commitDelegate = Objects.requireNonNull(commitDelegate, "Commit delegate must be provided");
        this.commandHandlers = Objects.requireNonNull(commandHandlers, "Command handlers must be provided");
        this.sagaIdKey = options.getSagaIdKey();
    }

    @Override
    protected void probe(E sample) {
        initialState.apply(sample);
    }

    @Override
    protected void dispatch(E event, Map<String, Object> metadata, MetadataScope scope, ResolvedEvent resolved)
            throws Exception {
        Optional<String> sagaId = sagaIdOf(metadata);
        if (!sagaId.isPresent()) {
            logger.debug("{} carries no {}, no saga to route to", resolved, sagaIdKey);
            return;
        }
        AggregateIdentifier identifier = AggregateIdentifier.of(sagaId.get());
        UnitOfWork unitOfWork = new UnitOfWork();
        Repository<SagaRoot<S, E>> repository = sagaRepositories.create(unitOfWork);
        try (UnitOfWorkScope commit = new UnitOfWorkScope(unitOfWork, scope, commitDelegate)) {
            Optional<SagaRoot<S, E>> existing = repository.tryGet(identifier);
            SagaRoot<S, E> root;
            if (existing.isPresent()) {
                root = existing.get();
            } else {
                root = SagaRoot.create(initialState);
                repository.add(identifier, root);
            }
            RecordedEvent target = resolved.getEvent();
            List<C> commands = root.accept(reaction, event, target.getStreamId(), target.getEventNumber(), metadata);
            for (C command : commands) {
                commandHandlers.create().handle(command, scope);
            }
            commit.complete();
        }
    }

    private Optional<String> sagaIdOf(Map<String, Object> metadata) {
        Object value = metadata.get(sagaIdKey);
        if (value instanceof List) {
            List<?> values = (List<?>) value;
            value = values.isEmpty() ? null : values.get(values.size() - 1);
        }
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
