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
import io.github.goodees.aggregates.core.command.CommandHandlerProvider;
import io.github.goodees.aggregates.core.contract.EventContractRegistry;
import io.github.goodees.aggregates.core.contract.SubscriptionContract;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.reaction.Reaction;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.store.EventStoreException;
import io.github.goodees.aggregates.core.store.PersistentSubscriptions;
import io.github.goodees.aggregates.core.store.ResolvedEvent;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Executes commands a reaction issues for consumed events. Every command is handled by a new handler.
 * @param <E> type of consumed events
 * @param <C> type of issued commands
 */
public class ReactionWorker<E, C> extends SubscriptionWorker<E> {
    protected final Reaction<E, C> reaction;
    protected final CommandHandlerProvider<? super C> commandHandlers;

    public ReactionWorker(SubscriptionContract contract, Class<E> eventType, Reaction<E, C> reaction,
            CommandHandlerProvider<? super C> commandHandlers, PersistentSubscriptions subscriptions,
            EventContractRegistry registry, EventDeserializer deserializer, AggregatesOptions options) {
        super(contract, eventType, subscriptions, registry, deserializer, options);
        this.reaction = Objects.requireNonNull(reaction, "Reaction must be provided");
        this.commandHandlers = Objects.requireNonNull(commandHandlers, "Command handlers must be provided");
    }

    @Override
    protected void probe(E sample) {
        commandsFor(sample, Collections.emptyMap());
    }

    @Override
    protected void dispatch(E event, Map<String, Object> metadata, MetadataScope scope, ResolvedEvent resolved)
            throws Exception {
        for (C command : commandsFor(event, metadata)) {
            execute(command, scope);
        }
    }

    /**
     * @param event the event
     * @param metadata its metadata
     * @return all commands the reaction issues for the event
     */
    protected List<C> commandsFor(E event, Map<String, Object> metadata) {
        try (Stream<? extends C> commands = reaction.react(event, metadata)) {
            return commands.collect(Collectors.toList());
        }
    }

    /**
     * Handle command with new handler.
     * @param command the command
     * @param scope metadata scope of the consumed event
     * @throws EventStoreException when loading or committing the aggregate fails
     */
    protected void execute(C command, MetadataScope scope) throws EventStoreException {
        commandHandlers.create().handle(command, scope);
    }
}
