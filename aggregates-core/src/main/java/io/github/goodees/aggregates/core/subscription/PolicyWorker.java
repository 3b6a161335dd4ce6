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
import io.github.goodees.aggregates.core.reaction.PolicyErrorHandling;
import io.github.goodees.aggregates.core.reaction.Reaction;
import io.github.goodees.aggregates.core.serialization.EventDeserializer;
import io.github.goodees.aggregates.core.store.PersistentSubscriptions;
import io.github.goodees.aggregates.core.store.ResolvedEvent;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reaction worker tolerating failures of some commands issued for an event, as configured by
 * {@link PolicyErrorHandling}.
 * @param <E> type of consumed events
 * @param <C> type of issued commands
 */
public class PolicyWorker<E, C> extends ReactionWorker<E, C> {
    private final PolicyErrorHandling errorHandling;

    public PolicyWorker(SubscriptionContract contract, Class<E> eventType, Reaction<E, C> policy,
            PolicyErrorHandling errorHandling, CommandHandlerProvider<? super C> commandHandlers,
            PersistentSubscriptions subscriptions, EventContractRegistry registry, EventDeserializer deserializer,
            AggregatesOptions options) {
        super(contract, eventType, policy, commandHandlers, subscriptions, registry, deserializer, options);
        this.errorHandling = Objects.requireNonNull(errorHandling, "Error handling must be provided");
    }

    public PolicyErrorHandling getErrorHandling() {
        return errorHandling;
    }

    @Override
    protected void dispatch(E event, Map<String, Object> metadata, MetadataScope scope, ResolvedEvent resolved)
            throws Exception {
        List<C> batch = commandsFor(event, metadata);
        PolicyErrorHandling.ErrorBudget budget = errorHandling.budgetFor(batch.size());
        for (C command : batch) {
            try {
                execute(command, scope);
            } catch (Exception e) {
                if (!budget.tolerate()) {
                    throw e;
                }
                logger.error("Command {} issued for {} in {} failed, but policy {} tolerates {} errors so far",
                        command, resolved, contract, errorHandling, budget.getErrors(), e);
            }
        }
    }
}
