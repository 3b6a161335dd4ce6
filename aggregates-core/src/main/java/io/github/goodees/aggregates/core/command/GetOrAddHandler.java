package io.github.goodees.aggregates.core.command;

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
import io.github.goodees.aggregates.core.Command;
import io.github.goodees.aggregates.core.Repository;
import io.github.goodees.aggregates.core.State;
import io.github.goodees.aggregates.core.entity.EntityRoot;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.store.EventStoreException;

import java.util.Optional;

/**
 * Loads the aggregate, or creates it when it has no history, and lets it accept the command.
 */
public class GetOrAddHandler<C extends Command<S, E>, S extends State<S, E>, E> extends RoutingHandler<C, S, E> {
    public GetOrAddHandler(Repository<EntityRoot<S, E>> repository, S initialState) {
        super(repository, initialState);
    }

    @Override
    public void handle(C command, MetadataScope metadata) throws EventStoreException {
        AggregateIdentifier identifier = command.aggregateId();
        Optional<EntityRoot<S, E>> existing = repository.tryGet(identifier);
        EntityRoot<S, E> root;
        if (existing.isPresent()) {
            root = existing.get();
        } else {
            root = EntityRoot.create(initialState);
            repository.add(identifier, root);
        }
        root.accept(command, metadata);
    }
}
