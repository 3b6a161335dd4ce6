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

import io.github.goodees.aggregates.core.Command;
import io.github.goodees.aggregates.core.Repository;
import io.github.goodees.aggregates.core.State;
import io.github.goodees.aggregates.core.entity.EntityRoot;
import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.store.EventStoreException;

/**
 * Applies the command to an existing aggregate.
 * @see io.github.goodees.aggregates.core.AggregateRootNotFoundException
 */
public class ModificationHandler<C extends Command<S, E>, S extends State<S, E>, E> extends RoutingHandler<C, S, E> {
    public ModificationHandler(Repository<EntityRoot<S, E>> repository, S initialState) {
        super(repository, initialState);
    }

    @Override
    public void handle(C command, MetadataScope metadata) throws EventStoreException {
        repository.get(command.aggregateId()).accept(command, metadata);
    }
}
