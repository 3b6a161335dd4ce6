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

/**
 * Creates new aggregate for the command. Existence of the stream is not checked here, the append fails with
 * version conflict when the aggregate already exists.
 */
public class CreationHandler<C extends Command<S, E>, S extends State<S, E>, E> extends RoutingHandler<C, S, E> {
    public CreationHandler(Repository<EntityRoot<S, E>> repository, S initialState) {
        super(repository, initialState);
    }

    @Override
    public void handle(C command, MetadataScope metadata) {
        EntityRoot<S, E> root = EntityRoot.create(initialState);
        repository.add(command.aggregateId(), root);
        root.accept(command, metadata);
    }
}
