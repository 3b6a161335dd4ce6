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

import io.github.goodees.aggregates.core.AggregatesOptions;
import io.github.goodees.aggregates.core.Command;
import io.github.goodees.aggregates.core.State;
import io.github.goodees.aggregates.core.entity.EntityRoot;
import io.github.goodees.aggregates.core.uow.CommitDelegate;
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds command handling pipelines for aggregates of one state type.
 * <p>Each handler created by a registered provider composes, outermost first: {@link MetadataAwareHandler},
 * {@link UnitOfWorkAwareHandler} over a fresh {@link UnitOfWork}, and the routing handler selected for the command
 * type by {@link AggregateCreationBehaviour}.</p>
 * @param <S> the state type
 * @param <E> events of the state
 */
public class CommandHandlers<S extends State<S, E>, E> {
    private static final Logger logger = LoggerFactory.getLogger(CommandHandlers.class);

    private final AggregatesOptions options;
    private final S initialState;
    private final RepositoryFactory<EntityRoot<S, E>> repositories;
    private final CommitDelegate commitDelegate;

    public CommandHandlers(AggregatesOptions options, S initialState, RepositoryFactory<EntityRoot<S, E>> repositories,
            CommitDelegate commitDelegate) {
        this.options = Objects.requireNonNull(options, "Options must be provided");
        this.initialState = Objects.requireNonNull(initialState, "Initial state must be provided");
        this.repositories = Objects.requireNonNull(repositories, "Repository factory must be provided");
        this.commitDelegate = Objects.requireNonNull(commitDelegate, "Commit delegate must be provided");
    }

    /**
     * Register command type.
     * @param commandType the command type
     * @param <C> the command type
     * @return provider of handlers for the command
     */
    public <C extends Command<S, E>> CommandHandlerProvider<C> register(Class<C> commandType) {
        CommandRouting routing = options.getCreationBehaviour().routingFor(commandType);
        logger.debug("Commands {} are routed by {}", commandType.getName(), routing);
        return () -> {
            UnitOfWork unitOfWork = new UnitOfWork();
            RoutingHandler<C, S, E> router = routing.handler(repositories.create(unitOfWork), initialState);
            return new MetadataAwareHandler<>(new UnitOfWorkAwareHandler<>(unitOfWork, commitDelegate, router));
        };
    }
}
