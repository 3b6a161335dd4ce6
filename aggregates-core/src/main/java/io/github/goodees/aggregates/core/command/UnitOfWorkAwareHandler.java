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

import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.store.EventStoreException;
import io.github.goodees.aggregates.core.uow.CommitDelegate;
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import io.github.goodees.aggregates.core.uow.UnitOfWorkScope;

import java.util.Objects;

/**
 * Commits the unit of work after the delegate handled the command successfully.
 */
public class UnitOfWorkAwareHandler<C> implements CommandHandler<C> {
    private final UnitOfWork unitOfWork;
    private final CommitDelegate commitDelegate;
    private final CommandHandler<C> delegate;

    public UnitOfWorkAwareHandler(UnitOfWork unitOfWork, CommitDelegate commitDelegate, CommandHandler<C> delegate) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork);
        this.commitDelegate = Objects.requireNonNull(commitDelegate);
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void handle(C command, MetadataScope metadata) throws EventStoreException {
        try (UnitOfWorkScope scope = new UnitOfWorkScope(unitOfWork, metadata, commitDelegate)) {
            delegate.handle(command, metadata);
            scope.complete();
        }
    }
}
