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

import java.util.Objects;

/**
 * Runs the delegate in a child of the caller's metadata scope.
 */
public class MetadataAwareHandler<C> implements CommandHandler<C> {
    private final CommandHandler<C> delegate;

    public MetadataAwareHandler(CommandHandler<C> delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void handle(C command, MetadataScope metadata) throws EventStoreException {
        delegate.handle(command, metadata.createChild());
    }
}
