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

/**
 * Handles commands of one type.
 * @param <C> type of the command
 */
@FunctionalInterface
public interface CommandHandler<C> {
    /**
     * Handle a command within given metadata scope.
     * @param command the command
     * @param metadata scope of the caller
     * @throws EventStoreException when loading or committing the aggregate fails
     */
    void handle(C command, MetadataScope metadata) throws EventStoreException;

    /**
     * Handle a command outside of any scope.
     * @param command the command
     * @throws EventStoreException when loading or committing the aggregate fails
     */
    default void handle(C command) throws EventStoreException {
        handle(command, MetadataScope.empty());
    }
}
