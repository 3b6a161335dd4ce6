package io.github.goodees.aggregates.core;

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

import io.github.goodees.aggregates.core.store.EventStoreException;

import java.util.Optional;

/**
 * Loads roots of aggregates participating in current unit of work.
 * @param <R> type of the roots
 */
public interface Repository<R extends AggregateRoot> {
    /**
     * Get the root attached to current unit of work, or replay it from its stream and attach it.
     * @param identifier the aggregate
     * @return the root, or empty when the aggregate has no history
     * @throws EventStoreException when reading the stream fails
     * @throws IllegalStateException when identifier names a system stream
     */
    Optional<R> tryGet(AggregateIdentifier identifier) throws EventStoreException;

    /**
     * Same as {@link #tryGet(AggregateIdentifier)}, but requires the aggregate to exist.
     * @param identifier the aggregate
     * @return the root
     * @throws EventStoreException when reading the stream fails
     * @throws AggregateRootNotFoundException when the aggregate has no history
     */
    default R get(AggregateIdentifier identifier) throws EventStoreException {
        return tryGet(identifier).orElseThrow(() -> new AggregateRootNotFoundException(identifier));
    }

    /**
     * Attach newly created root to current unit of work.
     * @param identifier the aggregate
     * @param root the root
     * @throws IllegalStateException when the identifier is already attached
     */
    void add(AggregateIdentifier identifier, R root);
}
