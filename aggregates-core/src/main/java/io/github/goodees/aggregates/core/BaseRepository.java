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
import io.github.goodees.aggregates.core.uow.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Repository that consults the unit of work before loading a root, and attaches every loaded root.
 * <p>An identifier attached to the unit of work by a different repository cannot be read through this one.</p>
 * @param <R> type of the roots
 */
public abstract class BaseRepository<R extends AggregateRoot> implements Repository<R> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    protected final UnitOfWork unitOfWork;
    private final Map<AggregateIdentifier, R> attachedRoots = new HashMap<>();

    protected BaseRepository(UnitOfWork unitOfWork) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "Unit of work must be provided");
    }

    @Override
    public Optional<R> tryGet(AggregateIdentifier identifier) throws EventStoreException {
        Objects.requireNonNull(identifier, "Identifier must be provided");
        if (identifier.isSystemStream()) {
            throw new IllegalStateException("Repository must not read system stream " + identifier);
        }
        Optional<Aggregate> attached = unitOfWork.get(identifier);
        if (attached.isPresent()) {
            R root = attachedRoots.get(identifier);
            if (root == null || root != attached.get().getRoot()) {
                throw new IllegalStateException("Aggregate " + identifier + " was attached by another repository");
            }
            return Optional.of(root);
        }
        Optional<R> loaded = load(identifier);
        if (loaded.isPresent()) {
            logger.debug("Loaded {} at version {}", identifier, loaded.get().getVersion());
            add(identifier, loaded.get());
        }
        return loaded;
    }

    @Override
    public void add(AggregateIdentifier identifier, R root) {
        unitOfWork.attach(Aggregate.of(identifier, root));
        attachedRoots.put(identifier, root);
    }

    /**
     * Replay root from its stream.
     * @param identifier the aggregate
     * @return the root, or empty if stream does not exist
     * @throws EventStoreException when reading fails
     */
    protected abstract Optional<R> load(AggregateIdentifier identifier) throws EventStoreException;
}
