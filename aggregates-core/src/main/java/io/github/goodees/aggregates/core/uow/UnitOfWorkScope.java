package io.github.goodees.aggregates.core.uow;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Commit scope of one execution.
 * <p>When the scope closes after {@link #complete()} was called, changes of the unit of work are committed. The unit
 * of work is cleared on close in any case.</p>
 * <pre>
 * try (UnitOfWorkScope scope = new UnitOfWorkScope(unitOfWork, metadata, commitDelegate)) {
 *     handle(command);
 *     scope.complete();
 * }
 * </pre>
 */
public class UnitOfWorkScope implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UnitOfWorkScope.class);

    private final UnitOfWork unitOfWork;
    private final MetadataScope metadata;
    private final CommitDelegate commitDelegate;
    private boolean completed;
    private boolean closed;

    public UnitOfWorkScope(UnitOfWork unitOfWork, MetadataScope metadata, CommitDelegate commitDelegate) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "Unit of work must be provided");
        this.metadata = Objects.requireNonNull(metadata, "Metadata scope must be provided");
        this.commitDelegate = Objects.requireNonNull(commitDelegate, "Commit delegate must be provided");
    }

    public UnitOfWork getUnitOfWork() {
        return unitOfWork;
    }

    /**
     * Mark the execution successful.
     */
    public void complete() {
        this.completed = true;
    }

    public boolean isCompleted() {
        return completed;
    }

    @Override
    public void close() throws EventStoreException {
        if (closed) {
            return;
        }
        closed = true;
        Exception failure = null;
        try {
            if (completed) {
                commitDelegate.commit(unitOfWork, metadata);
            }
        } catch (EventStoreException | RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            clear(failure);
        }
    }

    private void clear(Exception commitFailure) {
        try {
            unitOfWork.clear();
        } catch (RuntimeException e) {
            if (commitFailure == null) {
                throw e;
            }
            logger.warn("Clearing unit of work failed after failed commit", e);
            commitFailure.addSuppressed(e);
        }
    }
}
