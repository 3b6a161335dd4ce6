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

/**
 * Persists the changes of a unit of work.
 */
@FunctionalInterface
public interface CommitDelegate {
    /**
     * Write pending changes of the unit of work.
     * @param unitOfWork the unit of work
     * @param metadata metadata of the execution, captured into every written event
     * @throws EventStoreException when write fails
     */
    void commit(UnitOfWork unitOfWork, MetadataScope metadata) throws EventStoreException;
}
