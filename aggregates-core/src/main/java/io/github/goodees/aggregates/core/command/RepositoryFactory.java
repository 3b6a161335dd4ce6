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

import io.github.goodees.aggregates.core.AggregateRoot;
import io.github.goodees.aggregates.core.Repository;
import io.github.goodees.aggregates.core.uow.UnitOfWork;

/**
 * Creates repository bound to a unit of work.
 */
@FunctionalInterface
public interface RepositoryFactory<R extends AggregateRoot> {
    Repository<R> create(UnitOfWork unitOfWork);
}
