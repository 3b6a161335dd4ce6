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

import java.util.List;

/**
 * In-memory holder of one stream's reconstructed state, its version and events pending commit.
 */
public interface AggregateRoot {
    AggregateVersion getVersion();

    /**
     * @return events produced by the most recently accepted command, in order of production
     */
    List<Object> getChanges();

    default boolean hasChanges() {
        return !getChanges().isEmpty();
    }
}
