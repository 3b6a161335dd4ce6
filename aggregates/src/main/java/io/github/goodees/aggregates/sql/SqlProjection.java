package io.github.goodees.aggregates.sql;

/*-
 * #%L
 * aggregates
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

import io.github.goodees.aggregates.core.projection.Commit;
import io.github.goodees.aggregates.core.projection.Projection;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;

/**
 * Projection into relational database. Each event results in SQL commands executed in one transaction.
 * @param <E> type of projected events
 */
public abstract class SqlProjection<E> implements Projection<E> {
    private final DataSource dataSource;

    protected SqlProjection(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource);
    }

    @Override
    public final Commit apply(E event, Map<String, Object> metadata) {
        SqlCommit commit = project(event, metadata, SqlCommit.on(dataSource));
        return commit.isEmpty() ? Commit.none() : commit;
    }

    /**
     * Build commands for the event.
     * @param event the event
     * @param metadata metadata of the event
     * @param commit empty commit to append commands to
     * @return commit with commands for the event
     */
    protected abstract SqlCommit project(E event, Map<String, Object> metadata, SqlCommit commit);
}
