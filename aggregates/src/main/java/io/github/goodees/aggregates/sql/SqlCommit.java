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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Commit executing queued SQL commands in single transaction.
 * Instances are immutable, every query method returns new commit with the command appended.
 */
public final class SqlCommit implements Commit {
    private static final Logger logger = LoggerFactory.getLogger(SqlCommit.class);

    private final DataSource dataSource;
    private final List<Query> queries;

    private SqlCommit(DataSource dataSource, List<Query> queries) {
        this.dataSource = dataSource;
        this.queries = queries;
    }

    /**
     * @param dataSource database the commands run against
     * @return commit without any commands
     */
    public static SqlCommit on(DataSource dataSource) {
        return new SqlCommit(Objects.requireNonNull(dataSource), Collections.emptyList());
    }

    public SqlCommit query(String sql) {
        return append(Query.text(sql, Collections.emptyMap()));
    }

    public SqlCommit query(String sql, Map<String, ?> parameters) {
        return append(Query.text(sql, parameters));
    }

    public SqlCommit procedure(String name, Map<String, ?> parameters) {
        return append(Query.procedure(name, parameters));
    }

    public SqlCommit append(Query query) {
        List<Query> next = new ArrayList<>(queries);
        next.add(Objects.requireNonNull(query));
        return new SqlCommit(dataSource, Collections.unmodifiableList(next));
    }

    public List<Query> getQueries() {
        return queries;
    }

    public boolean isEmpty() {
        return queries.isEmpty();
    }

    @Override
    public void commit() {
        if (queries.isEmpty()) {
            return;
        }
        NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(dataSource);
        TransactionTemplate transaction = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        transaction.executeWithoutResult(status -> {
            for (Query query : queries) {
                logger.debug("Executing {}", query);
                jdbc.update(query.toStatement(), new MapSqlParameterSource(query.getParameters()));
            }
        });
    }

    @Override
    public String toString() {
        return "SqlCommit" + queries;
    }
}
