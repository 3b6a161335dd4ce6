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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Single SQL command of a {@link SqlCommit}.
 */
public final class Query {
    private final String text;
    private final Map<String, Object> parameters;
    private final CommandKind kind;

    public Query(String text, Map<String, ?> parameters, CommandKind kind) {
        this.text = Objects.requireNonNull(text);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.kind = Objects.requireNonNull(kind);
    }

    public static Query text(String sql, Map<String, ?> parameters) {
        return new Query(sql, parameters, CommandKind.TEXT);
    }

    public static Query procedure(String name, Map<String, ?> parameters) {
        return new Query(name, parameters, CommandKind.STORED_PROCEDURE);
    }

    public String getText() {
        return text;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public CommandKind getKind() {
        return kind;
    }

    /**
     * @return statement as passed to the driver, with named parameter placeholders
     */
    public String toStatement() {
        if (kind == CommandKind.TEXT) {
            return text;
        }
        return parameters.keySet().stream()
                .map(name -> ":" + name)
                .collect(Collectors.joining(", ", "{call " + text + "(", ")}"));
    }

    @Override
    public String toString() {
        return kind + " " + text + " " + parameters;
    }
}
