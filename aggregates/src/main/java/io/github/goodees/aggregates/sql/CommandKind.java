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

/**
 * How the text of a {@link Query} is executed.
 */
public enum CommandKind {
    /**
     * Text is a statement with named parameters.
     */
    TEXT,
    /**
     * Text is a name of stored procedure, called with the parameters in their order.
     */
    STORED_PROCEDURE
}
