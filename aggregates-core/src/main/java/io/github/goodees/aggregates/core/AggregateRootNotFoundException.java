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

/**
 * Thrown when a command requires an existing aggregate, but its stream does not exist.
 */
public class AggregateRootNotFoundException extends RuntimeException {
    private final AggregateIdentifier identifier;

    public AggregateRootNotFoundException(AggregateIdentifier identifier) {
        super("Aggregate root " + identifier + " was not found");
        this.identifier = identifier;
    }

    public AggregateIdentifier getIdentifier() {
        return identifier;
    }
}
