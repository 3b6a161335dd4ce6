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

import java.util.Objects;

/**
 * Binding of an identifier to a loaded or created root.
 */
public final class Aggregate {
    public static final Aggregate NONE = new Aggregate(null, null);

    private final AggregateIdentifier identifier;
    private final AggregateRoot root;

    private Aggregate(AggregateIdentifier identifier, AggregateRoot root) {
        this.identifier = identifier;
        this.root = root;
    }

    public static Aggregate of(AggregateIdentifier identifier, AggregateRoot root) {
        return new Aggregate(Objects.requireNonNull(identifier, "Identifier must be provided"),
                Objects.requireNonNull(root, "Root must be provided"));
    }

    public AggregateIdentifier getIdentifier() {
        return identifier;
    }

    public AggregateRoot getRoot() {
        return root;
    }

    public boolean isNone() {
        return root == null;
    }

    @Override
    public String toString() {
        return isNone() ? "Aggregate[NONE]" : "Aggregate[" + identifier + "@" + root.getVersion() + "]";
    }
}
