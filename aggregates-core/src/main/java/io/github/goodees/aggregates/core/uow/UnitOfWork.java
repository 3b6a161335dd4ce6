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

import io.github.goodees.aggregates.core.Aggregate;
import io.github.goodees.aggregates.core.AggregateIdentifier;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregates loaded or created during one command execution.
 * <p>An identifier can be attached only once. At most one of the attached aggregates may change, a command changing
 * multiple aggregates is not supported.</p>
 * <p>Confined to a single execution, not thread safe.</p>
 */
public class UnitOfWork {
    private final Map<AggregateIdentifier, Aggregate> aggregates = new LinkedHashMap<>();

    public Optional<Aggregate> get(AggregateIdentifier identifier) {
        return Optional.ofNullable(aggregates.get(identifier));
    }

    /**
     * Attach an aggregate.
     * @param aggregate the aggregate
     * @throws IllegalStateException when aggregate with same identifier is already attached
     */
    public void attach(Aggregate aggregate) {
        Objects.requireNonNull(aggregate, "Aggregate must be provided");
        if (aggregate.isNone()) {
            throw new IllegalArgumentException("Cannot attach empty aggregate binding");
        }
        if (aggregates.putIfAbsent(aggregate.getIdentifier(), aggregate) != null) {
            throw new IllegalStateException("Aggregate " + aggregate.getIdentifier()
                    + " is already attached to this unit of work");
        }
    }

    /**
     * @return the aggregate with pending changes, or {@link Aggregate#NONE}
     * @throws UnsupportedOperationException when more than one aggregate has pending changes
     */
    public Aggregate getChanged() {
        Aggregate changed = Aggregate.NONE;
        for (Aggregate aggregate : aggregates.values()) {
            if (aggregate.getRoot().hasChanges()) {
                if (!changed.isNone()) {
                    throw new UnsupportedOperationException("Changing multiple aggregates in single unit of work"
                            + " is not supported. Changed: " + changed.getIdentifier() + ", "
                            + aggregate.getIdentifier());
                }
                changed = aggregate;
            }
        }
        return changed;
    }

    public boolean isEmpty() {
        return aggregates.isEmpty();
    }

    public void clear() {
        aggregates.clear();
    }
}
