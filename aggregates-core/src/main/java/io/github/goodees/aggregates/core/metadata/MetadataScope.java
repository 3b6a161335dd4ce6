package io.github.goodees.aggregates.core.metadata;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Metadata gathered during one execution, captured into the metadata of every event that execution writes.
 * <p>A scope is passed explicitly along the call chain of a command or a consumed event. Nested executions work in
 * a {@link #createChild() child scope}, which starts with a copy of all the parent's entries. Entries added to a
 * child are not visible to its parent.</p>
 * <p>A scope is confined to a single execution and is not thread safe.</p>
 */
public final class MetadataScope {
    private final Map<String, Object> entries;
    // keys whose value is a list collected from MULTIPLE additions
    private final Set<String> collected;

    private MetadataScope(Map<String, Object> entries, Set<String> collected) {
        this.entries = entries;
        this.collected = collected;
    }

    /**
     * @return new empty scope
     */
    public static MetadataScope empty() {
        return new MetadataScope(new LinkedHashMap<>(), new HashSet<>());
    }

    /**
     * Scope seeded with given entries, e.g. with the metadata stored along a consumed event. List values are taken
     * as collected values, further {@link MetadataMultiplicity#MULTIPLE} additions append to them.
     * @param seed initial entries, may be null
     * @return new scope
     */
    public static MetadataScope of(Map<String, ?> seed) {
        MetadataScope scope = empty();
        if (seed != null) {
            seed.forEach((k, v) -> {
                if (v instanceof List) {
                    scope.entries.put(k, Collections.unmodifiableList(new ArrayList<>((List<?>) v)));
                    scope.collected.add(k);
                } else if (v != null) {
                    scope.entries.put(k, v);
                }
            });
        }
        return scope;
    }

    /**
     * @return new scope inheriting all entries of this one
     */
    public MetadataScope createChild() {
        return new MetadataScope(new LinkedHashMap<>(entries), new HashSet<>(collected));
    }

    public MetadataScope add(String key, Object value) {
        return add(key, value, MetadataMultiplicity.SINGLE);
    }

    /**
     * Add an entry.
     * With {@link MetadataMultiplicity#SINGLE} the value replaces whatever was stored under the key. With
     * {@link MetadataMultiplicity#MULTIPLE} the first value is stored as is and a second one turns the entry into a
     * list of both values. Further values are appended to that list. A list added as a value is never merged into
     * the collected values.
     * @param key the key
     * @param value the value
     * @param multiplicity how to combine with existing value
     * @return this scope
     */
    public MetadataScope add(String key, Object value, MetadataMultiplicity multiplicity) {
        Objects.requireNonNull(key, "Metadata key must be provided");
        Objects.requireNonNull(value, "Metadata value must be provided");
        Objects.requireNonNull(multiplicity, "Multiplicity must be provided");
        Object existing = entries.get(key);
        if (multiplicity == MetadataMultiplicity.SINGLE || existing == null) {
            entries.put(key, value);
            collected.remove(key);
            return this;
        }
        List<Object> values = new ArrayList<>();
        if (collected.contains(key)) {
            values.addAll((List<?>) existing);
        } else {
            values.add(existing);
        }
        values.add(value);
        entries.put(key, Collections.unmodifiableList(values));
        collected.add(key);
        return this;
    }

    /**
     * Let the object contribute its metadata, if it is a {@link MetadataContributor}.
     * @param source any object
     * @return this scope
     */
    public MetadataScope contributeFrom(Object source) {
        if (source instanceof MetadataContributor) {
            ((MetadataContributor) source).contributeTo(this);
        }
        return this;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return immutable snapshot of current entries in insertion order
     */
    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public String toString() {
        return "MetadataScope" + entries;
    }
}
