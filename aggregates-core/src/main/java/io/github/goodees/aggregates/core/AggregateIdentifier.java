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
 * Name of a stream holding the history of one aggregate.
 * Identifiers starting with {@value #SYSTEM_STREAM_PREFIX} are reserved by the event log.
 */
public final class AggregateIdentifier {
    public static final char SYSTEM_STREAM_PREFIX = '$';

    private final String value;

    private AggregateIdentifier(String value) {
        this.value = value;
    }

    public static AggregateIdentifier of(String value) {
        Objects.requireNonNull(value, "Identifier value must be provided");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        return new AggregateIdentifier(value);
    }

    public String value() {
        return value;
    }

    public boolean isSystemStream() {
        return value.charAt(0) == SYSTEM_STREAM_PREFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateIdentifier)) {
            return false;
        }
        return value.equals(((AggregateIdentifier) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
