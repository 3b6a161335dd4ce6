package io.github.goodees.aggregates.core.contract;

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
 * Name of an event independent of its Java type.
 * The wire form is {@code [namespace.]name@v{version}}.
 */
public final class EventContract {
    private final String namespace;
    private final String name;
    private final int version;

    private EventContract(String namespace, String name, int version) {
        Objects.requireNonNull(name, "Contract name must be provided");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Contract name must not be blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Contract version must be positive, was " + version);
        }
        this.namespace = namespace == null || namespace.isEmpty() ? null : namespace;
        this.name = name;
        this.version = version;
    }

    public static EventContract of(String name) {
        return new EventContract(null, name, 1);
    }

    public static EventContract of(String name, int version) {
        return new EventContract(null, name, version);
    }

    public static EventContract of(String namespace, String name, int version) {
        return new EventContract(namespace, name, version);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventContract)) {
            return false;
        }
        EventContract that = (EventContract) o;
        return version == that.version && Objects.equals(namespace, that.namespace) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name, version);
    }

    @Override
    public String toString() {
        return (namespace == null ? "" : namespace + ".") + name + "@v" + version;
    }
}
