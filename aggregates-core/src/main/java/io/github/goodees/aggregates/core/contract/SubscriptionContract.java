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
import java.util.Optional;

/**
 * Versioned name of a persistent subscription consumed by a projection, reaction, saga or policy.
 * <p>A contract of version greater than one continues from its previous version by default: when the previous
 * subscription exists at startup, the new one starts at its last position and the previous one is deleted.</p>
 */
public final class SubscriptionContract {
    private final String namespace;
    private final String name;
    private final int version;
    private final String continueFrom;
    private final boolean startFromEnd;

    private SubscriptionContract(String namespace, String name, int version, String continueFrom, boolean startFromEnd) {
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
        this.continueFrom = continueFrom;
        this.startFromEnd = startFromEnd;
    }

    public static SubscriptionContract of(String name, int version) {
        return new SubscriptionContract(null, name, version, null, false);
    }

    public static SubscriptionContract of(String namespace, String name, int version) {
        return new SubscriptionContract(namespace, name, version, null, false);
    }

    /**
     * @param predecessor fully qualified name of the subscription to continue from
     * @return copy of this contract with explicit predecessor
     */
    public SubscriptionContract continuingFrom(String predecessor) {
        return new SubscriptionContract(namespace, name, version, Objects.requireNonNull(predecessor), startFromEnd);
    }

    /**
     * @return copy of this contract that starts at the end of the log when it has no predecessor
     */
    public SubscriptionContract startingFromEnd() {
        return new SubscriptionContract(namespace, name, version, continueFrom, true);
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

    public boolean isStartFromEnd() {
        return startFromEnd;
    }

    /**
     * @return the name of the persistent subscription
     */
    public String qualifiedName() {
        return qualifiedName(version);
    }

    /**
     * @return explicit predecessor, or this contract at previous version when version is greater than one
     */
    public Optional<String> predecessor() {
        if (continueFrom != null) {
            return Optional.of(continueFrom);
        }
        return version > 1 ? Optional.of(qualifiedName(version - 1)) : Optional.empty();
    }

    private String qualifiedName(int v) {
        return (namespace == null ? "" : namespace + ".") + name + "@v" + v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubscriptionContract)) {
            return false;
        }
        SubscriptionContract that = (SubscriptionContract) o;
        return version == that.version && startFromEnd == that.startFromEnd
                && Objects.equals(namespace, that.namespace) && name.equals(that.name)
                && Objects.equals(continueFrom, that.continueFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name, version, continueFrom, startFromEnd);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
