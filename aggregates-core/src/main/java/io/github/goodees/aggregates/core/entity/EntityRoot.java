package io.github.goodees.aggregates.core.entity;

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

import io.github.goodees.aggregates.core.AggregateRoot;
import io.github.goodees.aggregates.core.AggregateVersion;
import io.github.goodees.aggregates.core.Command;
import io.github.goodees.aggregates.core.State;
import io.github.goodees.aggregates.core.metadata.MetadataScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Root of an entity aggregate.
 * <p>Holds current state, the version it was loaded at, and events produced by the last accepted command. A root
 * accepts commands one at a time.</p>
 * @param <S> type of the state
 * @param <E> type of events applicable to the state
 */
public class EntityRoot<S extends State<S, E>, E> implements AggregateRoot {
    private final AggregateVersion version;
    private final List<Object> changes = new ArrayList<>();
    private final AtomicBoolean accepting = new AtomicBoolean();
    private S state;

    public EntityRoot(S state, AggregateVersion version) {
        this.state = Objects.requireNonNull(state, "State must be provided");
        this.version = Objects.requireNonNull(version, "Version must be provided");
    }

    /**
     * Root of an aggregate with no history.
     * @param initial the initial state
     * @param <S> type of the state
     * @param <E> type of the events
     * @return new root at version {@link AggregateVersion#NONE}
     */
    public static <S extends State<S, E>, E> EntityRoot<S, E> create(S initial) {
        return new EntityRoot<>(initial, AggregateVersion.NONE);
    }

    public S getState() {
        return state;
    }

    @Override
    public AggregateVersion getVersion() {
        return version;
    }

    @Override
    public List<Object> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    /**
     * Let the command progress the state. Every produced event is applied to the state and recorded as a change.
     * Every resulting state and finally the command contribute their metadata into the scope.
     * @param command the command
     * @param metadata metadata scope of current execution
     * @throws IllegalStateException when another command is being accepted by this root
     */
    public void accept(Command<S, E> command, MetadataScope metadata) {
        Objects.requireNonNull(command, "Command must be provided");
        if (!accepting.compareAndSet(false, true)) {
            throw new IllegalStateException("Root is already accepting command, cannot accept " + command);
        }
        try {
            changes.clear();
            try (Stream<? extends E> events = command.progress(state)) {
                events.forEachOrdered(event -> {
                    Objects.requireNonNull(event, "Command produced null event");
                    state = state.apply(event);
                    changes.add(event);
                    metadata.contributeFrom(state);
                });
            }
            metadata.contributeFrom(command);
        } finally {
            accepting.set(false);
        }
    }

    @Override
    public String toString() {
        return "EntityRoot{" + state + " @ " + version + ", changes=" + changes.size() + "}";
    }
}
