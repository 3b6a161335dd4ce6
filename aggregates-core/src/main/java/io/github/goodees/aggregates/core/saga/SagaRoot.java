package io.github.goodees.aggregates.core.saga;

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
import io.github.goodees.aggregates.core.State;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Root of a saga. Its stream consists of links to the events the saga reacted to.
 * @param <S> type of the saga state
 * @param <E> type of the events the saga consumes
 */
public class SagaRoot<S extends State<S, E>, E> implements AggregateRoot {
    private final S state;
    private final AggregateVersion version;
    private final List<Object> changes = new ArrayList<>();

    public SagaRoot(S state, AggregateVersion version) {
        this.state = Objects.requireNonNull(state, "State must be provided");
        this.version = Objects.requireNonNull(version, "Version must be provided");
    }

    public static <S extends State<S, E>, E> SagaRoot<S, E> create(S initial) {
        return new SagaRoot<>(initial, AggregateVersion.NONE);
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
     * Record the event as change of this saga and let the reaction decide on commands, against the state before
     * the event.
     * @param reaction the saga's reaction
     * @param event the event
     * @param streamId stream the event was read from
     * @param eventNumber number of the event in that stream
     * @param metadata metadata of the event
     * @param <C> type of commands
     * @return commands to execute
     */
    public <C> List<C> accept(SagaReaction<? super S, ? super E, C> reaction, E event, String streamId, long eventNumber,
            Map<String, Object> metadata) {
        changes.add(new LinkedEvent(event, streamId, eventNumber));
        try (Stream<? extends C> commands = reaction.react(state, event, metadata)) {
            return commands.collect(Collectors.toList());
        }
    }

    @Override
    public String toString() {
        return "SagaRoot{" + state + " @ " + version + ", changes=" + changes.size() + "}";
    }
}
