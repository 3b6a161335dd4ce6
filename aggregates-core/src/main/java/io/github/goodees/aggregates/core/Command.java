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

import java.util.stream.Stream;

/**
 * Request to change an aggregate.
 * @param <S> state of the target aggregate
 * @param <E> base type of events the command produces
 */
public interface Command<S extends State<S, E>, E> {
    /**
     * @return identifier of the aggregate this command targets
     */
    AggregateIdentifier aggregateId();

    /**
     * Produce events against current state. The stream is consumed lazily, one event at a time, and every
     * event is applied to the state before the next one is requested.
     * @param state current state of the aggregate
     * @return events to apply, possibly empty
     */
    Stream<? extends E> progress(S state);
}
