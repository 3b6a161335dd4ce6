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
 * Immutable state of an aggregate, rebuilt by folding its events in log order.
 * The initial state is supplied to the repository that replays the aggregate.
 * @param <S> the concrete state type
 * @param <E> base type of events the state applies
 */
public interface State<S extends State<S, E>, E> {
    /**
     * Fold single event into the state. Must not perform any I/O.
     * @param event the event
     * @return the new state
     */
    S apply(E event);
}
