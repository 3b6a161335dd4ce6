package io.github.goodees.aggregates.core.reaction;

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

import java.util.Map;
import java.util.stream.Stream;

/**
 * Turns consumed events into commands.
 * @param <E> type of consumed events
 * @param <C> type of issued commands
 */
@FunctionalInterface
public interface Reaction<E, C> {
    Stream<? extends C> react(E event, Map<String, Object> metadata);
}
