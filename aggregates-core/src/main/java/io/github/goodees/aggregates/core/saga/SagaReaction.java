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

import java.util.Map;
import java.util.stream.Stream;

/**
 * Decides which commands to issue when a saga receives an event.
 * @param <S> state of the saga
 * @param <E> events the saga consumes
 * @param <C> commands the saga issues
 */
@FunctionalInterface
public interface SagaReaction<S, E, C> {
    Stream<? extends C> react(S state, E event, Map<String, Object> metadata);
}
