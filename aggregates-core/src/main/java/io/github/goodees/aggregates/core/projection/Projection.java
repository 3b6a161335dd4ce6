package io.github.goodees.aggregates.core.projection;

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

/**
 * Read model maintained from events of a subscription.
 * <p>{@code apply} should only describe the effect of the event. Events the projection does not handle should be
 * rejected by an exception, which excludes their type from the subscription filter.</p>
 * @param <E> type of consumed events
 */
@FunctionalInterface
public interface Projection<E> {
    Commit apply(E event, Map<String, Object> metadata);
}
