package io.github.goodees.aggregates.core.store;

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

import io.github.goodees.aggregates.core.AggregateVersion;

/**
 * Values of expected version for {@link EventStore#appendToStream}.
 */
public final class ExpectedVersion {
    /**
     * The stream must not exist yet.
     */
    public static final long NO_STREAM = -1;

    private ExpectedVersion() {

    }

    public static long of(AggregateVersion version) {
        return version.isNone() ? NO_STREAM : version.value();
    }
}
