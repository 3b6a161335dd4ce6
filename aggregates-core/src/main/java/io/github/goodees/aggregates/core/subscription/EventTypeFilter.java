package io.github.goodees.aggregates.core.subscription;

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

import io.github.goodees.aggregates.core.contract.EventContract;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Regular expressions selecting events of a subscription by their type.
 */
public final class EventTypeFilter {
    private EventTypeFilter() {

    }

    /**
     * Anchored alternation of wire names of the contracts, with dots escaped.
     * Contracts {@code N.A@v1} and {@code B@v1} result in {@code ^(?:N\.A@v1|B@v1)$}.
     * @param contracts contracts to match
     * @return the filter expression
     */
    public static String matching(Collection<EventContract> contracts) {
        return contracts.stream()
                .map(c -> c.toString().replace(".", "\\."))
                .collect(Collectors.joining("|", "^(?:", ")$"));
    }
}
