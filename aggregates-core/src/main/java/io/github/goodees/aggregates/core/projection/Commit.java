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

import java.util.Objects;

/**
 * Effect of a projection step, executed after the projection applied an event and before the event is acknowledged.
 */
@FunctionalInterface
public interface Commit {
    Commit NONE = () -> {
    };

    void commit() throws Exception;

    /**
     * @return commit that does nothing
     */
    static Commit none() {
        return NONE;
    }

    /**
     * Commit whose effect is computed only when it is committed.
     * @param factory creates the actual commit
     * @return deferred commit
     */
    static Commit deferred(Factory factory) {
        Objects.requireNonNull(factory);
        return () -> factory.create().commit();
    }

    /**
     * @param next commit to run after this one succeeds
     * @return commit running both, in order
     */
    default Commit andThen(Commit next) {
        Objects.requireNonNull(next);
        if (this == NONE) {
            return next;
        }
        return () -> {
            commit();
            next.commit();
        };
    }

    @FunctionalInterface
    interface Factory {
        Commit create() throws Exception;
    }
}
