package io.github.goodees.aggregates.core.command;

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
 * Process wide policy deciding which commands create aggregates.
 */
public abstract class AggregateCreationBehaviour {
    /**
     * Every command loads its aggregate, or creates it when it does not exist.
     * @return the behaviour
     */
    public static AggregateCreationBehaviour automatic() {
        return Automatic.INSTANCE;
    }

    /**
     * Commands implementing the marker always create their aggregate, all other commands require it to exist.
     * @param marker the marker type
     * @return the behaviour
     */
    public static AggregateCreationBehaviour markerInterface(Class<?> marker) {
        return new MarkerInterface(marker);
    }

    /**
     * Resolve routing of a command type. Called once per command type at registration.
     * @param commandType the command type
     * @return the routing
     */
    public abstract CommandRouting routingFor(Class<?> commandType);

    static final class Automatic extends AggregateCreationBehaviour {
        static final Automatic INSTANCE = new Automatic();

        @Override
        public CommandRouting routingFor(Class<?> commandType) {
            return CommandRouting.GET_OR_ADD;
        }

        @Override
        public String toString() {
            return "Automatic";
        }
    }

    static final class MarkerInterface extends AggregateCreationBehaviour {
        private final Class<?> marker;

        MarkerInterface(Class<?> marker) {
            this.marker = Objects.requireNonNull(marker, "Marker type must be specified");
        }

        @Override
        public CommandRouting routingFor(Class<?> commandType) {
            return marker.isAssignableFrom(commandType) ? CommandRouting.CREATION : CommandRouting.MODIFICATION;
        }

        @Override
        public String toString() {
            return "MarkerInterface[" + marker.getName() + "]";
        }
    }
}
