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

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads and appends streams of the event log.
 */
public interface EventStore {
    /**
     * Read entire stream from its beginning.
     * @param streamId the stream
     * @param resolveLinks whether link events should be resolved to the events they point to
     * @return accessor for the events in order they appeared in the stream
     * @throws EventStoreException with fault {@link EventStoreException.Fault#STREAM_NOT_FOUND} when stream does not
     * exist, or when read fails
     */
    StoredEvents readStreamForwards(String streamId, boolean resolveLinks) throws EventStoreException;

    /**
     * Append events to a stream.
     * Appending events whose ids are all already present at the end of the stream succeeds without change.
     * @param streamId the stream
     * @param expectedVersion event number of the last event in the stream, or {@link ExpectedVersion#NO_STREAM}
     * @param events events to append
     * @return event number of the last event in the stream after the append
     * @throws EventStoreException with fault {@link EventStoreException.Fault#OPTIMISTIC_LOCK} on version mismatch,
     * transient faults when the outcome is unknown
     */
    long appendToStream(String streamId, long expectedVersion, List<EventData> events) throws EventStoreException;

    /**
     * Accessor that enables single iteration over found events.
     * Only one of methods foreach and reduce may be called on single instance, and only once.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super ResolvedEvent> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super ResolvedEvent, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
