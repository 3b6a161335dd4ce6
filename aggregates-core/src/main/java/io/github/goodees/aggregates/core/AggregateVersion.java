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
 * Position of the last event of an aggregate within its stream.
 * <p>{@link #NONE} stands for an aggregate without any history. Every other value equals the number of events in
 * the stream minus one.</p>
 */
public final class AggregateVersion implements Comparable<AggregateVersion> {
    public static final AggregateVersion NONE = new AggregateVersion(Long.MIN_VALUE);

    private final long value;

    private AggregateVersion(long value) {
        this.value = value;
    }

    /**
     * Version for given stream position. Negative values normalize to {@link #NONE}.
     * @param value position of last event
     * @return the version
     */
    public static AggregateVersion of(long value) {
        return value < 0 ? NONE : new AggregateVersion(value);
    }

    /**
     * Version after replay of given number of events.
     * @param eventCount number of events read from the stream
     * @return {@code eventCount - 1}, or {@link #NONE} for empty history
     */
    public static AggregateVersion afterReplayOf(long eventCount) {
        return of(eventCount - 1);
    }

    public long value() {
        return value;
    }

    public boolean isNone() {
        return value == Long.MIN_VALUE;
    }

    @Override
    public int compareTo(AggregateVersion o) {
        return Long.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AggregateVersion && ((AggregateVersion) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isNone() ? "NONE" : Long.toString(value);
    }
}
