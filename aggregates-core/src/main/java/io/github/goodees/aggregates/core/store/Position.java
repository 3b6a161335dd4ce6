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

/**
 * Position of an event within the whole log.
 */
public final class Position implements Comparable<Position> {
    public static final Position START = new Position(0);
    public static final Position END = new Position(Long.MAX_VALUE);

    private final long commitPosition;

    private Position(long commitPosition) {
        this.commitPosition = commitPosition;
    }

    public static Position of(long commitPosition) {
        if (commitPosition < 0) {
            throw new IllegalArgumentException("Position must not be negative, was " + commitPosition);
        }
        return commitPosition == Long.MAX_VALUE ? END : new Position(commitPosition);
    }

    public long getCommitPosition() {
        return commitPosition;
    }

    public boolean isEnd() {
        return commitPosition == Long.MAX_VALUE;
    }

    @Override
    public int compareTo(Position o) {
        return Long.compare(commitPosition, o.commitPosition);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Position && ((Position) o).commitPosition == commitPosition;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(commitPosition);
    }

    @Override
    public String toString() {
        return isEnd() ? "END" : Long.toString(commitPosition);
    }
}
