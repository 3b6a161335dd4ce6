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

import java.util.Objects;

/**
 * Change of a saga: an event of another stream the saga reacted to. It is stored in the saga's stream as a link.
 */
public final class LinkedEvent {
    private final Object event;
    private final String streamId;
    private final long eventNumber;

    public LinkedEvent(Object event, String streamId, long eventNumber) {
        this.event = Objects.requireNonNull(event);
        this.streamId = Objects.requireNonNull(streamId);
        this.eventNumber = eventNumber;
    }

    public Object getEvent() {
        return event;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getEventNumber() {
        return eventNumber;
    }

    /**
     * @return the reference stored as data of link event
     */
    public String toLinkData() {
        return eventNumber + "@" + streamId;
    }

    @Override
    public String toString() {
        return toLinkData();
    }
}
