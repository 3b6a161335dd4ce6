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

import java.util.Objects;
import java.util.UUID;

/**
 * Event prepared for append.
 */
public final class EventData {
    /**
     * Type of events that link to an event of another stream.
     */
    public static final String LINK_EVENT_TYPE = "$>";

    private final UUID eventId;
    private final String type;
    private final byte[] data;
    private final byte[] metadata;

    public EventData(UUID eventId, String type, byte[] data, byte[] metadata) {
        this.eventId = Objects.requireNonNull(eventId, "Event id must be provided");
        this.type = Objects.requireNonNull(type, "Event type must be provided");
        this.data = Objects.requireNonNull(data, "Event data must be provided");
        this.metadata = metadata == null ? new byte[0] : metadata;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getType() {
        return type;
    }

    public byte[] getData() {
        return data;
    }

    public byte[] getMetadata() {
        return metadata;
    }

    public boolean isLink() {
        return LINK_EVENT_TYPE.equals(type);
    }

    @Override
    public String toString() {
        return "EventData{" + type + ", id=" + eventId + "}";
    }
}
