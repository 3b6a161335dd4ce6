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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Event as stored in the log.
 */
public final class RecordedEvent {
    private final UUID eventId;
    private final String streamId;
    private final long eventNumber;
    private final String eventType;
    private final byte[] data;
    private final byte[] metadata;
    private final Position position;
    private final Instant created;

    public RecordedEvent(UUID eventId, String streamId, long eventNumber, String eventType, byte[] data,
            byte[] metadata, Position position, Instant created) {
        this.eventId = Objects.requireNonNull(eventId);
        this.streamId = Objects.requireNonNull(streamId);
        this.eventNumber = eventNumber;
        this.eventType = Objects.requireNonNull(eventType);
        this.data = Objects.requireNonNull(data);
        this.metadata = metadata == null ? new byte[0] : metadata;
        this.position = Objects.requireNonNull(position);
        this.created = created;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * @return zero-based index of the event within its stream
     */
    public long getEventNumber() {
        return eventNumber;
    }

    public String getEventType() {
        return eventType;
    }

    public byte[] getData() {
        return data;
    }

    public byte[] getMetadata() {
        return metadata;
    }

    public Position getPosition() {
        return position;
    }

    public Instant getCreated() {
        return created;
    }

    @Override
    public String toString() {
        return eventNumber + "@" + streamId + " (" + eventType + ")";
    }
}
