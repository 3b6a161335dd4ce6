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

/**
 * Event delivered from the log, along with the link event that pointed to it, if any.
 */
public final class ResolvedEvent {
    private final RecordedEvent event;
    private final RecordedEvent link;

    public ResolvedEvent(RecordedEvent event, RecordedEvent link) {
        this.event = Objects.requireNonNull(event);
        this.link = link;
    }

    public static ResolvedEvent of(RecordedEvent event) {
        return new ResolvedEvent(event, null);
    }

    /**
     * @return the target event
     */
    public RecordedEvent getEvent() {
        return event;
    }

    /**
     * @return link that resolved to the event, or null
     */
    public RecordedEvent getLink() {
        return link;
    }

    /**
     * @return the record actually read from the stream: the link if present, the event otherwise
     */
    public RecordedEvent getOriginalEvent() {
        return link != null ? link : event;
    }

    public Position getOriginalPosition() {
        return getOriginalEvent().getPosition();
    }

    @Override
    public String toString() {
        return link != null ? link + " -> " + event : event.toString();
    }
}
