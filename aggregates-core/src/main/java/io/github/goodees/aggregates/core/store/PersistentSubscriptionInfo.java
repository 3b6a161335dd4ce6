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
import java.util.Optional;

/**
 * Description of a persistent subscription known to the log.
 */
public final class PersistentSubscriptionInfo {
    private final String groupName;
    private final Position lastKnownEventPosition;
    private final long processedMessages;
    private final long parkedMessages;

    public PersistentSubscriptionInfo(String groupName, Position lastKnownEventPosition, long processedMessages,
            long parkedMessages) {
        this.groupName = Objects.requireNonNull(groupName);
        this.lastKnownEventPosition = lastKnownEventPosition;
        this.processedMessages = processedMessages;
        this.parkedMessages = parkedMessages;
    }

    public String getGroupName() {
        return groupName;
    }

    /**
     * @return position of the last event acknowledged on this subscription, empty if none was
     */
    public Optional<Position> getLastKnownEventPosition() {
        return Optional.ofNullable(lastKnownEventPosition);
    }

    public long getProcessedMessages() {
        return processedMessages;
    }

    public long getParkedMessages() {
        return parkedMessages;
    }

    @Override
    public String toString() {
        return groupName + "[last=" + lastKnownEventPosition + ", processed=" + processedMessages
                + ", parked=" + parkedMessages + "]";
    }
}
