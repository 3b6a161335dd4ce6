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

/**
 * Management of the log's persistent subscriptions to all streams.
 */
public interface PersistentSubscriptions {
    List<PersistentSubscriptionInfo> listAll() throws EventStoreException;

    /**
     * Create subscription to all streams.
     * @param groupName name of the subscription
     * @param eventTypeFilter regular expression the whole event type of delivered events must match
     * @param startFrom position of the first event to deliver
     * @throws EventStoreException when subscription exists or creation fails
     */
    void create(String groupName, String eventTypeFilter, Position startFrom) throws EventStoreException;

    void delete(String groupName) throws EventStoreException;

    PersistentSubscription subscribe(String groupName) throws EventStoreException;
}
