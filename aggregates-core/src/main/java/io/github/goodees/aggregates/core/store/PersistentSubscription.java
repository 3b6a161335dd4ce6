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
 * Open connection to a persistent subscription.
 * Instances are used by a single consumer thread, except {@link #close()} which may be called from any thread.
 */
public interface PersistentSubscription extends AutoCloseable {
    /**
     * Wait for next message.
     * @return next message, or null when the subscription was closed
     * @throws InterruptedException when the waiting thread is interrupted
     * @throws EventStoreException when the subscription is dropped
     */
    SubscriptionMessage next() throws InterruptedException, EventStoreException;

    void ack(ResolvedEvent event) throws EventStoreException;

    void nak(NakAction action, String reason, ResolvedEvent event) throws EventStoreException;

    // will not throw exception
    @Override
    void close();
}
