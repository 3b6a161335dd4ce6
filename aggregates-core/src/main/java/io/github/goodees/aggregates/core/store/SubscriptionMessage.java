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
 * Message received over a persistent subscription.
 */
public abstract class SubscriptionMessage {
    private SubscriptionMessage() {

    }

    /**
     * The log confirmed the subscription is open.
     */
    public static final class Confirmation extends SubscriptionMessage {
        private final String subscriptionId;

        public Confirmation(String subscriptionId) {
            this.subscriptionId = subscriptionId;
        }

        public String getSubscriptionId() {
            return subscriptionId;
        }

        @Override
        public String toString() {
            return "Confirmation{" + subscriptionId + "}";
        }
    }

    /**
     * An event was delivered.
     */
    public static final class EventAppeared extends SubscriptionMessage {
        private final ResolvedEvent event;
        private final int retryCount;

        public EventAppeared(ResolvedEvent event, int retryCount) {
            this.event = Objects.requireNonNull(event);
            this.retryCount = retryCount;
        }

        public ResolvedEvent getEvent() {
            return event;
        }

        /**
         * @return how many times the event was delivered before
         */
        public int getRetryCount() {
            return retryCount;
        }

        @Override
        public String toString() {
            return "EventAppeared{" + event + ", retry=" + retryCount + "}";
        }
    }
}
