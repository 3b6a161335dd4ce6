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
 * Exception generated when reading from or writing to the event log fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Expected version did not match the stream. Never retried.
         */
        OPTIMISTIC_LOCK(false),
        STREAM_NOT_FOUND(false),
        DEADLINE_EXCEEDED(true),
        /**
         * Outcome of the operation is not known.
         */
        UNKNOWN(true),
        TX_ERROR(false),
        PROGRAMMATIC_ERROR(false);

        private final boolean transientFault;

        Fault(boolean transientFault) {
            this.transientFault = transientFault;
        }

        public boolean isTransient() {
            return transientFault;
        }
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isTransient() {
        return fault.isTransient();
    }

    public static EventStoreException optimisticLock(String streamId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Append to stream " + streamId + " expected version "
                + describe(expectedVersion) + " while current version is " + describe(actualVersion), null);
    }

    public static EventStoreException streamNotFound(String streamId) {
        return new EventStoreException(Fault.STREAM_NOT_FOUND, "Stream " + streamId + " does not exist", null);
    }

    public static EventStoreException deadlineExceeded(String operation, Throwable cause) {
        return new EventStoreException(Fault.DEADLINE_EXCEEDED, "Deadline exceeded during " + operation, cause);
    }

    public static EventStoreException unknown(String operation, Throwable cause) {
        return new EventStoreException(Fault.UNKNOWN, "Unknown outcome of " + operation
                + (cause != null ? ". " + cause.getMessage() : ""), cause);
    }

    public static EventStoreException storeFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
                "Store of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException subscriptionNotFound(String groupName) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Subscription " + groupName + " does not exist", null);
    }

    public static EventStoreException subscriptionExists(String groupName) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Subscription " + groupName + " already exists", null);
    }

    public static EventStoreException subscriptionDropped(String groupName, Throwable cause) {
        return new EventStoreException(Fault.UNKNOWN, "Subscription " + groupName + " was dropped", cause);
    }

    private static String describe(long version) {
        return version == ExpectedVersion.NO_STREAM ? "NO_STREAM" : Long.toString(version);
    }
}
