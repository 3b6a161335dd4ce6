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

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when a failed append should be retried.
 */
@FunctionalInterface
public interface CommitRetryStrategy {
    long DO_NOT_RETRY = -1;
    long RETRY_NOW = 0;

    /**
     * @param streamId stream the append failed on
     * @param failure the failure
     * @param completedAttempts number of attempts made so far, at least {@code 1}
     * @return negative to fail the commit, otherwise delay in milliseconds before next attempt
     */
    long retryDelay(String streamId, EventStoreException failure, int completedAttempts);

    CommitRetryStrategy NO_RETRIES = (streamId, failure, attempts) -> DO_NOT_RETRY;

    /**
     * Retry transient faults, waiting {@code backoff * completedAttempts} before each retry. Other faults, most
     * notably version conflicts, are never retried.
     * @param attempts total number of attempts to allow
     * @param backoff base delay
     * @return a retry strategy
     */
    static CommitRetryStrategy growingBackoff(int attempts, Duration backoff) {
        Objects.requireNonNull(backoff, "Backoff must be specified");
        if (attempts < 1) {
            throw new IllegalArgumentException("At least one attempt must be allowed");
        }
        long delay = backoff.toMillis();
        return (streamId, failure, completedAttempts) -> failure.isTransient() && completedAttempts < attempts
                ? delay * completedAttempts
                : DO_NOT_RETRY;
    }
}
