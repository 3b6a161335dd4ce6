package io.github.goodees.aggregates.core;

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

import io.github.goodees.aggregates.core.command.AggregateCreationBehaviour;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Process wide settings of aggregates, sagas and subscription workers.
 */
public class AggregatesOptions {
    public static final String PREFIX = "aggregates.";

    private AggregateCreationBehaviour creationBehaviour = AggregateCreationBehaviour.automatic();
    private String sagaIdKey = "SagaId";
    private int commitAttempts = 5;
    private Duration commitBackoff = Duration.ofMillis(100);
    private int maxDeliveryRetries = 5;

    /**
     * Read options from properties. Recognized keys are {@code aggregates.sagaIdKey},
     * {@code aggregates.commit.attempts}, {@code aggregates.commit.backoffMillis},
     * {@code aggregates.subscription.maxDeliveryRetries} and {@code aggregates.creation.marker}, the latter being
     * class name of creation marker interface. Missing keys keep their defaults.
     * @param properties the properties
     * @return options
     */
    public static AggregatesOptions fromProperties(Properties properties) {
        AggregatesOptions options = new AggregatesOptions();
        String sagaIdKey = properties.getProperty(PREFIX + "sagaIdKey");
        if (sagaIdKey != null) {
            options.setSagaIdKey(sagaIdKey.trim());
        }
        String attempts = properties.getProperty(PREFIX + "commit.attempts");
        if (attempts != null) {
            options.setCommitAttempts(Integer.parseInt(attempts.trim()));
        }
        String backoff = properties.getProperty(PREFIX + "commit.backoffMillis");
        if (backoff != null) {
            options.setCommitBackoff(Duration.ofMillis(Long.parseLong(backoff.trim())));
        }
        String retries = properties.getProperty(PREFIX + "subscription.maxDeliveryRetries");
        if (retries != null) {
            options.setMaxDeliveryRetries(Integer.parseInt(retries.trim()));
        }
        String marker = properties.getProperty(PREFIX + "creation.marker");
        if (marker != null && !marker.trim().isEmpty()) {
            try {
                ClassLoader loader = Thread.currentThread().getContextClassLoader();
                options.setCreationBehaviour(AggregateCreationBehaviour.markerInterface(
                        Class.forName(marker.trim(), false, loader != null ? loader : AggregatesOptions.class.getClassLoader())));
            } catch (ClassNotFoundException e) {
                throw new IllegalArgumentException("Creation marker " + marker + " not found", e);
            }
        }
        return options;
    }

    public AggregateCreationBehaviour getCreationBehaviour() {
        return creationBehaviour;
    }

    public AggregatesOptions setCreationBehaviour(AggregateCreationBehaviour creationBehaviour) {
        this.creationBehaviour = Objects.requireNonNull(creationBehaviour, "Creation behaviour must be specified");
        return this;
    }

    /**
     * @return metadata key saga workers read saga id from
     */
    public String getSagaIdKey() {
        return sagaIdKey;
    }

    public AggregatesOptions setSagaIdKey(String sagaIdKey) {
        this.sagaIdKey = Objects.requireNonNull(sagaIdKey, "Saga id key must be specified");
        return this;
    }

    public int getCommitAttempts() {
        return commitAttempts;
    }

    public AggregatesOptions setCommitAttempts(int commitAttempts) {
        if (commitAttempts < 1) {
            throw new IllegalArgumentException("At least one commit attempt must be allowed");
        }
        this.commitAttempts = commitAttempts;
        return this;
    }

    public Duration getCommitBackoff() {
        return commitBackoff;
    }

    public AggregatesOptions setCommitBackoff(Duration commitBackoff) {
        this.commitBackoff = Objects.requireNonNull(commitBackoff, "Backoff must be specified");
        return this;
    }

    /**
     * @return retry count below which failed messages are retried, rather than parked
     */
    public int getMaxDeliveryRetries() {
        return maxDeliveryRetries;
    }

    public AggregatesOptions setMaxDeliveryRetries(int maxDeliveryRetries) {
        this.maxDeliveryRetries = maxDeliveryRetries;
        return this;
    }
}
