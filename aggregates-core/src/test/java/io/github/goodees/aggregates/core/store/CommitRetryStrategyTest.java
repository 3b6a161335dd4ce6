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

import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class CommitRetryStrategyTest {
    private final CommitRetryStrategy strategy = CommitRetryStrategy.growingBackoff(3, Duration.ofMillis(100));

    @Test
    public void transient_faults_are_retried_with_growing_delay() {
        EventStoreException failure = EventStoreException.deadlineExceeded("append", null);
        assertThat(strategy.retryDelay("cart-1", failure, 1), is(100L));
        assertThat(strategy.retryDelay("cart-1", failure, 2), is(200L));
    }

    @Test
    public void attempts_are_limited() {
        EventStoreException failure = EventStoreException.unknown("append", null);
        assertThat(strategy.retryDelay("cart-1", failure, 3), is(CommitRetryStrategy.DO_NOT_RETRY));
    }

    @Test
    public void version_conflicts_are_not_retried() {
        EventStoreException failure = EventStoreException.optimisticLock("cart-1", 1, 2);
        assertThat(strategy.retryDelay("cart-1", failure, 1), is(CommitRetryStrategy.DO_NOT_RETRY));
    }

    @Test(expected = IllegalArgumentException.class)
    public void at_least_one_attempt_is_required() {
        CommitRetryStrategy.growingBackoff(0, Duration.ZERO);
    }
}
