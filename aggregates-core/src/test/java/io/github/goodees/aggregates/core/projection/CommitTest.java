package io.github.goodees.aggregates.core.projection;

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

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

public class CommitTest {
    private final List<String> log = new ArrayList<>();

    private Commit logging(String entry) {
        return () -> log.add(entry);
    }

    @Test
    public void none_followed_by_commit_is_that_commit() {
        Commit next = logging("a");
        assertThat(Commit.none().andThen(next), sameInstance(next));
    }

    @Test
    public void commits_run_in_order() throws Exception {
        logging("a").andThen(logging("b")).andThen(logging("c")).commit();
        assertThat(log, contains("a", "b", "c"));
    }

    @Test
    public void failing_commit_stops_the_chain() {
        Commit failing = () -> {
            throw new IllegalStateException("failed");
        };
        try {
            logging("a").andThen(failing).andThen(logging("c")).commit();
            fail("Chain should fail");
        } catch (Exception e) {
            assertThat(log, contains("a"));
        }
    }

    @Test
    public void deferred_commit_is_created_on_commit() throws Exception {
        Commit deferred = Commit.deferred(() -> logging("created"));
        assertThat(log, empty());
        deferred.commit();
        assertThat(log, contains("created"));
    }
}
