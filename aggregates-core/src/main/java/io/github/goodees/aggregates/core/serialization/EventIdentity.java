package io.github.goodees.aggregates.core.serialization;

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

import com.google.common.hash.Hashing;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.AggregateVersion;

import java.util.UUID;

/**
 * Deterministic identity of written events.
 * <p>The same event written again for the same aggregate at the same position gets the same id, so that the log
 * recognizes appends repeated after a failed commit as duplicates.</p>
 */
public final class EventIdentity {
    private EventIdentity() {

    }

    /**
     * Compute event id. Aggregate identifier, {@code version + offset}, murmur3 hash of the payload and the type name
     * are digested by MD5 into a name based UUID.
     * @param identifier the aggregate
     * @param version version of the aggregate before the commit
     * @param offset index of the event among the events of the aggregate in current commit
     * @param payload serialized event
     * @param typeName type name of the event
     * @return the id
     */
    public static UUID create(AggregateIdentifier identifier, AggregateVersion version, int offset, byte[] payload,
            String typeName) {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        out.writeUTF(identifier.value());
        out.writeLong(version.value() + offset);
        out.writeLong(Hashing.murmur3_128().hashBytes(payload).asLong());
        out.writeUTF(typeName);
        return UUID.nameUUIDFromBytes(out.toByteArray());
    }
}
