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

/**
 * Codec of event payloads and metadata.
 */
public interface Serializer {
    /**
     * @param value value to serialize
     * @return serialized form
     * @throws SerializationException when value cannot be serialized
     */
    byte[] serialize(Object value);

    /**
     * @param data serialized form
     * @param type target type
     * @param <T> target type
     * @return the value
     * @throws SerializationException when data cannot be read as the type
     */
    <T> T deserialize(byte[] data, Class<T> type);
}
