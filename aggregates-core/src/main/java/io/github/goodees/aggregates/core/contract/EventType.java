package io.github.goodees.aggregates.core.contract;

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
 * Naming of event types that declare no contract.
 */
public class EventType {
    static final String IMMUTABLES_PREFIX = "Immutable";

    private EventType() {

    }

    /**
     * Bare type name of an event class. Prefix {@code Immutable} of classes generated by Immutables is stripped, so
     * that the name matches the declared value type.
     * @param clazz the event class
     * @return simple name. ImmutableItemAdded becomes ItemAdded.
     */
    public static String defaultTypeName(Class<?> clazz) {
        return defaultTypeName(clazz.getSimpleName());
    }

    public static String defaultTypeName(String simpleClassName) {
        return simpleClassName.startsWith(IMMUTABLES_PREFIX) && simpleClassName.length() > IMMUTABLES_PREFIX.length()
                ? simpleClassName.substring(IMMUTABLES_PREFIX.length())
                : simpleClassName;
    }
}
