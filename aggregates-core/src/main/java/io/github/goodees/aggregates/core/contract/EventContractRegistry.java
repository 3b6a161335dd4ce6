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

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Registry of event types known to the process.
 * <p>Types are registered at startup, each optionally under an {@link EventContract}. The registry resolves the wire
 * type of events being written, the Java type of events being read, their upgrade chain, and which contracts
 * a subscription consuming a given type could receive.</p>
 */
public class EventContractRegistry {
    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final Map<String, Registration<?>> byWireType = new ConcurrentHashMap<>();
    private final Map<Class<?>, Registration<?>> byType = new ConcurrentHashMap<>();

    /**
     * Register event type under a contract.
     * @param type the event class
     * @param contract its contract
     * @param <E> event type
     * @return the registration, which can be further configured with probe and upgrade
     */
    public <E> Registration<E> register(Class<E> type, EventContract contract) {
        Objects.requireNonNull(contract, "Contract must be provided. Use register(Class) for types without contract");
        return add(new Registration<>(type, contract));
    }

    /**
     * Register event type without a contract. It is written and read under its bare type name, but never
     * selected by subscription filters.
     * @param type the event class
     * @param <E> event type
     * @return the registration
     */
    public <E> Registration<E> register(Class<E> type) {
        return add(new Registration<>(type, null));
    }

    private synchronized <E> Registration<E> add(Registration<E> registration) {
        Objects.requireNonNull(registration.type, "Event type must be provided");
        String wireType = registration.wireType();
        if (byWireType.containsKey(wireType)) {
            throw new IllegalStateException("Event type " + wireType + " is already registered for "
                    + byWireType.get(wireType).type.getName());
        }
        if (byType.containsKey(registration.type)) {
            throw new IllegalStateException("Class " + registration.type.getName() + " is already registered as "
                    + byType.get(registration.type).wireType());
        }
        byWireType.put(wireType, registration);
        byType.put(registration.type, registration);
        registrations.add(registration);
        return registration;
    }

    public Optional<Registration<?>> findByWireType(String wireType) {
        return Optional.ofNullable(byWireType.get(wireType));
    }

    /**
     * Find registration of the event's class, or of closest registered superclass or interface.
     * @param event the event
     * @return registration if any
     */
    public Optional<Registration<?>> findFor(Object event) {
        Class<?> type = event.getClass();
        Registration<?> direct = byType.get(type);
        if (direct != null) {
            return Optional.of(direct);
        }
        return registrations.stream().filter(r -> r.type.isAssignableFrom(type)).findFirst();
    }

    /**
     * Wire type of an event: its contract when one is registered, the bare type name otherwise.
     * @param event the event
     * @return event type to store in the log
     */
    public String wireTypeOf(Object event) {
        return findFor(event).map(Registration::wireType).orElseGet(() -> EventType.defaultTypeName(event.getClass()));
    }

    /**
     * Apply upgrades registered for the event's type, repeatedly, until the event's type declares no upgrade.
     * @param event event as read from the log
     * @return the newest shape of the event
     */
    public Object upgrade(Object event) {
        Object current = event;
        Set<Class<?>> visited = new HashSet<>();
        while (visited.add(current.getClass())) {
            Registration<?> registration = byType.get(current.getClass());
            if (registration == null || registration.upgrader == null) {
                break;
            }
            current = registration.applyUpgrade(current);
        }
        return current;
    }

    /**
     * Registrations having a contract, whose type is assignable to given type, in order of registration.
     * @param type the type consumed by a subscription
     * @return matching registrations
     */
    public List<Registration<?>> contractsAssignableTo(Class<?> type) {
        List<Registration<?>> result = new ArrayList<>();
        for (Registration<?> registration : registrations) {
            if (registration.contract != null && type.isAssignableFrom(registration.type)) {
                result.add(registration);
            }
        }
        return result;
    }

    /**
     * Registered event type.
     * @param <E> the event type
     */
    public static final class Registration<E> {
        private final Class<E> type;
        private final EventContract contract;
        private volatile Supplier<? extends E> probe;
        private volatile EventUpgrader<? super E, ?> upgrader;

        Registration(Class<E> type, EventContract contract) {
            this.type = type;
            this.contract = contract;
        }

        /**
         * Supply the empty instance used to probe which subscriptions consume this type. By default the no-arg
         * constructor is used.
         * @param probe supplier of empty instance
         * @return this registration
         */
        public Registration<E> probeWith(Supplier<? extends E> probe) {
            this.probe = Objects.requireNonNull(probe);
            return this;
        }

        /**
         * Declare how this type migrates to its next version. The result type should be registered too, so that
         * upgrades can chain.
         * @param upgrader the upgrade function
         * @return this registration
         */
        public Registration<E> upgradeWith(EventUpgrader<? super E, ?> upgrader) {
            this.upgrader = Objects.requireNonNull(upgrader);
            return this;
        }

        public Class<E> getType() {
            return type;
        }

        public Optional<EventContract> getContract() {
            return Optional.ofNullable(contract);
        }

        public String wireType() {
            return contract != null ? contract.toString() : EventType.defaultTypeName(type);
        }

        /**
         * Create empty instance of the type.
         * @return the instance
         * @throws ReflectiveOperationException when no probe was configured and the type has no usable no-arg
         * constructor
         */
        public E createProbe() throws ReflectiveOperationException {
            Supplier<? extends E> supplier = probe;
            if (supplier != null) {
                return supplier.get();
            }
            Constructor<E> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        }

        private Object applyUpgrade(Object event) {
            Object upgraded = upgrader.upgrade(type.cast(event));
            return Objects.requireNonNull(upgraded, () -> "Upgrade of " + wireType() + " returned null");
        }

        @Override
        public String toString() {
            return wireType() + "=" + type.getName();
        }
    }
}
