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

import io.github.goodees.aggregates.core.example.cart.CartCleared;
import io.github.goodees.aggregates.core.example.cart.CartEvent;
import io.github.goodees.aggregates.core.example.cart.ItemAdded;
import io.github.goodees.aggregates.core.example.cart.ItemRemoved;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;

public class EventContractRegistryTest {
    private EventContractRegistry registry;

    static class ItemAddedV1 {
        final String item;

        ItemAddedV1() {
            this("unknown");
        }

        ItemAddedV1(String item) {
            this.item = item;
        }
    }

    static class ItemAddedV2 {
        final String item;
        final int quantity;

        ItemAddedV2(String item, int quantity) {
            this.item = item;
            this.quantity = quantity;
        }
    }

    @Before
    public void setUp() {
        registry = new EventContractRegistry();
    }

    @Test
    public void contract_wire_type_includes_namespace_and_version() {
        assertThat(EventContract.of("Shop.Cart", "ItemAdded", 2).toString(), is("Shop.Cart.ItemAdded@v2"));
        assertThat(EventContract.of("ItemAdded").toString(), is("ItemAdded@v1"));
    }

    @Test
    public void registered_type_is_written_under_its_contract() {
        registry.register(ItemAdded.class, EventContract.of("Cart", "ItemAdded", 1));
        assertThat(registry.wireTypeOf(new ItemAdded("apple", 1)), is("Cart.ItemAdded@v1"));
        assertThat(registry.findByWireType("Cart.ItemAdded@v1").get().getType(), equalTo(ItemAdded.class));
    }

    @Test
    public void types_without_contract_use_type_name() {
        registry.register(CartCleared.class);
        assertThat(registry.wireTypeOf(new CartCleared("x")), is("CartCleared"));
        assertThat(registry.wireTypeOf(new ItemRemoved("x")), is("ItemRemoved"));
    }

    @Test
    public void immutables_prefix_is_stripped() {
        assertThat(EventType.defaultTypeName("ImmutableItemAdded"), is("ItemAdded"));
        assertThat(EventType.defaultTypeName("Immutable"), is("Immutable"));
        assertThat(EventType.defaultTypeName("ItemAdded"), is("ItemAdded"));
    }

    @Test(expected = IllegalStateException.class)
    public void wire_type_can_be_registered_once() {
        registry.register(ItemAdded.class, EventContract.of("Cart", "ItemAdded", 1));
        registry.register(ItemAddedV2.class, EventContract.of("Cart", "ItemAdded", 1));
    }

    @Test
    public void upgrades_are_chained() {
        registry.register(ItemAddedV1.class, EventContract.of("ItemAdded", 1))
                .upgradeWith(e -> new ItemAddedV2(e.item, 1));
        registry.register(ItemAddedV2.class, EventContract.of("ItemAdded", 2))
                .upgradeWith(e -> new ItemAdded(e.item, e.quantity));
        registry.register(ItemAdded.class, EventContract.of("ItemAdded", 3));

        Object upgraded = registry.upgrade(new ItemAddedV1("apple"));
        assertThat(upgraded, equalTo(new ItemAdded("apple", 1)));
    }

    @Test
    public void upgrade_to_same_type_terminates() {
        registry.register(ItemAdded.class, EventContract.of("ItemAdded", 1))
                .upgradeWith(e -> new ItemAdded(e.getItem(), e.getQuantity() + 1));
        assertThat(registry.upgrade(new ItemAdded("apple", 1)), equalTo(new ItemAdded("apple", 2)));
    }

    @Test
    public void contracts_assignable_to_type_keep_registration_order() {
        registry.register(CartCleared.class, EventContract.of("CartCleared", 1));
        registry.register(ItemAddedV1.class, EventContract.of("Other", 1));
        registry.register(ItemRemoved.class);
        registry.register(ItemAdded.class, EventContract.of("ItemAdded", 1));

        List<String> names = registry.contractsAssignableTo(CartEvent.class).stream()
                .map(EventContractRegistry.Registration::wireType)
                .collect(Collectors.toList());
        assertThat(names, contains("CartCleared@v1", "ItemAdded@v1"));
    }

    @Test
    public void probe_uses_supplier_or_constructor() throws ReflectiveOperationException {
        EventContractRegistry.Registration<ItemAdded> added = registry.register(ItemAdded.class);
        assertThat(added.createProbe(), equalTo(new ItemAdded()));
        added.probeWith(() -> new ItemAdded("probe", 0));
        assertThat(added.createProbe(), equalTo(new ItemAdded("probe", 0)));
    }

    @Test
    public void unknown_wire_type_is_not_found() {
        assertFalse(registry.findByWireType("Nope@v1").isPresent());
        assertFalse(registry.findFor(new ItemAdded()).isPresent());
    }

    @Test
    public void subscription_contract_names_its_predecessor() {
        SubscriptionContract v1 = SubscriptionContract.of("Projections", "Carts", 1);
        SubscriptionContract v3 = SubscriptionContract.of("Projections", "Carts", 3);

        assertThat(v1.qualifiedName(), is("Projections.Carts@v1"));
        assertFalse(v1.predecessor().isPresent());
        assertThat(v3.predecessor(), is(Optional.of("Projections.Carts@v2")));
        assertThat(v3.continuingFrom("Legacy@v7").predecessor(), is(Optional.of("Legacy@v7")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void subscription_version_must_be_positive() {
        SubscriptionContract.of("Carts", 0);
    }
}
