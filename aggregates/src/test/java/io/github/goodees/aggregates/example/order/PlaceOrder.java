package io.github.goodees.aggregates.example.order;

/*-
 * #%L
 * aggregates
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

import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.Command;
import io.github.goodees.aggregates.core.metadata.MetadataContributor;
import io.github.goodees.aggregates.core.metadata.MetadataScope;

import java.time.Instant;
import java.util.stream.Stream;

public final class PlaceOrder implements Command<OrderState, OrderEvent>, MetadataContributor {
    private final String orderId;
    private final String customer;
    private final String sku;

    public PlaceOrder(String orderId, String customer, String sku) {
        this.orderId = orderId;
        this.customer = customer;
        this.sku = sku;
    }

    @Override
    public AggregateIdentifier aggregateId() {
        return AggregateIdentifier.of(orderId);
    }

    @Override
    public Stream<? extends OrderEvent> progress(OrderState state) {
        if (state.isPlaced()) {
            throw new IllegalStateException("Order " + orderId + " was already placed");
        }
        return Stream.of(ImmutableOrderPlaced.builder().customer(customer).placedAt(Instant.now()).build(),
                ImmutableItemOrdered.builder().sku(sku).quantity(1).build());
    }

    @Override
    public void contributeTo(MetadataScope scope) {
        scope.add("Customer", customer);
    }
}
