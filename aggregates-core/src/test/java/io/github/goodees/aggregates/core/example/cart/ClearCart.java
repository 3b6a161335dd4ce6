package io.github.goodees.aggregates.core.example.cart;

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

import io.github.goodees.aggregates.core.AggregateIdentifier;
import io.github.goodees.aggregates.core.Command;

import java.util.stream.Stream;

public final class ClearCart implements Command<CartState, CartEvent> {
    private final String cartId;

    public ClearCart(String cartId) {
        this.cartId = cartId;
    }

    @Override
    public AggregateIdentifier aggregateId() {
        return AggregateIdentifier.of(cartId);
    }

    @Override
    public Stream<CartCleared> progress(CartState state) {
        return state.isEmpty() ? Stream.empty() : Stream.of(new CartCleared("requested"));
    }
}
