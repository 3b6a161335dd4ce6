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

import io.github.goodees.aggregates.core.metadata.MetadataScope;
import io.github.goodees.aggregates.core.metadata.MetadataContributor;

public final class CartCleared implements CartEvent, MetadataContributor {
    private static final long serialVersionUID = 1L;
    private final String reason;

    public CartCleared() {
        this("");
    }

    public CartCleared(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public void contributeTo(MetadataScope scope) {
        scope.add("ClearReason", reason);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CartCleared && reason.equals(((CartCleared) o).reason);
    }

    @Override
    public int hashCode() {
        return reason.hashCode();
    }

    @Override
    public String toString() {
        return "CartCleared{" + reason + "}";
    }
}
