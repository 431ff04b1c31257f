/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.projection.sample.misrouted;

import org.tributary.projection.Projector;
import org.tributary.testsupport.billing.InvoiceIssued;
import org.tributary.testsupport.shop.OrderPlaced;

import java.util.HashSet;
import java.util.Set;

// Handles events of both the shop and the billing bounded context
public class InvoicedOrdersProjector implements Projector {
    public final Set<String> placed = new HashSet<>();
    public final Set<String> invoiced = new HashSet<>();

    public void whenOrderPlaced(OrderPlaced event) {
        placed.add(event.orderId());
    }

    public void whenInvoiceIssued(InvoiceIssued event) {
        invoiced.add(event.orderId());
    }

    @Override
    public void reset() {
        placed.clear();
        invoiced.clear();
    }
}
