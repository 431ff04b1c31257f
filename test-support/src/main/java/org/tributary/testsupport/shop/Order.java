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

package org.tributary.testsupport.shop;

import java.util.Collections;
import java.util.List;

/**
 * A small order aggregate expressed as functions from the event history to new events.
 */
public class Order {

    public static List<ShopEvent> place(List<ShopEvent> events, String orderId, String customer) {
        if (!events.isEmpty()) {
            throw new IllegalStateException("No previous events can exist when placing an order");
        }
        return Collections.singletonList(new OrderPlaced(orderId, customer));
    }

    public static List<ShopEvent> ship(List<ShopEvent> events) {
        String orderId = requirePlaced(events);
        if (events.stream().anyMatch(e -> e instanceof OrderShipped || e instanceof OrderCancelled)) {
            throw new IllegalStateException("Order " + orderId + " cannot be shipped");
        }
        return Collections.singletonList(new OrderShipped(orderId));
    }

    public static List<ShopEvent> cancel(List<ShopEvent> events, String reason) {
        String orderId = requirePlaced(events);
        if (events.stream().anyMatch(OrderShipped.class::isInstance)) {
            throw new IllegalStateException("Order " + orderId + " is already shipped");
        }
        return Collections.singletonList(new OrderCancelled(orderId, reason));
    }

    private static String requirePlaced(List<ShopEvent> events) {
        return events.stream()
                .filter(OrderPlaced.class::isInstance)
                .map(ShopEvent::orderId)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Order has not been placed"));
    }
}
