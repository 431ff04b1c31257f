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

package org.tributary.projection.sample.shop;

import org.tributary.eventstore.api.RawEvent;
import org.tributary.projection.Projector;
import org.tributary.testsupport.shop.OrderPlaced;
import org.tributary.testsupport.shop.OrderShipped;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class OrderListProjector implements Projector {
    public final Map<String, String> statusByOrderId = new ConcurrentHashMap<>();
    public final List<Long> appliedSequenceNumbers = new CopyOnWriteArrayList<>();
    public volatile String failOnOrderId;
    public volatile int resets;

    public void whenOrderPlaced(OrderPlaced event, RawEvent rawEvent) {
        if (event.orderId().equals(failOnOrderId)) {
            throw new IllegalStateException("Cannot list order " + event.orderId());
        }
        statusByOrderId.put(event.orderId(), "placed by " + event.customer());
        appliedSequenceNumbers.add(rawEvent.sequenceNumber());
    }

    public void whenOrderShipped(OrderShipped event, RawEvent rawEvent) {
        statusByOrderId.put(event.orderId(), "shipped");
        appliedSequenceNumbers.add(rawEvent.sequenceNumber());
    }

    @Override
    public void reset() {
        resets++;
        statusByOrderId.clear();
        appliedSequenceNumbers.clear();
    }
}
