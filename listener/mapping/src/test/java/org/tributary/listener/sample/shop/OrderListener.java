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

package org.tributary.listener.sample.shop;

import org.tributary.eventstore.api.RawEvent;
import org.tributary.listener.EventListener;
import org.tributary.testsupport.shop.OrderPlaced;
import org.tributary.testsupport.shop.OrderShipped;

import java.util.ArrayList;
import java.util.List;

public class OrderListener implements EventListener {
    public final List<Object> received = new ArrayList<>();
    public final List<Long> sequenceNumbers = new ArrayList<>();

    public void whenOrderPlaced(OrderPlaced event) {
        received.add(event);
    }

    public void whenOrderShipped(OrderShipped event, RawEvent rawEvent) {
        received.add(event);
        sequenceNumbers.add(rawEvent.sequenceNumber());
    }

    public void reset() {
        received.clear();
    }
}
