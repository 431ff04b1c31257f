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

package org.tributary.application.converter.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.application.typemapper.EventTypeResolver;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.api.WritableEvent;
import org.tributary.testsupport.shop.Order;
import org.tributary.testsupport.shop.OrderCancelled;
import org.tributary.testsupport.shop.OrderPlaced;
import org.tributary.testsupport.shop.ShopEvent;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JacksonEventConverterTest {

    private JacksonEventConverter<ShopEvent> converter;

    @BeforeEach
    void create_converter() {
        EventTypeResolver resolver = EventTypeResolver.builder()
                .register(OrderPlaced.class, "Acme.Shop", "OrderPlaced")
                .register(OrderCancelled.class, "Acme.Shop", "OrderCancelled")
                .build();
        converter = new JacksonEventConverter<>(new ObjectMapper(), resolver);
    }

    @Test
    void converts_domain_event_to_writable_event() {
        // When
        WritableEvent writableEvent = converter.toWritableEvent(new OrderPlaced("1", "John"), Map.of("correlationId", "abc"));

        // Then
        assertThat(writableEvent.type()).isEqualTo("Acme.Shop:OrderPlaced");
        assertThat(writableEvent.payload()).containsOnly(Map.entry("orderId", "1"), Map.entry("customer", "John"));
        assertThat(writableEvent.metadata()).containsEntry("correlationId", "abc");
        assertThat(writableEvent.identifier()).isNotBlank();
    }

    @Test
    void converts_raw_event_to_domain_event() {
        // Given
        RawEvent rawEvent = new RawEvent(1, "Acme.Shop:OrderCancelled", Map.of("orderId", "1", "reason", "changed mind"), Map.of(), "Acme.Shop:Order:1", 2, "id", OffsetDateTime.now());

        // When
        ShopEvent domainEvent = converter.toDomainEvent(rawEvent);

        // Then
        assertThat(domainEvent).isEqualTo(new OrderCancelled("1", "changed mind"));
    }

    @Test
    void events_converted_together_share_metadata() {
        // When
        List<WritableEvent> events = converter.toWritableEvents(Stream.of(new OrderPlaced("1", "John"), new OrderCancelled("1", "oops")), Map.of("correlationId", "abc"));

        // Then
        assertThat(events).extracting(WritableEvent::metadata).containsOnly(Map.of("correlationId", "abc"));
        assertThat(events).extracting(WritableEvent::identifier).doesNotHaveDuplicates();
    }

    @Test
    void aggregate_history_can_be_rebuilt_from_converted_events() {
        // Given
        List<WritableEvent> placed = converter.toWritableEvents(Order.place(List.of(), "1", "John").stream(), Map.of());
        List<RawEvent> history = placed.stream()
                .map(e -> new RawEvent(1, e.type(), e.payload(), e.metadata(), "Acme.Shop:Order:1", 1, e.identifier(), OffsetDateTime.now()))
                .collect(Collectors.toList());

        // When
        List<ShopEvent> newEvents = Order.cancel(history.stream().map(converter::toDomainEvent).collect(Collectors.toList()), "changed mind");

        // Then
        assertThat(newEvents).containsExactly(new OrderCancelled("1", "changed mind"));
    }
}
