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

package org.tributary.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.application.converter.jackson.JacksonEventConverter;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.manager.ListenerPreset;
import org.tributary.listener.sample.billing.InvoiceListener;
import org.tributary.listener.sample.shop.OrderHistoryListener;
import org.tributary.listener.sample.shop.OrderListener;
import org.tributary.testsupport.shop.OrderShipped;

import java.time.OffsetDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.tributary.listener.ListenerMappingProviderTest.EVENT_TYPES;
import static org.tributary.listener.ListenerMappingProviderTest.LISTENERS;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventListenerInvokerTest {

    private ListenerMappingProvider provider;
    private EventListenerInvoker invoker;

    @BeforeEach
    void create_invoker() {
        provider = new ListenerMappingProvider(Map.of("default", Map.of(".*", ListenerPreset.active())), LISTENERS, EVENT_TYPES);
        invoker = new EventListenerInvoker(new JacksonEventConverter<>(new ObjectMapper(), EVENT_TYPES));
    }

    @Test
    void converts_the_raw_event_and_passes_it_to_the_handler() {
        // Given
        OrderListener listener = new OrderListener();
        RawEvent rawEvent = rawEvent(7, "Acme.Shop:OrderShipped", Map.of("orderId", "1"));
        Mapping mapping = provider.mappingsForListener(OrderListener.class.getName()).forListenerAndEventType(OrderListener.class.getName(), rawEvent.type()).orElseThrow();

        // When
        invoker.invoke(listener, mapping, rawEvent);

        // Then
        assertThat(listener.received).containsExactly(new OrderShipped("1"));
        assertThat(listener.sequenceNumbers).containsExactly(7L);
    }

    @Test
    void exceptions_thrown_by_the_handler_are_propagated() {
        // Given
        InvoiceListener listener = new InvoiceListener();
        RawEvent rawEvent = rawEvent(1, "Acme.Billing:InvoiceIssued", Map.of("invoiceId", "i1", "orderId", "1", "amount", -1));
        Mapping mapping = provider.mappingsForListener(InvoiceListener.class.getName()).toList().get(0);

        // When
        Throwable throwable = catchThrowable(() -> invoker.invoke(listener, mapping, rawEvent));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Negative amount");
    }

    @Test
    void listener_of_wrong_class_is_rejected() {
        // Given
        RawEvent rawEvent = rawEvent(1, "Acme.Shop:OrderCancelled", Map.of("orderId", "1", "reason", "oops"));
        Mapping mapping = provider.mappingsForListener(OrderHistoryListener.class.getName()).toList().get(0);

        // When
        Throwable throwable = catchThrowable(() -> invoker.invoke(new OrderListener(), mapping, rawEvent));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void instance_provider_returns_registered_instances() {
        // Given
        OrderListener listener = new OrderListener();
        ListenerInstanceProvider instances = ListenerInstanceProvider.of(listener);

        // Then
        assertThat(instances.getInstance(OrderListener.class)).isSameAs(listener);
        assertThat(catchThrowable(() -> instances.getInstance(InvoiceListener.class))).isExactlyInstanceOf(EventListenerNotFoundException.class);
    }

    private static RawEvent rawEvent(long sequenceNumber, String type, Map<String, Object> payload) {
        return new RawEvent(sequenceNumber, type, payload, Map.of(), "stream", 1, "id" + sequenceNumber, OffsetDateTime.now());
    }
}
