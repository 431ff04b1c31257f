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

package org.tributary.projection;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tributary.application.converter.jackson.JacksonEventConverter;
import org.tributary.application.typemapper.EventTypeResolver;
import org.tributary.eventstore.api.InvalidConfigurationException;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.inmemory.InMemoryEventStorage;
import org.tributary.eventstore.manager.AmbiguousEventStoreRoutingException;
import org.tributary.eventstore.manager.EventStorageFactory;
import org.tributary.eventstore.manager.EventStoreConfiguration;
import org.tributary.eventstore.manager.EventStoreManager;
import org.tributary.eventstore.manager.EventStoreRegistration;
import org.tributary.listener.EventListenerInvoker;
import org.tributary.listener.ListenerDescriptor;
import org.tributary.listener.ListenerInstanceProvider;
import org.tributary.listener.ListenerMappingProvider;
import org.tributary.projection.sample.billing.RevenueProjector;
import org.tributary.projection.sample.misrouted.InvoicedOrdersProjector;
import org.tributary.projection.sample.misrouted.ShopOrdersProjector;
import org.tributary.projection.sample.shop.OrderListProjector;
import org.tributary.projection.sample.shop.ShippingNotifier;
import org.tributary.testsupport.billing.InvoiceIssued;
import org.tributary.testsupport.shop.OrderCancelled;
import org.tributary.testsupport.shop.OrderPlaced;
import org.tributary.testsupport.shop.OrderShipped;
import org.tributary.testsupport.shop.ShopEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.entry;
import static org.awaitility.Awaitility.await;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectionManagerTest {
    private static final String ORDER_LIST = "org.tributary.projection.sample.shop:orderlist";
    private static final String BILLING_ORDER_LIST = "org.tributary.projection.sample.billing:orderlist";
    private static final String REVENUE = "org.tributary.projection.sample.billing:revenue";

    private static final String SHOP_LISTENERS = "org\\.tributary\\.projection\\.sample\\.shop\\..*";
    private static final String BILLING_LISTENERS = "org\\.tributary\\.projection\\.sample\\.billing\\..*";
    private static final String MISROUTED_LISTENERS = "org\\.tributary\\.projection\\.sample\\.misrouted\\..*";

    private static final EventTypeResolver EVENT_TYPES = EventTypeResolver.builder()
            .register(OrderPlaced.class, "Acme.Shop", "OrderPlaced")
            .register(OrderShipped.class, "Acme.Shop", "OrderShipped")
            .register(OrderCancelled.class, "Acme.Shop", "OrderCancelled")
            .register(InvoiceIssued.class, "Acme.Billing", "InvoiceIssued")
            .build();

    private EventStoreManager eventStoreManager;
    private JacksonEventConverter<Object> eventConverter;
    private ProjectionPositionStorage positionStorage;
    private ProjectionManager projectionManager;
    private OrderListProjector orderList;
    private RevenueProjector revenue;

    @BeforeEach
    void create_projection_manager() {
        orderList = new OrderListProjector();
        revenue = new RevenueProjector();
        eventConverter = new JacksonEventConverter<>(new ObjectMapper(), EVENT_TYPES);
        positionStorage = new InMemoryProjectionPositionStorage();
        projectionManager = projectionManager(BILLING_LISTENERS, List.of(
                        ListenerDescriptor.fromClass(OrderListProjector.class),
                        ListenerDescriptor.fromClass(ShippingNotifier.class),
                        ListenerDescriptor.fromClass(RevenueProjector.class),
                        ListenerDescriptor.fromClass(org.tributary.projection.sample.billing.OrderListProjector.class)),
                ListenerInstanceProvider.of(orderList, revenue, new ShippingNotifier(), new org.tributary.projection.sample.billing.OrderListProjector()));
    }

    private ProjectionManager projectionManager(String billingListeners, List<ListenerDescriptor> listeners, ListenerInstanceProvider instances) {
        EventStoreConfiguration configuration = EventStoreConfiguration.of(
                EventStoreRegistration.builder("default").storage(InMemoryEventStorage.STORAGE_NAME).storageOption(InMemoryEventStorage.BATCH_SIZE_OPTION, 2)
                        .fallback().listeners(SHOP_LISTENERS).build(),
                EventStoreRegistration.builder("billing").storage(InMemoryEventStorage.STORAGE_NAME)
                        .boundedContext("Acme.Billing").listeners(billingListeners).build());
        eventStoreManager = new EventStoreManager(EventStorageFactory.single(InMemoryEventStorage.STORAGE_NAME, InMemoryEventStorage::fromOptions), configuration);
        ListenerMappingProvider mappingProvider = new ListenerMappingProvider(configuration, listeners, EVENT_TYPES);
        return new ProjectionManager(eventStoreManager, mappingProvider, instances, new EventListenerInvoker(eventConverter), positionStorage);
    }

    @Nested
    @DisplayName("projections")
    class Projections {

        @Test
        void only_listeners_that_are_projectors_are_projections() {
            // When
            List<Projection> projections = projectionManager.getProjections();

            // Then
            assertThat(projections).extracting(Projection::identifier).containsExactly(BILLING_ORDER_LIST, REVENUE, ORDER_LIST);
        }

        @Test
        void describes_the_projector_event_types_and_event_store_of_a_projection() {
            // When
            Projection projection = projectionManager.getProjection(ORDER_LIST);

            // Then
            assertThat(projection.projectorClass()).isEqualTo(OrderListProjector.class);
            assertThat(projection.listenerIdentifier()).isEqualTo(OrderListProjector.class.getName());
            assertThat(projection.eventTypes()).containsExactlyInAnyOrder("Acme.Shop:OrderPlaced", "Acme.Shop:OrderShipped");
            assertThat(projection.eventStoreIdentifier()).isEqualTo("default");
        }

        @Test
        void event_types_of_a_projection_route_to_the_event_store_it_is_bound_to() {
            // Given
            Projection projection = projectionManager.getProjection("revenue");

            // Then
            assertThat(eventStoreManager.storeForEventTypes(projection.eventTypes()).identifier()).isEqualTo(projection.eventStoreIdentifier()).isEqualTo("billing");
        }

        @Test
        void short_identifier_is_the_shortest_form_that_resolves_to_the_projection_only() {
            // When
            Map<String, String> shortIdentifiers = new LinkedHashMap<>();
            projectionManager.getProjections().forEach(projection -> shortIdentifiers.put(projection.identifier(), projectionManager.shortIdentifierOf(projection)));

            // Then
            assertThat(shortIdentifiers).containsExactly(entry(BILLING_ORDER_LIST, "billing:orderlist"), entry(REVENUE, "revenue"), entry(ORDER_LIST, "shop:orderlist"));
            shortIdentifiers.forEach((identifier, shortIdentifier) -> assertThat(projectionManager.getProjection(shortIdentifier).identifier()).isEqualTo(identifier));
        }

        @Test
        void projection_bound_to_another_event_store_than_its_event_types_is_rejected_at_creation() {
            // When
            Throwable throwable = catchThrowable(() -> projectionManager(MISROUTED_LISTENERS,
                    List.of(ListenerDescriptor.fromClass(OrderListProjector.class), ListenerDescriptor.fromClass(ShopOrdersProjector.class)),
                    ListenerInstanceProvider.of(new OrderListProjector(), new ShopOrdersProjector())));

            // Then
            assertThat(throwable).isExactlyInstanceOf(InvalidConfigurationException.class)
                    .hasMessage("Projection \"org.tributary.projection.sample.misrouted:shoporders\" is bound to event store \"billing\" by its listener preset " +
                            "but its event types [Acme.Shop:OrderPlaced] are stored in event store \"default\"");
        }

        @Test
        void projection_with_event_types_of_different_event_stores_is_rejected_at_creation() {
            // When
            Throwable throwable = catchThrowable(() -> projectionManager(MISROUTED_LISTENERS,
                    List.of(ListenerDescriptor.fromClass(OrderListProjector.class), ListenerDescriptor.fromClass(InvoicedOrdersProjector.class)),
                    ListenerInstanceProvider.of(new OrderListProjector(), new InvoicedOrdersProjector())));

            // Then
            assertThat(throwable).isExactlyInstanceOf(InvalidConfigurationException.class)
                    .hasMessageStartingWith("Projection \"org.tributary.projection.sample.misrouted:invoicedorders\" handles event types of different event stores")
                    .hasCauseExactlyInstanceOf(AmbiguousEventStoreRoutingException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"revenue", "billing:revenue", "sample.billing:revenue", "org.tributary.projection.sample.billing:revenue", "Billing:Revenue"})
        void finds_projection_by_unique_short_form(String shortForm) {
            // When
            Projection projection = projectionManager.getProjection(shortForm);

            // Then
            assertThat(projection.identifier()).isEqualTo(REVENUE);
        }

        @Test
        void ambiguous_short_form_lists_the_candidates() {
            // When
            Throwable throwable = catchThrowable(() -> projectionManager.getProjection("orderlist"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(InvalidProjectionIdentifierException.class);
            assertThat(((InvalidProjectionIdentifierException) throwable).candidates).containsExactly(BILLING_ORDER_LIST, ORDER_LIST);
        }

        @Test
        void unknown_projection_identifier_lists_the_known_projections() {
            // When
            Throwable throwable = catchThrowable(() -> projectionManager.getProjection("shipping"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(InvalidProjectionIdentifierException.class)
                    .hasMessageContaining("No projection matches the identifier \"shipping\"");
            assertThat(((InvalidProjectionIdentifierException) throwable).candidates).containsExactly(BILLING_ORDER_LIST, REVENUE, ORDER_LIST);
        }

        @Test
        void a_part_of_a_package_name_is_not_a_short_form() {
            // When
            Throwable throwable = catchThrowable(() -> projectionManager.getProjection("illing:revenue"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(InvalidProjectionIdentifierException.class);
        }
    }

    @Nested
    @DisplayName("catch-up")
    class CatchUp {

        @Test
        void applies_the_events_of_the_projection_in_sequence_number_order() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderPlaced("2", "bob"), new OrderCancelled("2", "changed mind"), new OrderShipped("1"));
            List<Long> onEvent = new ArrayList<>();

            // When
            long count = projectionManager.catchUp("shop:orderlist", rawEvent -> onEvent.add(rawEvent.sequenceNumber()));

            // Then
            assertThat(count).isEqualTo(3);
            assertThat(orderList.appliedSequenceNumbers).containsExactly(1L, 2L, 4L);
            assertThat(onEvent).containsExactly(1L, 2L, 4L);
            assertThat(orderList.statusByOrderId).containsOnly(entry("1", "shipped"), entry("2", "placed by bob"));
            assertThat(positionStorage.read(ORDER_LIST)).isEqualTo(4L);
        }

        @Test
        void resumes_exactly_after_the_last_applied_event() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderPlaced("2", "bob"));
            projectionManager.catchUp(ORDER_LIST, __ -> {});
            commit(new OrderShipped("1"), new OrderShipped("2"));

            // When
            long count = projectionManager.catchUp(ORDER_LIST, __ -> {});

            // Then
            assertThat(count).isEqualTo(2);
            assertThat(orderList.appliedSequenceNumbers).containsExactly(1L, 2L, 3L, 4L);
            assertThat(positionStorage.read(ORDER_LIST)).isEqualTo(4L);
        }

        @Test
        void catching_up_without_new_events_applies_nothing() {
            // Given
            commit(new OrderPlaced("1", "alice"));
            projectionManager.catchUp(ORDER_LIST, __ -> {});

            // When
            long count = projectionManager.catchUp(ORDER_LIST, __ -> {});

            // Then
            assertThat(count).isZero();
            assertThat(orderList.appliedSequenceNumbers).containsExactly(1L);
        }

        @Test
        void position_is_not_advanced_past_an_event_that_could_not_be_applied() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderPlaced("2", "bob"), new OrderShipped("1"));
            orderList.failOnOrderId = "2";

            // When
            Throwable throwable = catchThrowable(() -> projectionManager.catchUp(ORDER_LIST, __ -> {}));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventCouldNotBeAppliedException.class).hasCauseExactlyInstanceOf(IllegalStateException.class);
            EventCouldNotBeAppliedException exception = (EventCouldNotBeAppliedException) throwable;
            assertThat(exception.projectionIdentifier).isEqualTo(ORDER_LIST);
            assertThat(exception.rawEvent.sequenceNumber()).isEqualTo(2L);
            assertThat(positionStorage.read(ORDER_LIST)).isEqualTo(1L);
        }

        @Test
        void retrying_a_failed_catch_up_resumes_with_the_failed_event() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderPlaced("2", "bob"), new OrderShipped("1"));
            orderList.failOnOrderId = "2";
            catchThrowable(() -> projectionManager.catchUp(ORDER_LIST, __ -> {}));
            orderList.failOnOrderId = null;

            // When
            long count = projectionManager.catchUp(ORDER_LIST, __ -> {});

            // Then
            assertThat(count).isEqualTo(2);
            assertThat(orderList.appliedSequenceNumbers).containsExactly(1L, 2L, 3L);
        }

        @Test
        void reads_the_events_from_the_event_store_that_owns_the_event_types() {
            // Given
            commit(new OrderPlaced("1", "alice"));
            commitInvoice(new InvoiceIssued("i1", "1", 100), new InvoiceIssued("i2", "1", 50));

            // When
            long count = projectionManager.catchUp("revenue", __ -> {});

            // Then
            assertThat(count).isEqualTo(2);
            assertThat(revenue.revenue).isEqualTo(150);
            assertThat(positionStorage.read(REVENUE)).isEqualTo(2L);
        }

        @Test
        void projection_is_empty_until_an_event_is_applied() {
            // Given
            commit(new OrderPlaced("1", "alice"));
            boolean emptyBefore = projectionManager.isProjectionEmpty(ORDER_LIST);

            // When
            projectionManager.catchUp(ORDER_LIST, __ -> {});

            // Then
            assertThat(emptyBefore).isTrue();
            assertThat(projectionManager.isProjectionEmpty(ORDER_LIST)).isFalse();
        }
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        void replaying_twice_yields_the_same_position_and_invocations() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderShipped("1"), new OrderPlaced("2", "bob"));
            long firstCount = projectionManager.replay(ORDER_LIST, __ -> {});
            List<Long> firstInvocations = List.copyOf(orderList.appliedSequenceNumbers);
            Map<String, String> firstState = Map.copyOf(orderList.statusByOrderId);
            long firstPosition = positionStorage.read(ORDER_LIST);

            // When
            long secondCount = projectionManager.replay(ORDER_LIST, __ -> {});

            // Then
            assertThat(secondCount).isEqualTo(firstCount).isEqualTo(3);
            assertThat(orderList.appliedSequenceNumbers).isEqualTo(firstInvocations);
            assertThat(orderList.statusByOrderId).isEqualTo(firstState);
            assertThat(positionStorage.read(ORDER_LIST)).isEqualTo(firstPosition).isEqualTo(3L);
            assertThat(orderList.resets).isEqualTo(2);
        }

        @Test
        void replay_starts_from_the_first_event_regardless_of_the_position() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderShipped("1"));
            projectionManager.catchUp(ORDER_LIST, __ -> {});

            // When
            long count = projectionManager.replay(ORDER_LIST, __ -> {});

            // Then
            assertThat(count).isEqualTo(2);
            assertThat(orderList.appliedSequenceNumbers).containsExactly(1L, 2L);
        }

        @Test
        void replay_all_returns_the_total_number_of_events() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderShipped("1"));
            commitInvoice(new InvoiceIssued("i1", "1", 100));
            List<RawEvent> onEvent = new ArrayList<>();

            // When
            long count = projectionManager.replayAll(false, onEvent::add);

            // Then
            assertThat(count).isEqualTo(4);
            assertThat(onEvent).hasSize(4);
            assertThat(revenue.revenue).isEqualTo(100);
        }

        @Test
        void replay_all_with_only_empty_skips_projections_that_have_applied_events() {
            // Given
            commit(new OrderPlaced("1", "alice"), new OrderShipped("1"));
            commitInvoice(new InvoiceIssued("i1", "1", 100));
            projectionManager.catchUp(ORDER_LIST, __ -> {});

            // When
            long count = projectionManager.replayAll(true, __ -> {});

            // Then
            assertThat(count).isEqualTo(2);
            assertThat(orderList.resets).isZero();
            assertThat(revenue.revenue).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("watch")
    class Watch {
        private ProjectionWatcher watcher;

        @BeforeEach
        void create_watcher() {
            watcher = new ProjectionWatcher(projectionManager);
        }

        @AfterEach
        void shutdown_watcher() {
            watcher.shutdown();
        }

        @Test
        void applies_events_committed_while_watching() {
            // Given
            commit(new OrderPlaced("1", "alice"));
            watcher.watch(ORDER_LIST, Duration.ofMillis(20), __ -> {});
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(orderList.appliedSequenceNumbers).containsExactly(1L));

            // When
            commit(new OrderShipped("1"));

            // Then
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(orderList.appliedSequenceNumbers).containsExactly(1L, 2L));
        }

        @Test
        void a_failed_cycle_does_not_stop_watching_by_default() {
            // Given
            orderList.failOnOrderId = "1";
            commit(new OrderPlaced("1", "alice"));
            watcher.watch(ORDER_LIST, Duration.ofMillis(20), __ -> {});

            // When
            orderList.failOnOrderId = null;

            // Then
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(orderList.appliedSequenceNumbers).containsExactly(1L));
            assertThat(watcher.runningWatches()).isEqualTo(1);
        }

        @Test
        void cancelling_the_watch_stops_the_loop() {
            // Given
            ProjectionWatch watch = watcher.watch("shop:orderlist", Duration.ofSeconds(10), __ -> {});
            await().atMost(Duration.ofSeconds(2)).until(() -> watcher.runningWatches() == 1);

            // When
            watch.cancel();

            // Then
            await().atMost(Duration.ofSeconds(2)).until(() -> watcher.runningWatches() == 0);
            assertThat(watch.projectionIdentifier()).isEqualTo(ORDER_LIST);
        }

        @Test
        void failure_is_rethrown_when_the_failure_handler_stops_watching() {
            // Given
            orderList.failOnOrderId = "1";
            commit(new OrderPlaced("1", "alice"));
            ProjectionWatch watch = new ProjectionWatch(ORDER_LIST);
            List<String> failedProjections = new ArrayList<>();

            // When
            Throwable throwable = catchThrowable(() -> projectionManager.watch(ORDER_LIST, Duration.ofMillis(10), watch, __ -> {}, (projection, e) -> {
                failedProjections.add(projection);
                return false;
            }));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventCouldNotBeAppliedException.class);
            assertThat(failedProjections).containsExactly(ORDER_LIST);
        }

        @Test
        void watch_returns_when_the_watching_thread_is_interrupted() throws Exception {
            // Given
            ExecutorService executor = Executors.newSingleThreadExecutor();
            ProjectionWatch watch = new ProjectionWatch(ORDER_LIST);
            Future<?> future = executor.submit(() -> projectionManager.watch(ORDER_LIST, Duration.ofSeconds(30), watch, __ -> {}, CatchUpFailureHandler.stopWatching()));

            // When
            Thread.sleep(100);
            executor.shutdownNow();

            // Then
            await().atMost(Duration.ofSeconds(2)).until(future::isDone);
            assertThat(watch.isCancelled()).isFalse();
        }

        @Test
        void watcher_rejects_new_watches_after_shutdown() {
            // Given
            watcher.shutdown();

            // When
            Throwable throwable = catchThrowable(() -> watcher.watch(ORDER_LIST, Duration.ofMillis(10), __ -> {}));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
        }
    }

    private void commit(ShopEvent... events) {
        for (ShopEvent event : events) {
            String streamName = "Acme.Shop:Order:" + event.orderId();
            eventStoreManager.storeForStreamName(streamName).commit(streamName, List.of(eventConverter.toWritableEvent(event)));
        }
    }

    private void commitInvoice(InvoiceIssued... events) {
        for (InvoiceIssued event : events) {
            String streamName = "Acme.Billing:Invoice:" + event.invoiceId();
            eventStoreManager.storeForStreamName(streamName).commit(streamName, List.of(eventConverter.toWritableEvent(event)));
        }
    }
}
