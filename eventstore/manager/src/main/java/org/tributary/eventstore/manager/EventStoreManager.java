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

package org.tributary.eventstore.manager;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.eventstore.api.EventStorage;
import org.tributary.eventstore.api.EventStore;
import org.tributary.eventstore.api.InvalidConfigurationException;
import org.tributary.eventstore.api.StreamFilter;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Resolves which {@link EventStore} owns a stream, an event type or a bounded context.
 * <p>
 * The routing configuration is validated once, when the manager is created: every registration must declare a storage
 * and at least one active bounded context, at most one registration may be the fallback ({@code "*"}) and no two
 * registrations may declare the same active bounded context pattern.
 * </p>
 * <p>
 * A bounded context is routed to the registration with the longest matching pattern (see {@link BoundedContextPattern}),
 * or to the fallback registration if no pattern matches. Event stores are created lazily, on first access, and are then
 * reused for the lifetime of the manager. The manager is thread-safe.
 * </p>
 */
@NullMarked
public class EventStoreManager {
    private static final Logger log = LoggerFactory.getLogger(EventStoreManager.class);

    private final EventStorageFactory eventStorageFactory;
    private final Map<String, EventStoreRegistration> registrations;
    private final List<Route> routes;
    private final @Nullable String fallbackIdentifier;
    private final ConcurrentMap<String, EventStore> eventStores = new ConcurrentHashMap<>();

    public EventStoreManager(EventStorageFactory eventStorageFactory, EventStoreConfiguration configuration) {
        requireNonNull(eventStorageFactory, EventStorageFactory.class.getSimpleName() + " cannot be null");
        requireNonNull(configuration, EventStoreConfiguration.class.getSimpleName() + " cannot be null");
        this.eventStorageFactory = eventStorageFactory;
        this.registrations = validateRegistrations(configuration);
        this.fallbackIdentifier = findFallback(registrations.values());
        this.routes = createRoutes(registrations.values());

        log.info("Configured {} event store(s), fallback: {}, routes: {}", registrations.size(), fallbackIdentifier, routes);
    }

    /**
     * @return The event store with the given identifier
     * @throws InvalidConfigurationException If no such event store is configured
     */
    public EventStore store(String identifier) {
        requireNonNull(identifier, "Identifier cannot be null");
        EventStoreRegistration registration = registrations.get(identifier);
        if (registration == null) {
            throw new InvalidConfigurationException("No event store with identifier \"" + identifier + "\" is configured, configured event stores are " + registrations.keySet());
        }
        return eventStores.computeIfAbsent(identifier, __ -> instantiate(registration));
    }

    /**
     * @return The event store owning the stream. The bounded context of a stream is the part of its name before the first {@code ":"}.
     */
    public EventStore storeForStreamName(String streamName) {
        requireNonNull(streamName, "Stream name cannot be null");
        return storeForBoundedContext(boundedContextOf(streamName));
    }

    /**
     * Resolve the event store owning all the given event types. An empty collection resolves to the fallback store.
     *
     * @throws AmbiguousEventStoreRoutingException If the event types are owned by different event stores
     */
    public EventStore storeForEventTypes(Collection<String> eventTypes) {
        return store(identifierForEventTypes(eventTypes));
    }

    /**
     * Same routing as {@link #storeForEventTypes(Collection)} without creating the event store.
     *
     * @return The identifier of the event store owning all the given event types
     * @throws AmbiguousEventStoreRoutingException If the event types are owned by different event stores
     */
    public String identifierForEventTypes(Collection<String> eventTypes) {
        requireNonNull(eventTypes, "Event types cannot be null");
        if (eventTypes.isEmpty()) {
            return requireFallback("no event types");
        }

        Map<String, String> identifierByEventType = new LinkedHashMap<>();
        for (String eventType : eventTypes) {
            identifierByEventType.put(eventType, resolve(boundedContextOf(eventType)));
        }
        Set<String> identifiers = new LinkedHashSet<>(identifierByEventType.values());
        if (identifiers.size() > 1) {
            throw new AmbiguousEventStoreRoutingException(identifierByEventType);
        }
        return identifiers.iterator().next();
    }

    public EventStore storeForBoundedContext(String boundedContext) {
        requireNonNull(boundedContext, "Bounded context cannot be null");
        return store(resolve(boundedContext));
    }

    /**
     * Resolve the event store for a {@link StreamFilter}, by its stream name if present and otherwise by its event types.
     */
    public EventStore storeForFilter(StreamFilter filter) {
        requireNonNull(filter, StreamFilter.class.getSimpleName() + " cannot be null");
        String streamName = filter.getStreamName();
        return streamName == null ? storeForEventTypes(filter.getEventTypes()) : storeForStreamName(streamName);
    }

    /**
     * @return All configured event stores, in declaration order
     * @throws InvalidConfigurationException If no event stores are configured
     */
    public List<EventStore> allStores() {
        if (registrations.isEmpty()) {
            throw new InvalidConfigurationException("No event stores are configured");
        }
        return registrations.keySet().stream().map(this::store).collect(Collectors.toList());
    }

    public Set<String> identifiers() {
        return registrations.keySet();
    }

    private String resolve(String boundedContext) {
        Route bestMatch = null;
        for (Route route : routes) {
            if (route.pattern.matches(boundedContext) && (bestMatch == null || route.pattern.specificity() > bestMatch.pattern.specificity())) {
                bestMatch = route;
            }
        }
        return bestMatch == null ? requireFallback("bounded context \"" + boundedContext + "\"") : bestMatch.identifier;
    }

    private String requireFallback(String what) {
        if (fallbackIdentifier == null) {
            throw new InvalidConfigurationException("No event store matches " + what + " and no fallback event store (\"" + BoundedContextPattern.WILDCARD + "\") is configured");
        }
        return fallbackIdentifier;
    }

    private EventStore instantiate(EventStoreRegistration registration) {
        String storage = requireNonNull(registration.storage());
        EventStorage eventStorage = eventStorageFactory.create(storage, registration.storageOptions());
        if (eventStorage == null) {
            throw new InvalidConfigurationException("The storage \"" + storage + "\" of event store \"" + registration.identifier() + "\" could not be created");
        }
        log.debug("Created storage {} for event store {}", eventStorage, registration.identifier());
        return new EventStore(registration.identifier(), eventStorage);
    }

    private static String boundedContextOf(String name) {
        int index = name.indexOf(':');
        return index < 0 ? name : name.substring(0, index);
    }

    private static Map<String, EventStoreRegistration> validateRegistrations(EventStoreConfiguration configuration) {
        Map<String, EventStoreRegistration> registrations = new LinkedHashMap<>();
        for (EventStoreRegistration registration : configuration.registrations()) {
            String identifier = registration.identifier();
            if (registrations.containsKey(identifier)) {
                throw new InvalidConfigurationException("The event store \"" + identifier + "\" is configured more than once");
            } else if (registration.storage() == null || registration.storage().isBlank()) {
                throw new InvalidConfigurationException("The event store \"" + identifier + "\" does not declare a storage");
            } else if (registration.boundedContexts().keySet().stream().anyMatch(String::isBlank)) {
                throw new InvalidConfigurationException("The event store \"" + identifier + "\" declares a blank bounded context");
            } else if (registration.activeBoundedContextPatterns().isEmpty()) {
                throw new InvalidConfigurationException("The event store \"" + identifier + "\" does not declare any active bounded context");
            }
            registrations.put(identifier, registration);
        }
        return registrations;
    }

    private static @Nullable String findFallback(Collection<EventStoreRegistration> registrations) {
        List<String> fallbacks = registrations.stream().filter(EventStoreRegistration::isFallback).map(EventStoreRegistration::identifier).collect(Collectors.toList());
        if (fallbacks.size() > 1) {
            throw new InvalidConfigurationException("Only one event store may be the fallback (\"" + BoundedContextPattern.WILDCARD + "\") but " + fallbacks + " are");
        }
        return fallbacks.isEmpty() ? null : fallbacks.get(0);
    }

    private static List<Route> createRoutes(Collection<EventStoreRegistration> registrations) {
        Map<String, String> identifierByPattern = new HashMap<>();
        return registrations.stream()
                .flatMap(registration -> registration.activeBoundedContextPatterns().stream()
                        .filter(pattern -> !pattern.isWildcard())
                        .map(pattern -> {
                            String existing = identifierByPattern.putIfAbsent(pattern.pattern(), registration.identifier());
                            if (existing != null && !existing.equals(registration.identifier())) {
                                throw new OverlappingBoundedContextsException(pattern.pattern(), existing, registration.identifier());
                            }
                            return new Route(pattern, registration.identifier());
                        }))
                .collect(Collectors.toList());
    }

    private static class Route {
        private final BoundedContextPattern pattern;
        private final String identifier;

        private Route(BoundedContextPattern pattern, String identifier) {
            this.pattern = pattern;
            this.identifier = identifier;
        }

        @Override
        public String toString() {
            return pattern + " -> " + identifier;
        }
    }
}
