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

import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.application.typemapper.EventTypeResolver;
import org.tributary.eventstore.api.InvalidConfigurationException;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.manager.EventStoreConfiguration;
import org.tributary.eventstore.manager.EventStoreRegistration;
import org.tributary.eventstore.manager.ListenerPreset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Binds the handler methods of event listeners to event types and each listener to exactly one event store.
 * <p>
 * The bindings are computed, and validated, once when the provider is created. Every listener preset pattern
 * (a regular expression that must match the whole listener identifier) of every event store is matched against every
 * listener. Creation fails if:
 * </p>
 * <ul>
 *     <li>no event store is configured, or an event store has no enabled listener preset</li>
 *     <li>a listener is matched by two presets, of the same or of different event stores</li>
 *     <li>a preset doesn't match any listener</li>
 *     <li>a listener isn't matched by any preset</li>
 *     <li>a listener has no handler methods, or a handler method doesn't follow the conventions described in {@link EventListener}</li>
 * </ul>
 * The same input always yields the same bindings or the same error. The provider is immutable and thread-safe.
 */
@NullMarked
public class ListenerMappingProvider {
    private static final Logger log = LoggerFactory.getLogger(ListenerMappingProvider.class);
    private static final String HANDLER_METHOD_PREFIX = "when";

    private final Map<String, Mappings> mappingsByEventStore;
    private final Map<String, ListenerDescriptor> listeners;

    /**
     * Create a {@link ListenerMappingProvider} from the listener presets of an {@link EventStoreConfiguration}.
     */
    public ListenerMappingProvider(EventStoreConfiguration configuration, Collection<ListenerDescriptor> listeners, EventTypeResolver eventTypeResolver) {
        this(presetsByEventStore(configuration), listeners, eventTypeResolver);
    }

    /**
     * @param presetsByEventStore Event store identifiers mapped to their listener presets (listener identifier pattern to preset)
     * @param listeners           The discovered listeners
     * @param eventTypeResolver   Resolves the event type of the event classes the listeners handle
     */
    public ListenerMappingProvider(Map<String, Map<String, ListenerPreset>> presetsByEventStore, Collection<ListenerDescriptor> listeners, EventTypeResolver eventTypeResolver) {
        requireNonNull(presetsByEventStore, "Presets cannot be null");
        requireNonNull(listeners, "Listeners cannot be null");
        requireNonNull(eventTypeResolver, EventTypeResolver.class.getSimpleName() + " cannot be null");

        this.listeners = indexListeners(listeners);
        Map<String, List<Mapping>> handlers = validateHandlers(this.listeners.values(), eventTypeResolver);
        this.mappingsByEventStore = Collections.unmodifiableMap(bind(presetsByEventStore, this.listeners.keySet(), handlers));

        if (log.isInfoEnabled()) {
            log.info("Bound {} listener(s): {}", this.listeners.size(), mappingsByEventStore.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue().listenerIdentifiers().size())
                    .collect(Collectors.joining(", ")));
        }
    }

    /**
     * @return All mappings owned by the event store
     * @throws IllegalArgumentException If the event store isn't configured
     */
    public Mappings mappingsForStore(String eventStoreIdentifier) {
        requireNonNull(eventStoreIdentifier, "Event store identifier cannot be null");
        Mappings mappings = mappingsByEventStore.get(eventStoreIdentifier);
        if (mappings == null) {
            throw new IllegalArgumentException(String.format("No mappings found for event store \"%s\". Configured stores are: %s", eventStoreIdentifier, mappingsByEventStore.keySet()));
        }
        return mappings;
    }

    /**
     * @return The identifier of the event store the listener is bound to
     * @throws EventListenerNotFoundException If the listener isn't bound to any event store
     */
    public String storeForListener(String listenerIdentifier) {
        requireNonNull(listenerIdentifier, "Listener identifier cannot be null");
        return mappingsByEventStore.entrySet().stream()
                .filter(entry -> entry.getValue().hasMappingForListener(listenerIdentifier))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow(() -> new EventListenerNotFoundException(listenerIdentifier, String.format("No mappings found for event listener \"%s\"", listenerIdentifier)));
    }

    public Mappings mappingsForListener(String listenerIdentifier) {
        return mappingsForStore(storeForListener(listenerIdentifier)).forListener(listenerIdentifier);
    }

    public ListenerDescriptor listener(String listenerIdentifier) {
        ListenerDescriptor descriptor = listeners.get(listenerIdentifier);
        if (descriptor == null) {
            throw new EventListenerNotFoundException(listenerIdentifier, String.format("Event listener \"%s\" is not known", listenerIdentifier));
        }
        return descriptor;
    }

    public Collection<ListenerDescriptor> listeners() {
        return Collections.unmodifiableCollection(listeners.values());
    }

    private static Map<String, ListenerDescriptor> indexListeners(Collection<ListenerDescriptor> listeners) {
        Map<String, ListenerDescriptor> index = new LinkedHashMap<>();
        for (ListenerDescriptor listener : listeners) {
            if (index.putIfAbsent(listener.listenerIdentifier(), listener) != null) {
                throw new InvalidConfigurationException(String.format("Listener \"%s\" is registered more than once", listener.listenerIdentifier()));
            }
        }
        return index;
    }

    private static Map<String, List<Mapping>> validateHandlers(Collection<ListenerDescriptor> listeners, EventTypeResolver eventTypeResolver) {
        Map<String, List<Mapping>> handlers = new LinkedHashMap<>();
        for (ListenerDescriptor listener : listeners) {
            if (listener.methods().isEmpty()) {
                throw new InvalidEventListenerException(String.format("No listener methods have been detected in listener class %s. A listener has the signature \"public void when<EventClass>(<EventClass> event)\" and every event listener class has to implement at least one listener!",
                        listener.listenerIdentifier()));
            }
            List<Mapping> mappings = new ArrayList<>();
            for (ListenerMethod method : listener.methods()) {
                Mapping mapping = validateHandler(listener, method, eventTypeResolver);
                if (mappings.stream().anyMatch(existing -> existing.eventType().equals(mapping.eventType()))) {
                    throw new InvalidEventListenerException(String.format("Listener %s has more than one handler for event type %s", listener.listenerIdentifier(), mapping.eventType()));
                }
                mappings.add(mapping);
            }
            handlers.put(listener.listenerIdentifier(), mappings);
        }
        return handlers;
    }

    private static Mapping validateHandler(ListenerDescriptor listener, ListenerMethod method, EventTypeResolver eventTypeResolver) {
        String location = listener.listenerIdentifier() + "::" + method.name();
        List<Class<?>> parameterTypes = method.parameterTypes();
        if (!ListenerDescriptor.HANDLER_METHOD_NAME.matcher(method.name()).matches()) {
            throw new InvalidEventListenerException(String.format("Invalid listener in %s the method name must start with \"%s\" followed by an upper case letter", location, HANDLER_METHOD_PREFIX));
        } else if (parameterTypes.isEmpty() || parameterTypes.size() > 2) {
            throw new InvalidEventListenerException(String.format("Invalid listener in %s the method signature is wrong, must accept an event and optionally a %s", location, RawEvent.class.getSimpleName()));
        }

        Class<?> eventClass = parameterTypes.get(0);
        if (!eventTypeResolver.isRegistered(eventClass)) {
            throw new InvalidEventListenerException(String.format("Invalid listener in %s the method signature is wrong, the first parameter should be a registered event class but it expects an instance of \"%s\"", location, eventClass.getName()));
        } else if (parameterTypes.size() == 2 && parameterTypes.get(1) != RawEvent.class) {
            throw new InvalidEventListenerException(String.format("Invalid listener in %s the method signature is wrong. If the second parameter is present, it has to be a %s but it expects an instance of \"%s\"", location, RawEvent.class.getSimpleName(), parameterTypes.get(1).getName()));
        }

        String eventType = eventTypeResolver.getEventType(eventClass);
        String expectedMethodName = HANDLER_METHOD_PREFIX + eventTypeResolver.getEventTypeIdentifier(eventClass).shortName();
        if (!expectedMethodName.equals(method.name())) {
            throw new InvalidEventListenerException(String.format("Invalid listener in %s the method name is expected to be \"%s\"", location, expectedMethodName));
        }
        return new Mapping(eventType, eventClass, listener.listenerIdentifier(), listener.listenerClass(), method, Collections.emptyMap());
    }

    private static Map<String, Mappings> bind(Map<String, Map<String, ListenerPreset>> presetsByEventStore, Collection<String> listenerIdentifiers, Map<String, List<Mapping>> handlers) {
        if (presetsByEventStore.isEmpty()) {
            throw new InvalidConfigurationException("No configured event stores. At least one event store should be configured");
        }

        Map<String, Match> matchedListeners = new LinkedHashMap<>();
        Map<String, Mappings> mappingsByEventStore = new LinkedHashMap<>();
        presetsByEventStore.forEach((eventStoreIdentifier, presets) -> {
            Map<String, ListenerPreset> enabledPresets = presets.entrySet().stream()
                    .filter(entry -> entry.getValue().enabled())
                    .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
            if (enabledPresets.isEmpty()) {
                throw new InvalidConfigurationException(String.format("Unmatched event store: \"%s\" does not have any enabled listener presets", eventStoreIdentifier));
            }

            List<Mapping> mappings = new ArrayList<>();
            enabledPresets.forEach((pattern, preset) -> {
                Pattern regex = compile(eventStoreIdentifier, pattern);
                boolean presetMatchesAnyListener = false;
                for (String listenerIdentifier : listenerIdentifiers) {
                    if (!regex.matcher(listenerIdentifier).matches()) {
                        continue;
                    }
                    Match previous = matchedListeners.get(listenerIdentifier);
                    if (previous != null) {
                        throw new AmbiguousListenerBindingException(listenerIdentifier, previous.eventStoreIdentifier, previous.pattern, eventStoreIdentifier, pattern);
                    }
                    presetMatchesAnyListener = true;
                    matchedListeners.put(listenerIdentifier, new Match(eventStoreIdentifier, pattern));
                    for (Mapping handler : handlers.get(listenerIdentifier)) {
                        log.debug("Binding {}::{} ({}) to event store {}", listenerIdentifier, handler.handlerName(), handler.eventType(), eventStoreIdentifier);
                        mappings.add(new Mapping(handler.eventType(), handler.eventClass(), listenerIdentifier, handler.listenerClass(), handler.method(), preset.options()));
                    }
                }
                if (!presetMatchesAnyListener) {
                    throw new UnmatchedListenerPatternException(eventStoreIdentifier, pattern);
                }
            });
            mappingsByEventStore.put(eventStoreIdentifier, Mappings.of(mappings));
        });

        List<String> unmatchedListeners = listenerIdentifiers.stream().filter(listenerIdentifier -> !matchedListeners.containsKey(listenerIdentifier)).collect(Collectors.toList());
        if (!unmatchedListeners.isEmpty()) {
            throw new UnmatchedListenerException(unmatchedListeners);
        }
        return mappingsByEventStore;
    }

    private static Pattern compile(String eventStoreIdentifier, String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidConfigurationException(String.format("The listener pattern \"%s\" of event store \"%s\" is not a valid regular expression", pattern, eventStoreIdentifier), e);
        }
    }

    private static Map<String, Map<String, ListenerPreset>> presetsByEventStore(EventStoreConfiguration configuration) {
        requireNonNull(configuration, EventStoreConfiguration.class.getSimpleName() + " cannot be null");
        return configuration.registrations().stream()
                .collect(Collectors.toMap(EventStoreRegistration::identifier, EventStoreRegistration::listeners, (a, b) -> a, LinkedHashMap::new));
    }

    private static class Match {
        private final String eventStoreIdentifier;
        private final String pattern;

        private Match(String eventStoreIdentifier, String pattern) {
            this.eventStoreIdentifier = eventStoreIdentifier;
            this.pattern = pattern;
        }
    }
}
