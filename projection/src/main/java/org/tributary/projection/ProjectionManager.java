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

import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.eventstore.api.EventStore;
import org.tributary.eventstore.api.InvalidConfigurationException;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.api.StreamFilter;
import org.tributary.eventstore.manager.AmbiguousEventStoreRoutingException;
import org.tributary.eventstore.manager.EventStoreManager;
import org.tributary.listener.EventListenerInvoker;
import org.tributary.listener.ListenerDescriptor;
import org.tributary.listener.ListenerInstanceProvider;
import org.tributary.listener.ListenerMappingProvider;
import org.tributary.listener.Mapping;
import org.tributary.listener.Mappings;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Builds projections by delivering the events they handle to their projectors, in increasing sequence number order.
 * <p>
 * Every listener that implements {@link Projector} is a projection. The position of each projection, the sequence
 * number of the last event it applied, is kept in a {@link ProjectionPositionStorage} and advanced after every event the
 * projector applied without failing. Catching up delivers the events after that position, so a failed catch-up can
 * be retried and resumes with the event that failed.
 * </p>
 * <p>
 * All operations block the calling thread until they're done. Running two catch-ups of the same projection concurrently
 * isn't prevented here and may deliver events twice.
 * </p>
 */
@NullMarked
public class ProjectionManager {
    private static final Logger log = LoggerFactory.getLogger(ProjectionManager.class);

    private final EventStoreManager eventStoreManager;
    private final ListenerInstanceProvider listenerInstanceProvider;
    private final EventListenerInvoker eventListenerInvoker;
    private final ProjectionPositionStorage positionStorage;
    private final ListenerMappingProvider mappingProvider;
    private final Map<String, Projection> projections;

    public ProjectionManager(EventStoreManager eventStoreManager, ListenerMappingProvider mappingProvider, ListenerInstanceProvider listenerInstanceProvider,
                             EventListenerInvoker eventListenerInvoker, ProjectionPositionStorage positionStorage) {
        requireNonNull(eventStoreManager, EventStoreManager.class.getSimpleName() + " cannot be null");
        requireNonNull(mappingProvider, ListenerMappingProvider.class.getSimpleName() + " cannot be null");
        requireNonNull(listenerInstanceProvider, ListenerInstanceProvider.class.getSimpleName() + " cannot be null");
        requireNonNull(eventListenerInvoker, EventListenerInvoker.class.getSimpleName() + " cannot be null");
        requireNonNull(positionStorage, ProjectionPositionStorage.class.getSimpleName() + " cannot be null");
        this.eventStoreManager = eventStoreManager;
        this.mappingProvider = mappingProvider;
        this.listenerInstanceProvider = listenerInstanceProvider;
        this.eventListenerInvoker = eventListenerInvoker;
        this.positionStorage = positionStorage;
        this.projections = detectProjections(eventStoreManager, mappingProvider);
    }

    /**
     * @return All projections, ordered by identifier
     */
    public List<Projection> getProjections() {
        return List.copyOf(projections.values());
    }

    /**
     * Find a projection by its identifier or by a short form of it. Given the identifier {@code org.acme.shop:orderlist}
     * the short forms {@code orderlist}, {@code shop:orderlist} and {@code acme.shop:orderlist} are accepted as long as
     * they match no other projection. Case is ignored.
     *
     * @throws InvalidProjectionIdentifierException If no projection, or more than one, matches {@code projectionIdentifier}
     */
    public Projection getProjection(String projectionIdentifier) {
        requireNonNull(projectionIdentifier, "Projection identifier cannot be null");
        String wanted = projectionIdentifier.toLowerCase(Locale.ROOT);
        Projection exactMatch = projections.get(wanted);
        if (exactMatch != null) {
            return exactMatch;
        }

        List<String> candidates = projections.values().stream()
                .filter(projection -> isShortFormOf(wanted, projection))
                .map(Projection::identifier)
                .collect(Collectors.toList());
        if (candidates.size() == 1) {
            return projections.get(candidates.get(0));
        } else if (candidates.isEmpty()) {
            throw new InvalidProjectionIdentifierException(projectionIdentifier, List.copyOf(projections.keySet()),
                    String.format("No projection matches the identifier \"%s\". Known projections are: %s", projectionIdentifier, projections.keySet()));
        }
        throw new InvalidProjectionIdentifierException(projectionIdentifier, candidates,
                String.format("The identifier \"%s\" is ambiguous, it matches the projections %s. Use a longer identifier.", projectionIdentifier, candidates));
    }

    /**
     * The shortest identifier that {@link #getProjection(String)} resolves to {@code projection} and to no other projection.
     * That is the name when no other projection has the same name, otherwise the name prefixed with as few trailing
     * package segments as needed, and the full identifier as the last resort.
     */
    public String shortIdentifierOf(Projection projection) {
        requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        String shortForm = projection.name();
        String[] packageSegments = projection.packageName().split("\\.");
        for (int i = packageSegments.length; i >= 0; i--) {
            if (i < packageSegments.length) {
                shortForm = packageSegments[i] + (i == packageSegments.length - 1 ? ":" : ".") + shortForm;
            }
            String candidate = shortForm;
            if (projections.values().stream().filter(p -> isShortFormOf(candidate, p)).count() == 1) {
                return candidate;
            }
        }
        return projection.identifier();
    }

    /**
     * Reset the projection and apply all of its events from the beginning.
     *
     * @param onEvent Called after each event the projector applied
     * @return The number of events applied
     * @throws EventCouldNotBeAppliedException If the projector fails to apply an event
     */
    public long replay(String projectionIdentifier, Consumer<RawEvent> onEvent) {
        Projection projection = getProjection(projectionIdentifier);
        log.info("Replaying projection {}", projection.identifier());
        positionStorage.delete(projection.identifier());
        projectorOf(projection).reset();
        long count = applyEventsAfterPosition(projection, onEvent);
        log.info("Replayed {} event(s) for projection {}", count, projection.identifier());
        return count;
    }

    /**
     * Replay every projection.
     *
     * @param onlyEmpty <code>true</code> to skip projections that have applied events before
     * @param onEvent   Called after each event a projector applied
     * @return The total number of events applied
     */
    public long replayAll(boolean onlyEmpty, Consumer<RawEvent> onEvent) {
        long count = 0;
        for (Projection projection : projections.values()) {
            if (onlyEmpty && !isProjectionEmpty(projection.identifier())) {
                log.info("Skipping non-empty projection {}", projection.identifier());
                continue;
            }
            count += replay(projection.identifier(), onEvent);
        }
        return count;
    }

    /**
     * Apply the events that were committed after the current position of the projection.
     *
     * @param onEvent Called after each event the projector applied
     * @return The number of events applied
     * @throws EventCouldNotBeAppliedException If the projector fails to apply an event. Events applied before the failing one stay applied.
     */
    public long catchUp(String projectionIdentifier, Consumer<RawEvent> onEvent) {
        Projection projection = getProjection(projectionIdentifier);
        log.info("Catching up projection {}", projection.identifier());
        long count = applyEventsAfterPosition(projection, onEvent);
        log.info("Caught up projection {} with {} event(s)", projection.identifier(), count);
        return count;
    }

    /**
     * Catch up the projection, wait for {@code interval} and repeat until {@code watch} is cancelled or the calling thread is
     * interrupted. Cancellation is checked between cycles, a catch-up that has started runs to completion.
     *
     * @param failureHandler Decides whether a failed cycle stops the loop (the failure is then rethrown) or not
     */
    public void watch(String projectionIdentifier, Duration interval, ProjectionWatch watch, Consumer<RawEvent> onEvent, CatchUpFailureHandler failureHandler) {
        requireNonNull(interval, "Interval cannot be null");
        requireNonNull(watch, ProjectionWatch.class.getSimpleName() + " cannot be null");
        requireNonNull(failureHandler, CatchUpFailureHandler.class.getSimpleName() + " cannot be null");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Interval cannot be negative");
        }
        String identifier = getProjection(projectionIdentifier).identifier();
        log.info("Watching projection {} every {}", identifier, interval);
        try {
            while (!watch.isCancelled()) {
                try {
                    catchUp(identifier, onEvent);
                } catch (RuntimeException e) {
                    if (!failureHandler.onFailure(identifier, e)) {
                        throw e;
                    }
                    log.warn("Catching up projection {} failed, retrying in {}", identifier, interval, e);
                }
                if (watch.awaitCancellation(interval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped watching projection {}", identifier);
    }

    /**
     * @return <code>true</code> if the projection hasn't applied any event since it was created or last replayed
     */
    public boolean isProjectionEmpty(String projectionIdentifier) {
        Projection projection = getProjection(projectionIdentifier);
        return positionStorage.read(projection.identifier()) == ProjectionPositionStorage.BEFORE_FIRST_EVENT;
    }

    private long applyEventsAfterPosition(Projection projection, Consumer<RawEvent> onEvent) {
        requireNonNull(onEvent, "onEvent cannot be null");
        EventStore eventStore = eventStoreManager.storeForEventTypes(projection.eventTypes());
        Projector projector = projectorOf(projection);
        Mappings mappings = mappingProvider.mappingsForListener(projection.listenerIdentifier());
        long position = positionStorage.read(projection.identifier());

        StreamFilter filter = StreamFilter.forEventTypes(projection.eventTypes()).afterSequenceNumber(position);
        long count = 0;
        for (RawEvent rawEvent : eventStore.get(filter)) {
            Mapping mapping = mappings.forListenerAndEventType(projection.listenerIdentifier(), rawEvent.type())
                    .orElseThrow(() -> new IllegalStateException(String.format("Projection \"%s\" has no handler for event type %s", projection.identifier(), rawEvent.type())));
            try {
                eventListenerInvoker.invoke(projector, mapping, rawEvent);
            } catch (RuntimeException e) {
                throw new EventCouldNotBeAppliedException(projection.identifier(), rawEvent, e);
            }
            positionStorage.save(projection.identifier(), rawEvent.sequenceNumber());
            log.debug("Projection {} applied {} at sequence number {}", projection.identifier(), rawEvent.type(), rawEvent.sequenceNumber());
            onEvent.accept(rawEvent);
            count++;
        }
        return count;
    }

    private Projector projectorOf(Projection projection) {
        return listenerInstanceProvider.getInstance(projection.projectorClass());
    }

    private static boolean isShortFormOf(String shortForm, Projection projection) {
        int colon = shortForm.indexOf(':');
        if (colon < 0) {
            return shortForm.equals(projection.name());
        }
        String packageSuffix = shortForm.substring(0, colon);
        String name = shortForm.substring(colon + 1);
        return name.equals(projection.name())
                && (projection.packageName().equals(packageSuffix) || projection.packageName().endsWith("." + packageSuffix));
    }

    private static Map<String, Projection> detectProjections(EventStoreManager eventStoreManager, ListenerMappingProvider mappingProvider) {
        Map<String, Projection> projections = new LinkedHashMap<>();
        mappingProvider.listeners().stream()
                .filter(listener -> Projector.class.isAssignableFrom(listener.listenerClass()))
                .sorted(Comparator.comparing(listener -> Projection.identifierFor(listener.listenerClass())))
                .forEach(listener -> {
                    Projection projection = toProjection(eventStoreManager, mappingProvider, listener);
                    Projection existing = projections.putIfAbsent(projection.identifier(), projection);
                    if (existing != null) {
                        throw new InvalidProjectionIdentifierException(projection.identifier(), List.of(existing.listenerIdentifier(), projection.listenerIdentifier()),
                                String.format("Projectors %s and %s both have the projection identifier \"%s\"", existing.listenerIdentifier(), projection.listenerIdentifier(), projection.identifier()));
                    }
                });
        log.debug("Detected projections {}", projections.keySet());
        return projections;
    }

    @SuppressWarnings("unchecked")
    private static Projection toProjection(EventStoreManager eventStoreManager, ListenerMappingProvider mappingProvider, ListenerDescriptor listener) {
        String identifier = Projection.identifierFor(listener.listenerClass());
        String listenerIdentifier = listener.listenerIdentifier();
        Set<String> eventTypes = mappingProvider.mappingsForListener(listenerIdentifier).eventTypes();
        String boundEventStore = mappingProvider.storeForListener(listenerIdentifier);

        final String routedEventStore;
        try {
            routedEventStore = eventStoreManager.identifierForEventTypes(eventTypes);
        } catch (AmbiguousEventStoreRoutingException e) {
            throw new InvalidConfigurationException(String.format("Projection \"%s\" handles event types of different event stores: %s", identifier,
                    e.eventStoreIdentifierByEventType), e);
        }
        if (!routedEventStore.equals(boundEventStore)) {
            throw new InvalidConfigurationException(String.format("Projection \"%s\" is bound to event store \"%s\" by its listener preset but its event types %s are stored in event store \"%s\"",
                    identifier, boundEventStore, eventTypes, routedEventStore));
        }
        return new Projection(identifier, (Class<? extends Projector>) listener.listenerClass(), listenerIdentifier, eventTypes, boundEventStore);
    }
}
