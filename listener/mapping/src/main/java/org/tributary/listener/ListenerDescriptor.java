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

import org.tributary.eventstore.api.RawEvent;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Describes an event listener class and its handler methods. The listener identifier is the fully qualified name of the
 * listener class and is what the listener presets of the event store configuration are matched against.
 * <p>
 * A descriptor can be created explicitly with {@link #builder(Class)}, or by reading the public {@code when*} methods
 * of a class with {@link #fromClass(Class)}. The descriptor is validated by the {@link ListenerMappingProvider}.
 * </p>
 */
public final class ListenerDescriptor {
    static final Pattern HANDLER_METHOD_NAME = Pattern.compile("^when[A-Z].*$");

    private final String listenerIdentifier;
    private final Class<?> listenerClass;
    private final List<ListenerMethod> methods;

    private ListenerDescriptor(Class<?> listenerClass, List<ListenerMethod> methods) {
        this.listenerIdentifier = listenerClass.getName();
        this.listenerClass = listenerClass;
        this.methods = List.copyOf(methods);
    }

    /**
     * Create a {@link ListenerDescriptor} from the public methods of {@code listenerClass} whose name match {@code when[A-Z].*}.
     */
    public static ListenerDescriptor fromClass(Class<?> listenerClass) {
        requireNonNull(listenerClass, "Listener class cannot be null");
        if (!EventListener.class.isAssignableFrom(listenerClass)) {
            throw new InvalidEventListenerException(listenerClass.getName() + " does not implement " + EventListener.class.getName());
        }
        List<ListenerMethod> methods = Arrays.stream(listenerClass.getMethods())
                .filter(method -> HANDLER_METHOD_NAME.matcher(method.getName()).matches())
                .filter(method -> !Modifier.isStatic(method.getModifiers()))
                .sorted(Comparator.comparing(Method::getName))
                .map(ListenerDescriptor::toListenerMethod)
                .collect(Collectors.toList());
        return new ListenerDescriptor(listenerClass, methods);
    }

    public static <L extends EventListener> Builder<L> builder(Class<L> listenerClass) {
        return new Builder<>(listenerClass);
    }

    public String listenerIdentifier() {
        return listenerIdentifier;
    }

    public Class<?> listenerClass() {
        return listenerClass;
    }

    public List<ListenerMethod> methods() {
        return methods;
    }

    private static ListenerMethod toListenerMethod(Method method) {
        // Public methods of non-public listener classes are not accessible without this
        method.trySetAccessible();
        return new ListenerMethod(method.getName(), Arrays.asList(method.getParameterTypes()), (listener, event, rawEvent) -> {
            Object[] arguments = method.getParameterCount() > 1 ? new Object[]{event, rawEvent} : new Object[]{event};
            try {
                method.invoke(listener, arguments);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                } else if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new RuntimeException(cause);
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        });
    }

    /**
     * Handler of an event that also receives the stored event
     */
    @FunctionalInterface
    public interface RawEventHandler<L, E> {
        void handle(L listener, E event, RawEvent rawEvent);
    }

    public static class Builder<L extends EventListener> {
        private final Class<L> listenerClass;
        private final List<ListenerMethod> methods = new ArrayList<>();

        private Builder(Class<L> listenerClass) {
            requireNonNull(listenerClass, "Listener class cannot be null");
            this.listenerClass = listenerClass;
        }

        @SuppressWarnings("unchecked")
        public <E> Builder<L> handler(String methodName, Class<E> eventClass, BiConsumer<L, E> handler) {
            requireNonNull(handler, "Handler cannot be null");
            methods.add(new ListenerMethod(methodName, List.of(eventClass), (listener, event, rawEvent) -> handler.accept((L) listener, (E) event)));
            return this;
        }

        @SuppressWarnings("unchecked")
        public <E> Builder<L> handlerWithRawEvent(String methodName, Class<E> eventClass, RawEventHandler<L, E> handler) {
            requireNonNull(handler, "Handler cannot be null");
            methods.add(new ListenerMethod(methodName, List.of(eventClass, RawEvent.class), (listener, event, rawEvent) -> handler.handle((L) listener, (E) event, rawEvent)));
            return this;
        }

        /**
         * Add a handler as produced by an external discovery step.
         */
        public Builder<L> method(ListenerMethod method) {
            methods.add(requireNonNull(method, ListenerMethod.class.getSimpleName() + " cannot be null"));
            return this;
        }

        public ListenerDescriptor build() {
            return new ListenerDescriptor(listenerClass, methods);
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ListenerDescriptor.class.getSimpleName() + "[", "]")
                .add("listenerIdentifier='" + listenerIdentifier + "'")
                .add("methods=" + methods.stream().map(ListenerMethod::name).collect(Collectors.toList()))
                .toString();
    }
}
