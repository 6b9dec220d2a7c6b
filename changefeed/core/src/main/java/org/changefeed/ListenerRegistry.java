/*
 * Copyright 2021 Johan Haleby
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

package org.changefeed;

import org.changefeed.api.ListenerRegistration;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Keeps track of the registered listeners and signals when the population goes from empty to non-empty and back.
 * <p>
 * The transition hooks are invoked while the registry is locked, so they must only hand over work (for example by
 * submitting a task to an executor) and never call back into the registry.
 * </p>
 *
 * @param <E> The type of the events delivered to the listeners
 */
@NullMarked
public class ListenerRegistry<E> {

    private final Map<ListenerRegistration, RegisteredListener<E>> listeners = new LinkedHashMap<>();
    private final Runnable onFirstListenerAdded;
    private final Runnable onLastListenerRemoved;

    private volatile List<RegisteredListener<E>> snapshot = Collections.emptyList();

    /**
     * @param onFirstListenerAdded  Invoked when a listener is added to an empty registry
     * @param onLastListenerRemoved Invoked when the last listener is removed
     */
    public ListenerRegistry(Runnable onFirstListenerAdded, Runnable onLastListenerRemoved) {
        this.onFirstListenerAdded = Objects.requireNonNull(onFirstListenerAdded, "onFirstListenerAdded cannot be null");
        this.onLastListenerRemoved = Objects.requireNonNull(onLastListenerRemoved, "onLastListenerRemoved cannot be null");
    }

    public synchronized void add(ListenerRegistration registration, Consumer<E> listener) {
        Objects.requireNonNull(registration, ListenerRegistration.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");
        if (listeners.containsKey(registration)) {
            throw new IllegalArgumentException("Listener " + registration.id() + " is already registered.");
        }

        boolean wasEmpty = listeners.isEmpty();
        listeners.put(registration, new RegisteredListener<>(registration, listener));
        refreshSnapshot();
        if (wasEmpty) {
            onFirstListenerAdded.run();
        }
    }

    /**
     * Remove a listener. Removing a listener that is not registered is a no-op.
     *
     * @return {@code true} if the listener was registered
     */
    public synchronized boolean remove(ListenerRegistration registration) {
        RegisteredListener<E> removed = listeners.remove(registration);
        if (removed == null) {
            return false;
        }
        removed.deactivate();
        refreshSnapshot();
        if (listeners.isEmpty()) {
            onLastListenerRemoved.run();
        }
        return true;
    }

    /**
     * Remove all listeners without signalling the transition to empty.
     */
    public synchronized void clear() {
        listeners.values().forEach(RegisteredListener::deactivate);
        listeners.clear();
        refreshSnapshot();
    }

    public synchronized boolean isEmpty() {
        return listeners.isEmpty();
    }

    public synchronized int size() {
        return listeners.size();
    }

    /**
     * @return The listeners registered right now. The list is immutable and doesn't reflect later changes, but a listener
     * removed after the snapshot was taken reports {@code false} from {@link RegisteredListener#isActive()}.
     */
    public List<RegisteredListener<E>> snapshot() {
        return snapshot;
    }

    private void refreshSnapshot() {
        snapshot = Collections.unmodifiableList(new ArrayList<>(listeners.values()));
    }

    public static final class RegisteredListener<E> {
        private final ListenerRegistration registration;
        private final Consumer<E> listener;
        private volatile boolean active = true;

        private RegisteredListener(ListenerRegistration registration, Consumer<E> listener) {
            this.registration = registration;
            this.listener = listener;
        }

        public ListenerRegistration registration() {
            return registration;
        }

        public boolean isActive() {
            return active;
        }

        public void accept(E event) {
            listener.accept(event);
        }

        private void deactivate() {
            active = false;
        }
    }
}
