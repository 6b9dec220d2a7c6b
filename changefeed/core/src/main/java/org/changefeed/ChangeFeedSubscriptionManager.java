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

import org.changefeed.ListenerRegistry.RegisteredListener;
import org.changefeed.api.FeedHandle;
import org.changefeed.api.FeedObserver;
import org.changefeed.api.FeedOpener;
import org.changefeed.api.ListenerRegistration;
import org.changefeed.api.ResumePosition;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Shares one subscription to a change feed between any number of listeners and keeps it alive across failures.
 * <p>
 * The feed is opened lazily when the first listener is added and closed when the last listener is removed. When the
 * feed reports an error it's closed, and after a fixed retry delay a new feed is opened from the last known
 * {@link ResumePosition} of the failed one. If the feed cannot be opened from that position it's immediately opened
 * again without a position. Errors from the feed are never propagated to the listeners or to the callers of this
 * class, a permanently unavailable feed shows up as an endless sequence of reconnection attempts in the log.
 * </p>
 * <p>
 * All state changes, as well as the delivery of events to the listeners, happen on a single control thread. Listeners
 * should therefore return quickly. Events are delivered in the order the feed emits them, and the events of a failed
 * feed are always delivered before the events of the feed that replaces it.
 * </p>
 * <p>
 * The resume position is only kept in memory. When the last listener is removed the position is discarded, so a
 * listener added later starts from the default position of the feed rather than resuming.
 * </p>
 *
 * @param <E> The type of the change events
 */
@NullMarked
public class ChangeFeedSubscriptionManager<E> {
    private static final Logger log = LoggerFactory.getLogger(ChangeFeedSubscriptionManager.class);

    private final FeedOpener<E> feedOpener;
    private final Duration retryDelay;
    private final ScheduledExecutorService control;
    private final boolean ownsControlExecutor;
    private final ListenerRegistry<E> listeners;

    // Only mutated from the control thread
    @Nullable
    private volatile FeedConnection connection;
    @Nullable
    private volatile ResumePosition resumePosition;
    @Nullable
    private ScheduledFuture<?> pendingReconnect;
    private volatile CompletableFuture<Void> ready = new CompletableFuture<>();

    private volatile boolean shutdown = false;
    @Nullable
    private volatile Thread controlThread;

    /**
     * Create a new {@link ChangeFeedSubscriptionManager} that waits one second before reconnecting and starts at the
     * default position of the feed.
     *
     * @param feedOpener Opens the underlying feed
     */
    public ChangeFeedSubscriptionManager(FeedOpener<E> feedOpener) {
        this(feedOpener, new ChangeFeedSubscriptionManagerConfig());
    }

    /**
     * Create a new {@link ChangeFeedSubscriptionManager} that runs on a dedicated control thread.
     *
     * @param feedOpener Opens the underlying feed
     * @param config     The configuration
     */
    public ChangeFeedSubscriptionManager(FeedOpener<E> feedOpener, ChangeFeedSubscriptionManagerConfig config) {
        this(feedOpener, config, newControlExecutor(requireNonNull(config, ChangeFeedSubscriptionManagerConfig.class.getSimpleName() + " cannot be null").controlThreadName), true);
    }

    /**
     * Create a new {@link ChangeFeedSubscriptionManager} that serializes its work on the supplied executor. The executor
     * must run one task at a time, and it's not shut down by {@link #shutdown()}.
     *
     * @param feedOpener      Opens the underlying feed
     * @param config          The configuration
     * @param controlExecutor A single threaded executor
     */
    public ChangeFeedSubscriptionManager(FeedOpener<E> feedOpener, ChangeFeedSubscriptionManagerConfig config, ScheduledExecutorService controlExecutor) {
        this(feedOpener, config, controlExecutor, false);
    }

    private ChangeFeedSubscriptionManager(FeedOpener<E> feedOpener, ChangeFeedSubscriptionManagerConfig config, ScheduledExecutorService controlExecutor, boolean ownsControlExecutor) {
        requireNonNull(feedOpener, FeedOpener.class.getSimpleName() + " cannot be null");
        requireNonNull(config, ChangeFeedSubscriptionManagerConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(controlExecutor, "Control executor cannot be null");
        this.feedOpener = feedOpener;
        this.retryDelay = config.retryDelay;
        this.resumePosition = config.initialResumePosition;
        this.control = controlExecutor;
        this.ownsControlExecutor = ownsControlExecutor;
        this.listeners = new ListenerRegistry<>(() -> onControlThread(this::connectIfNeeded), () -> onControlThread(this::disconnectIfNoListeners));
    }

    /**
     * Register a listener. Opens the feed if it's not open already, without waiting for it to become live. A failure to
     * open the feed is never thrown from here, it's handled by the reconnection logic.
     *
     * @param listener The listener that will receive all change events emitted from now on
     * @return A registration that can be used to remove the listener
     * @throws IllegalStateException If the manager is shutdown
     */
    public ListenerRegistration addListener(Consumer<E> listener) {
        requireNonNull(listener, "Listener cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Cannot add listener because " + ChangeFeedSubscriptionManager.class.getSimpleName() + " is shutdown");
        }
        ListenerRegistration registration = ListenerRegistration.random();
        listeners.add(registration, listener);
        // The feed may have been closed by the caller while listeners remained
        onControlThread(this::connectIfNeeded);
        return registration;
    }

    /**
     * Remove a listener. Once this method returns the listener is not invoked again, unless it's currently processing
     * an event. Removing an unknown listener is a no-op. When the last listener is removed the feed is closed and the
     * remembered resume position is discarded.
     *
     * @param registration The registration returned by {@link #addListener(Consumer)}
     */
    public void removeListener(ListenerRegistration registration) {
        requireNonNull(registration, ListenerRegistration.class.getSimpleName() + " cannot be null");
        if (!listeners.remove(registration)) {
            log.debug("Listener {} is not registered, ignoring", registration.id());
        }
    }

    /**
     * Close the feed regardless of how many listeners there are. The position of the closed feed is remembered, so
     * the next call to {@link #addListener(Consumer)} opens a new feed that resumes from it.
     *
     * @return A future that completes when the feed is closed. It always completes normally, even if closing fails.
     */
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> closed = new CompletableFuture<>();
        boolean submitted = onControlThread(() -> {
            cancelPendingReconnect();
            FeedConnection current = connection;
            if (current == null) {
                closed.complete(null);
                return;
            }
            current.handle.resumePosition().ifPresent(position -> resumePosition = position);
            discard(current).whenComplete((__, ___) -> closed.complete(null));
        });
        if (!submitted) {
            closed.complete(null);
        }
        return closed;
    }

    /**
     * Close the feed, remove all listeners and stop the control thread (if it was created by this instance).
     * <p>
     * When called from a listener the feed is closed, and the control thread stopped, after the listener returns.
     * </p>
     */
    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        CompletableFuture<Void> closed = close();
        shutdown = true;
        listeners.clear();
        if (isControlThread()) {
            // Waiting here would block the tasks we're waiting for
            if (ownsControlExecutor) {
                control.shutdown();
            }
            return;
        }
        try {
            closed.get(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Change feed wasn't closed within 5 seconds, continuing shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Failed to close change feed during shutdown", e.getCause());
        }

        if (ownsControlExecutor) {
            control.shutdown();
            try {
                if (!control.awaitTermination(5, TimeUnit.SECONDS)) {
                    control.shutdownNow();
                }
            } catch (InterruptedException e) {
                control.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return A future that completes once a feed is open. Intended for tests and for orchestrating start up, the
     * listeners don't need to wait for it.
     */
    public CompletableFuture<Void> whenReady() {
        return ready.copy();
    }

    /**
     * Synchronous, <strong>blocking</strong> call that returns once a feed is open or the {@code timeout} exceeds.
     *
     * @param timeout The max time to wait
     * @return {@code true} if a feed was open within the timeout, {@code false} otherwise.
     */
    public boolean waitUntilReady(Duration timeout) {
        requireNonNull(timeout, "Timeout cannot be null");
        long millis;
        try {
            millis = Math.max(0, timeout.toMillis());
        } catch (ArithmeticException e) {
            millis = Long.MAX_VALUE;
        }
        try {
            ready.get(millis, MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (ExecutionException e) {
            throw new RuntimeException(e.getCause());
        }
    }

    /**
     * @return {@code true} if a feed is open right now
     */
    public boolean isConnected() {
        return connection != null;
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * @return The position of the open feed, or the position that the next feed will be opened from if no feed is open.
     */
    public Optional<ResumePosition> resumePosition() {
        FeedConnection current = connection;
        if (current != null) {
            Optional<ResumePosition> position = current.handle.resumePosition();
            if (position.isPresent()) {
                return position;
            }
        }
        return Optional.ofNullable(resumePosition);
    }

    private void connectIfNeeded() {
        if (shutdown || connection != null || pendingReconnect != null || listeners.isEmpty()) {
            return;
        }
        connect();
    }

    private void disconnectIfNoListeners() {
        // A listener may have been added after the last one was removed but before we got here
        if (!listeners.isEmpty()) {
            return;
        }
        cancelPendingReconnect();
        resumePosition = null;
        FeedConnection current = connection;
        if (current != null) {
            log.debug("Last listener removed, closing change feed");
            discard(current);
        }
    }

    private void connect() {
        ResumePosition seed = resumePosition;
        FeedHandle<E> handle;
        try {
            handle = open(seed);
        } catch (RuntimeException e) {
            log.warn("Failed to open change feed at resume position {}, retrying without resume position", seed, e);
            resumePosition = null;
            try {
                handle = open(null);
            } catch (RuntimeException e2) {
                log.error("Failed to open change feed, will retry in {} ms", retryDelay.toMillis(), e2);
                scheduleReconnect();
                return;
            }
        }

        FeedConnection newConnection = new FeedConnection(handle);
        connection = newConnection;
        try {
            handle.start(newConnection);
        } catch (RuntimeException e) {
            newConnection.onError(e);
            return;
        }
        ready.complete(null);
        log.debug("Change feed opened at resume position {}", seed);
    }

    private FeedHandle<E> open(@Nullable ResumePosition seed) {
        return requireNonNull(feedOpener.open(seed), FeedOpener.class.getSimpleName() + " returned null");
    }

    private void recover(FeedConnection failed, Throwable error) {
        if (failed != connection) {
            log.debug("Ignoring error from a change feed that is already closed", error);
            return;
        }
        log.warn("Change feed failed, reconnecting in {} ms", retryDelay.toMillis(), error);
        resumePosition = failed.handle.resumePosition().orElse(null);
        discard(failed);
        if (!shutdown) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        cancelPendingReconnect();
        try {
            pendingReconnect = control.schedule(() -> guarded(this::reconnect), retryDelay.toMillis(), MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Not reconnecting since the control executor is shutdown");
        }
    }

    private void reconnect() {
        pendingReconnect = null;
        if (shutdown) {
            return;
        } else if (listeners.isEmpty()) {
            log.debug("No listeners left, skipping reconnection of change feed");
            return;
        } else if (connection != null) {
            return;
        }
        connect();
    }

    private void cancelPendingReconnect() {
        ScheduledFuture<?> pending = pendingReconnect;
        if (pending != null) {
            pending.cancel(false);
            pendingReconnect = null;
        }
    }

    private CompletableFuture<Void> discard(FeedConnection toDiscard) {
        toDiscard.dead = true;
        if (connection == toDiscard) {
            connection = null;
        }
        if (ready.isDone()) {
            ready = new CompletableFuture<>();
        }
        return closeQuietly(toDiscard.handle);
    }

    private void relay(FeedConnection source, E event) {
        if (source.dead) {
            return;
        }
        for (RegisteredListener<E> listener : listeners.snapshot()) {
            if (!listener.isActive()) {
                continue;
            }
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Listener {} failed to process change event", listener.registration().id(), e);
            }
        }
    }

    private boolean onControlThread(Runnable task) {
        try {
            control.execute(() -> guarded(task));
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Control executor is shutdown, dropping task");
            return false;
        }
    }

    private boolean isControlThread() {
        return Thread.currentThread() == controlThread;
    }

    private void guarded(Runnable task) {
        controlThread = Thread.currentThread();
        try {
            task.run();
        } catch (Exception e) {
            log.error("Unexpected error in change feed control thread", e);
        }
    }

    private static CompletableFuture<Void> closeQuietly(FeedHandle<?> handle) {
        if (handle.isClosed()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> closed;
        try {
            closed = handle.close();
        } catch (RuntimeException e) {
            closed = CompletableFuture.failedFuture(e);
        }
        return closed.handle((__, throwable) -> {
            if (throwable != null) {
                log.warn("Failed to close change feed, ignoring", throwable);
            }
            return null;
        });
    }

    private static ScheduledExecutorService newControlExecutor(String threadName) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private final class FeedConnection implements FeedObserver<E> {
        private final FeedHandle<E> handle;
        private final AtomicBoolean failed = new AtomicBoolean(false);
        // Set on the control thread once the handle is superseded or closed
        private volatile boolean dead = false;

        private FeedConnection(FeedHandle<E> handle) {
            this.handle = handle;
        }

        @Override
        public void onChange(E event) {
            onControlThread(() -> relay(this, event));
        }

        @Override
        public void onError(Throwable throwable) {
            if (failed.compareAndSet(false, true)) {
                onControlThread(() -> recover(this, throwable));
            } else {
                log.debug("Ignoring additional error from change feed that has already failed", throwable);
            }
        }
    }
}
