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

package org.changefeed.inmemory;

import org.changefeed.api.FeedHandle;
import org.changefeed.api.FeedObserver;
import org.changefeed.api.FeedOpener;
import org.changefeed.api.ResumePosition;
import org.changefeed.api.StringBasedResumePosition;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * A change feed that keeps its history in memory. This is mainly useful for testing and/or demo purposes.
 * <p>
 * Every published event gets a sequence number, starting at 1, and the {@link ResumePosition} of an event is its
 * sequence number. Only the latest {@code retention} events are kept, opening the feed at a position older than
 * that fails with a {@link ResumePositionExpiredException}. Events are pushed to the started handles synchronously,
 * on the thread that publishes them.
 * </p>
 *
 * @param <E> The type of the change events
 */
@NullMarked
public class InMemoryChangeFeed<E> {
    public static final int DEFAULT_RETENTION = 1000;

    private final int retention;
    private final Deque<Entry<E>> history = new ArrayDeque<>();
    private final Set<InMemoryFeedHandle> handles = new LinkedHashSet<>();
    private long lastSequenceNumber = 0;
    private int opensToFail = 0;
    private int openCount = 0;

    /**
     * Create an {@link InMemoryChangeFeed} that retains the latest {@value #DEFAULT_RETENTION} events.
     */
    public InMemoryChangeFeed() {
        this(DEFAULT_RETENTION);
    }

    /**
     * @param retention The number of events to keep, must be greater than zero.
     */
    public InMemoryChangeFeed(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("Retention must be greater than zero");
        }
        this.retention = retention;
    }

    /**
     * @return A {@link FeedOpener} that opens handles to this feed.
     */
    public FeedOpener<E> opener() {
        return this::open;
    }

    /**
     * Append an event to the feed and push it to all started handles.
     *
     * @return The position of the published event
     */
    public synchronized ResumePosition publish(E event) {
        requireNonNull(event, "Event cannot be null");
        long sequenceNumber = ++lastSequenceNumber;
        history.addLast(new Entry<>(sequenceNumber, event));
        while (history.size() > retention) {
            history.removeFirst();
        }
        for (InMemoryFeedHandle handle : new ArrayList<>(handles)) {
            handle.eventAvailable(sequenceNumber, event);
        }
        return positionOf(sequenceNumber);
    }

    /**
     * Make all open handles fail with the given error, as if the connection to the feed was lost.
     */
    public synchronized void failOpenHandles(Throwable error) {
        requireNonNull(error, "Error cannot be null");
        for (InMemoryFeedHandle handle : new ArrayList<>(handles)) {
            handle.fail(error);
        }
    }

    /**
     * Make the next {@code count} calls to {@link FeedOpener#open(ResumePosition)} throw an {@link IllegalStateException}.
     */
    public synchronized void failNextOpens(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative");
        }
        this.opensToFail = count;
    }

    /**
     * @return The position of the latest published event, or position {@code 0} if nothing has been published.
     */
    public synchronized ResumePosition latestPosition() {
        return positionOf(lastSequenceNumber);
    }

    /**
     * @return The number of handles that are open and haven't failed
     */
    public synchronized int openHandles() {
        return handles.size();
    }

    /**
     * @return The number of handles successfully opened since this feed was created
     */
    public synchronized int openCount() {
        return openCount;
    }

    private synchronized FeedHandle<E> open(@Nullable ResumePosition resumePosition) {
        if (opensToFail > 0) {
            opensToFail--;
            throw new IllegalStateException("Change feed is unavailable");
        }

        final long startAfter;
        if (resumePosition == null) {
            startAfter = lastSequenceNumber;
        } else {
            startAfter = parseSequenceNumber(resumePosition);
            long oldestAvailable = history.isEmpty() ? lastSequenceNumber + 1 : history.getFirst().sequenceNumber;
            if (startAfter > lastSequenceNumber) {
                throw new ResumePositionExpiredException(resumePosition, "Resume position " + resumePosition.asString() + " is ahead of the feed");
            } else if (startAfter < oldestAvailable - 1) {
                throw new ResumePositionExpiredException(resumePosition, "Resume position " + resumePosition.asString() + " is outside of the retention window");
            }
        }

        InMemoryFeedHandle handle = new InMemoryFeedHandle(startAfter);
        handles.add(handle);
        openCount++;
        return handle;
    }

    private static long parseSequenceNumber(ResumePosition resumePosition) {
        try {
            return Long.parseLong(resumePosition.asString());
        } catch (NumberFormatException e) {
            throw new ResumePositionExpiredException(resumePosition, "Resume position " + resumePosition.asString() + " was not created by an in-memory change feed");
        }
    }

    private static ResumePosition positionOf(long sequenceNumber) {
        return new StringBasedResumePosition(String.valueOf(sequenceNumber));
    }

    private record Entry<E>(long sequenceNumber, E event) {
    }

    // All state is guarded by the lock of the enclosing feed
    private class InMemoryFeedHandle implements FeedHandle<E> {
        private long lastSeenSequenceNumber;
        @Nullable
        private FeedObserver<E> observer;
        @Nullable
        private Throwable error;
        private boolean closed = false;

        private InMemoryFeedHandle(long startAfter) {
            this.lastSeenSequenceNumber = startAfter;
        }

        @Override
        public void start(FeedObserver<E> observer) {
            requireNonNull(observer, FeedObserver.class.getSimpleName() + " cannot be null");
            synchronized (InMemoryChangeFeed.this) {
                if (this.observer != null) {
                    throw new IllegalStateException("Handle is already started");
                }
                this.observer = observer;
                if (error != null) {
                    observer.onError(error);
                    return;
                }
                for (Entry<E> entry : history) {
                    if (entry.sequenceNumber > lastSeenSequenceNumber) {
                        lastSeenSequenceNumber = entry.sequenceNumber;
                        observer.onChange(entry.event);
                    }
                }
            }
        }

        @Override
        public Optional<ResumePosition> resumePosition() {
            synchronized (InMemoryChangeFeed.this) {
                return Optional.of(positionOf(lastSeenSequenceNumber));
            }
        }

        @Override
        public boolean isClosed() {
            synchronized (InMemoryChangeFeed.this) {
                return closed;
            }
        }

        @Override
        public CompletableFuture<Void> close() {
            synchronized (InMemoryChangeFeed.this) {
                closed = true;
                handles.remove(this);
            }
            return CompletableFuture.completedFuture(null);
        }

        private void eventAvailable(long sequenceNumber, E event) {
            if (observer != null && error == null && !closed) {
                lastSeenSequenceNumber = sequenceNumber;
                observer.onChange(event);
            }
        }

        private void fail(Throwable throwable) {
            if (closed || error != null) {
                return;
            }
            error = throwable;
            handles.remove(this);
            if (observer != null) {
                observer.onError(throwable);
            }
        }
    }
}
