package org.changefeed;

import org.changefeed.api.FeedHandle;
import org.changefeed.api.FeedObserver;
import org.changefeed.api.FeedOpener;
import org.changefeed.api.ResumePosition;
import org.changefeed.api.StringBasedResumePosition;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * A {@link FeedOpener} that is driven by the test: it records every call and lets the test push events and errors
 * through the handles it has opened.
 */
class ScriptedFeedOpener implements FeedOpener<String> {
    private final List<Optional<ResumePosition>> seeds = new CopyOnWriteArrayList<>();
    private final List<ScriptedHandle> handles = new CopyOnWriteArrayList<>();
    private volatile Predicate<Optional<ResumePosition>> failWhen = __ -> false;

    @Override
    public FeedHandle<String> open(ResumePosition resumePosition) {
        Optional<ResumePosition> seed = Optional.ofNullable(resumePosition);
        seeds.add(seed);
        if (failWhen.test(seed)) {
            throw new IllegalStateException("expected");
        }
        ScriptedHandle handle = new ScriptedHandle(resumePosition);
        handles.add(handle);
        return handle;
    }

    void failWhen(Predicate<Optional<ResumePosition>> failWhen) {
        this.failWhen = failWhen;
    }

    void failTimes(int times) {
        AtomicInteger failuresLeft = new AtomicInteger(times);
        this.failWhen = __ -> failuresLeft.getAndDecrement() > 0;
    }

    List<Optional<ResumePosition>> seeds() {
        return Collections.unmodifiableList(seeds);
    }

    int openCalls() {
        return seeds.size();
    }

    int opened() {
        return handles.size();
    }

    long openHandles() {
        return handles.stream().filter(handle -> !handle.isClosed()).count();
    }

    List<ScriptedHandle> handles() {
        return Collections.unmodifiableList(handles);
    }

    ScriptedHandle latest() {
        return handles.get(handles.size() - 1);
    }

    static ResumePosition position(String value) {
        return new StringBasedResumePosition(value);
    }

    static class ScriptedHandle implements FeedHandle<String> {
        private volatile FeedObserver<String> observer;
        private volatile ResumePosition resumePosition;
        private volatile boolean closed = false;
        private volatile boolean failOnClose = false;
        private final AtomicInteger closeCalls = new AtomicInteger();

        ScriptedHandle(ResumePosition resumePosition) {
            this.resumePosition = resumePosition;
        }

        @Override
        public void start(FeedObserver<String> observer) {
            this.observer = observer;
        }

        boolean isStarted() {
            return observer != null;
        }

        /**
         * Emit an event whose position is the event itself
         */
        void emit(String event) {
            resumePosition = position(event);
            observer.onChange(event);
        }

        void error(Throwable throwable) {
            observer.onError(throwable);
        }

        void failOnClose() {
            failOnClose = true;
        }

        int closeCalls() {
            return closeCalls.get();
        }

        @Override
        public Optional<ResumePosition> resumePosition() {
            return Optional.ofNullable(resumePosition);
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public CompletableFuture<Void> close() {
            closeCalls.incrementAndGet();
            closed = true;
            if (failOnClose) {
                return CompletableFuture.failedFuture(new IllegalStateException("expected close failure"));
            }
            return CompletableFuture.completedFuture(null);
        }
    }
}
