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

package org.changefeed.api;

import org.jspecify.annotations.NullMarked;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A live subscription to a change feed, created by a {@link FeedOpener}. A handle is bound to the position it was
 * opened at and is exclusively owned by whoever opened it.
 *
 * @param <E> The type of the change events
 */
@NullMarked
public interface FeedHandle<E> {

    /**
     * Start delivering change events and errors to the supplied observer. No events are delivered before this method
     * is called. It's invoked at most once per handle.
     *
     * @param observer The observer that receives the notifications of this handle.
     */
    void start(FeedObserver<E> observer);

    /**
     * @return The last known position of this handle, or empty if the feed hasn't reported one yet.
     */
    Optional<ResumePosition> resumePosition();

    /**
     * @return {@code true} if {@link #close()} has been called or the feed closed by itself.
     */
    boolean isClosed();

    /**
     * Close the subscription. Safe to invoke multiple times.
     *
     * @return A future that completes when the feed has confirmed the closure, or completes exceptionally if closing failed.
     */
    CompletableFuture<Void> close();
}
