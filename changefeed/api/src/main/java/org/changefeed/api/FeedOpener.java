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
import org.jspecify.annotations.Nullable;

/**
 * Opens a new subscription to a change feed. This is the only coupling point between a subscription manager
 * and the underlying feed source, the manager never creates a {@link FeedHandle} by itself.
 *
 * @param <E> The type of the change events
 */
@NullMarked
@FunctionalInterface
public interface FeedOpener<E> {

    /**
     * Open a subscription to the change feed.
     * <p>
     * Implementations must fail <i>synchronously</i>, by throwing, when the subscription cannot be established. An error
     * that is only reported later through the {@link FeedObserver} will not trigger an immediate retry without the
     * resume position.
     * </p>
     *
     * @param resumePosition The position to continue from, or {@code null} to start at the default position defined by the feed (typically "now").
     * @return A new, not yet started, {@link FeedHandle}.
     */
    FeedHandle<E> open(@Nullable ResumePosition resumePosition);
}
