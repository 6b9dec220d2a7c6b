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

/**
 * Receives the notifications of a {@link FeedHandle}. Notifications may arrive on any thread.
 *
 * @param <E> The type of the change events
 */
@NullMarked
public interface FeedObserver<E> {

    /**
     * Invoked for each change event, in the order the feed emits them.
     */
    void onChange(E event);

    /**
     * Invoked when the feed fails. The error is terminal, no change events are expected after it, but a handle
     * is allowed to report more than one error before it's fully closed.
     */
    void onError(Throwable throwable);
}
