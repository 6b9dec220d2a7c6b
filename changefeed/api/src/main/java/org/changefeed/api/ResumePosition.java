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
 * An opaque marker identifying a place in the history of a change feed from which a new subscription can continue.
 * How far back a position remains usable is bounded by the retention window of the underlying feed.
 */
@NullMarked
public interface ResumePosition {

    /**
     * @return A string representation of the position that the feed that produced it can parse back.
     */
    String asString();
}
