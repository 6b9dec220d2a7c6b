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

import java.util.Objects;
import java.util.UUID;

/**
 * The token returned when registering a listener. Use it to unregister the listener again.
 *
 * @param id The unique id of the registration
 */
@NullMarked
public record ListenerRegistration(String id) {

    public ListenerRegistration {
        Objects.requireNonNull(id, "Registration id cannot be null");
    }

    public static ListenerRegistration random() {
        return new ListenerRegistration(UUID.randomUUID().toString());
    }
}
