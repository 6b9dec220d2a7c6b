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
import java.util.StringJoiner;

/**
 * A {@link ResumePosition} whose value is a plain string, for example a position read back from a configuration file.
 */
@NullMarked
public class StringBasedResumePosition implements ResumePosition {
    private final String value;

    public StringBasedResumePosition(String value) {
        Objects.requireNonNull(value, "Resume position value cannot be null");
        this.value = value;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringBasedResumePosition)) return false;
        StringBasedResumePosition that = (StringBasedResumePosition) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StringBasedResumePosition.class.getSimpleName() + "[", "]")
                .add("value='" + value + "'")
                .toString();
    }
}
