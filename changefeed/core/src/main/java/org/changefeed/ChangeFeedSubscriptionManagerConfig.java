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

import org.changefeed.api.ResumePosition;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration of a {@link ChangeFeedSubscriptionManager}.
 */
@NullMarked
public class ChangeFeedSubscriptionManagerConfig {
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final String DEFAULT_CONTROL_THREAD_NAME = "changefeed-control";

    public final Duration retryDelay;
    @Nullable
    public final ResumePosition initialResumePosition;
    public final String controlThreadName;

    /**
     * Create a config with a retry delay of one second and no initial resume position.
     */
    public ChangeFeedSubscriptionManagerConfig() {
        this(DEFAULT_RETRY_DELAY);
    }

    /**
     * @param retryDelay The fixed time to wait after the feed has failed before a new subscription is opened.
     */
    public ChangeFeedSubscriptionManagerConfig(Duration retryDelay) {
        this(retryDelay, null, DEFAULT_CONTROL_THREAD_NAME);
    }

    /**
     * @param retryDelay            The fixed time to wait after the feed has failed before a new subscription is opened.
     * @param initialResumePosition The position the first subscription should continue from, {@code null} to start at the default position of the feed.
     */
    public ChangeFeedSubscriptionManagerConfig(Duration retryDelay, @Nullable ResumePosition initialResumePosition) {
        this(retryDelay, initialResumePosition, DEFAULT_CONTROL_THREAD_NAME);
    }

    private ChangeFeedSubscriptionManagerConfig(Duration retryDelay, @Nullable ResumePosition initialResumePosition, String controlThreadName) {
        Objects.requireNonNull(retryDelay, "Retry delay cannot be null");
        Objects.requireNonNull(controlThreadName, "Control thread name cannot be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delay cannot be negative");
        }
        this.retryDelay = retryDelay;
        this.initialResumePosition = initialResumePosition;
        this.controlThreadName = controlThreadName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeFeedSubscriptionManagerConfig)) return false;
        ChangeFeedSubscriptionManagerConfig that = (ChangeFeedSubscriptionManagerConfig) o;
        return Objects.equals(retryDelay, that.retryDelay) && Objects.equals(initialResumePosition, that.initialResumePosition) && Objects.equals(controlThreadName, that.controlThreadName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retryDelay, initialResumePosition, controlThreadName);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ChangeFeedSubscriptionManagerConfig.class.getSimpleName() + "[", "]")
                .add("retryDelay=" + retryDelay)
                .add("initialResumePosition=" + initialResumePosition)
                .add("controlThreadName='" + controlThreadName + "'")
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private ResumePosition initialResumePosition;
        private String controlThreadName = DEFAULT_CONTROL_THREAD_NAME;

        /**
         * @param retryDelay The fixed time to wait between a feed failure and the next attempt to open the feed. Default is one second.
         * @return The builder instance
         */
        @NullMarked
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * @param initialResumePosition The position the first subscription should continue from. May be <code>null</code>.
         * @return The builder instance
         */
        public Builder initialResumePosition(ResumePosition initialResumePosition) {
            this.initialResumePosition = initialResumePosition;
            return this;
        }

        /**
         * @param controlThreadName The name of the thread that serializes all state changes, only used when the manager creates its own executor.
         * @return The builder instance
         */
        @NullMarked
        public Builder controlThreadName(String controlThreadName) {
            this.controlThreadName = controlThreadName;
            return this;
        }

        @NullMarked
        public ChangeFeedSubscriptionManagerConfig build() {
            return new ChangeFeedSubscriptionManagerConfig(retryDelay, initialResumePosition, controlThreadName);
        }
    }
}
