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

import org.changefeed.api.ResumePosition;

/**
 * Thrown when a feed is opened at a position that is no longer, or never was, part of the retained history.
 */
public class ResumePositionExpiredException extends RuntimeException {
    private final ResumePosition resumePosition;

    public ResumePositionExpiredException(ResumePosition resumePosition, String message) {
        super(message);
        this.resumePosition = resumePosition;
    }

    public ResumePosition getResumePosition() {
        return resumePosition;
    }
}
