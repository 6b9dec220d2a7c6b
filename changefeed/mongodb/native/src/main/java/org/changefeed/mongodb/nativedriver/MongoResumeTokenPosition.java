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

package org.changefeed.mongodb.nativedriver;

import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.changefeed.api.ResumePosition;
import org.jspecify.annotations.NullMarked;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * A {@link ResumePosition} backed by a MongoDB change stream resume token.
 */
@NullMarked
public class MongoResumeTokenPosition implements ResumePosition {
    static final String RESUME_TOKEN = "resumeToken";

    public final BsonDocument resumeToken;

    public MongoResumeTokenPosition(BsonDocument resumeToken) {
        this.resumeToken = Objects.requireNonNull(resumeToken, "Resume token cannot be null");
    }

    /**
     * Get the resume token out of any {@link ResumePosition}. Positions that are not a {@link MongoResumeTokenPosition}
     * are parsed from their string representation, which is either the JSON returned by {@link #asString()} or the
     * resume token document itself.
     *
     * @throws IllegalArgumentException If the position doesn't contain a resume token
     */
    public static BsonDocument resumeTokenOf(ResumePosition resumePosition) {
        if (resumePosition instanceof MongoResumeTokenPosition) {
            return ((MongoResumeTokenPosition) resumePosition).resumeToken;
        }

        String json = resumePosition.asString();
        final BsonDocument document;
        try {
            document = BsonDocument.parse(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Resume position " + json + " is not a MongoDB resume token", e);
        }
        if (document.isDocument(RESUME_TOKEN)) {
            return document.getDocument(RESUME_TOKEN);
        } else if (document.containsKey("_data")) {
            return document;
        }
        throw new IllegalArgumentException("Resume position " + json + " is not a MongoDB resume token");
    }

    @Override
    public String asString() {
        return new Document(RESUME_TOKEN, resumeToken).toJson();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoResumeTokenPosition)) return false;
        MongoResumeTokenPosition that = (MongoResumeTokenPosition) o;
        return Objects.equals(resumeToken, that.resumeToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resumeToken);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoResumeTokenPosition.class.getSimpleName() + "[", "]")
                .add("resumeToken=" + resumeToken)
                .toString();
    }
}
