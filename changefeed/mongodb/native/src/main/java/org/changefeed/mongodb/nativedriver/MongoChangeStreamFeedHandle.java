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

import com.mongodb.MongoException;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import org.bson.BsonDocument;
import org.bson.Document;
import org.changefeed.api.FeedHandle;
import org.changefeed.api.FeedObserver;
import org.changefeed.api.ResumePosition;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A {@link FeedHandle} that reads a MongoDB change stream cursor on a thread of its own.
 */
@NullMarked
class MongoChangeStreamFeedHandle implements FeedHandle<ChangeStreamDocument<Document>> {
    private static final Logger log = LoggerFactory.getLogger(MongoChangeStreamFeedHandle.class);

    private final MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
    private final Executor cursorExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();

    @Nullable
    private volatile BsonDocument resumeToken;
    private volatile boolean closed = false;

    MongoChangeStreamFeedHandle(MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor, Executor cursorExecutor) {
        this.cursor = cursor;
        this.cursorExecutor = cursorExecutor;
        this.resumeToken = cursor.getResumeToken();
    }

    @Override
    public void start(FeedObserver<ChangeStreamDocument<Document>> observer) {
        requireNonNull(observer, FeedObserver.class.getSimpleName() + " cannot be null");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Change stream is already started");
        }
        cursorExecutor.execute(() -> readChanges(observer));
    }

    private void readChanges(FeedObserver<ChangeStreamDocument<Document>> observer) {
        try {
            while (!closed) {
                ChangeStreamDocument<Document> changeStreamDocument = cursor.tryNext();
                if (changeStreamDocument != null) {
                    resumeToken = changeStreamDocument.getResumeToken();
                    observer.onChange(changeStreamDocument);
                } else {
                    BsonDocument postBatchResumeToken = cursor.getResumeToken();
                    if (postBatchResumeToken != null) {
                        resumeToken = postBatchResumeToken;
                    }
                }
            }
        } catch (MongoException e) {
            if (closed) {
                log.debug("Caught {} (code={}, message={}), this might happen when cursor is shutdown.", e.getClass().getName(), e.getCode(), e.getMessage(), e);
            } else {
                observer.onError(e);
            }
        } catch (IllegalStateException e) {
            if (closed) {
                log.debug("Caught {} (message={}), this might happen when cursor is shutdown.", e.getClass().getName(), e.getMessage(), e);
            } else {
                observer.onError(e);
            }
        } finally {
            stopped.complete(null);
        }
    }

    @Override
    public Optional<ResumePosition> resumePosition() {
        return Optional.ofNullable(resumeToken).map(MongoResumeTokenPosition::new);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public CompletableFuture<Void> close() {
        if (!closed) {
            closed = true;
            try {
                cursor.close();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        if (!started.get()) {
            stopped.complete(null);
        }
        return stopped.copy();
    }
}
