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

import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.changefeed.api.FeedHandle;
import org.changefeed.api.FeedOpener;
import org.changefeed.api.ResumePosition;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * A {@link FeedOpener} that watches a MongoDB collection using the "native" MongoDB Java driver (sync). Each opened
 * handle reads its change stream on a dedicated thread from the {@code cursorExecutor}.
 * <p>
 * The aggregation {@code pipeline} is applied to the change stream as is, use it to filter or reshape the change events.
 * </p>
 */
@NullMarked
public class MongoChangeStreamFeedOpener implements FeedOpener<ChangeStreamDocument<Document>> {
    private static final Logger log = LoggerFactory.getLogger(MongoChangeStreamFeedOpener.class);
    private static final Duration DEFAULT_MAX_AWAIT_TIME = Duration.ofMillis(500);

    private final MongoCollection<Document> collection;
    private final List<? extends Bson> pipeline;
    private final FullDocument fullDocument;
    private final Duration maxAwaitTime;
    private final ExecutorService cursorExecutor;
    private final boolean ownsCursorExecutor;

    /**
     * Watch all changes of the collection, looking up the full document on updates. Uses an unbounded cached thread pool
     * to read the change streams.
     *
     * @param collection The collection to watch
     */
    public MongoChangeStreamFeedOpener(MongoCollection<Document> collection) {
        this(collection, Collections.emptyList(), FullDocument.UPDATE_LOOKUP);
    }

    /**
     * @param collection   The collection to watch
     * @param pipeline     The aggregation stages to apply to the change stream
     * @param fullDocument Whether to look up the full document on updates
     */
    public MongoChangeStreamFeedOpener(MongoCollection<Document> collection, List<? extends Bson> pipeline, FullDocument fullDocument) {
        this(collection, pipeline, fullDocument, DEFAULT_MAX_AWAIT_TIME, Executors.newCachedThreadPool(), true);
    }

    /**
     * @param collection     The collection to watch
     * @param pipeline       The aggregation stages to apply to the change stream
     * @param fullDocument   Whether to look up the full document on updates
     * @param maxAwaitTime   How long the server waits for new changes before an empty batch is returned. This is also the max time it takes to close a handle.
     * @param cursorExecutor The executor that reads the change streams, a thread is occupied per open handle. It's not shut down by this instance.
     */
    public MongoChangeStreamFeedOpener(MongoCollection<Document> collection, List<? extends Bson> pipeline, FullDocument fullDocument,
                                       Duration maxAwaitTime, ExecutorService cursorExecutor) {
        this(collection, pipeline, fullDocument, maxAwaitTime, cursorExecutor, false);
    }

    private MongoChangeStreamFeedOpener(MongoCollection<Document> collection, List<? extends Bson> pipeline, FullDocument fullDocument,
                                        Duration maxAwaitTime, ExecutorService cursorExecutor, boolean ownsCursorExecutor) {
        requireNonNull(collection, "Collection cannot be null");
        requireNonNull(pipeline, "Pipeline cannot be null");
        requireNonNull(fullDocument, FullDocument.class.getSimpleName() + " cannot be null");
        requireNonNull(maxAwaitTime, "Max await time cannot be null");
        requireNonNull(cursorExecutor, "Cursor executor cannot be null");
        this.collection = collection;
        this.pipeline = List.copyOf(pipeline);
        this.fullDocument = fullDocument;
        this.maxAwaitTime = maxAwaitTime;
        this.cursorExecutor = cursorExecutor;
        this.ownsCursorExecutor = ownsCursorExecutor;
    }

    @Override
    public FeedHandle<ChangeStreamDocument<Document>> open(@Nullable ResumePosition resumePosition) {
        if (cursorExecutor.isShutdown()) {
            throw new IllegalStateException("Cannot open change stream because the cursor executor is shutdown");
        }
        ChangeStreamIterable<Document> changeStream = collection.watch(pipeline)
                .fullDocument(fullDocument)
                .maxAwaitTime(maxAwaitTime.toMillis(), MILLISECONDS);
        if (resumePosition != null) {
            changeStream = changeStream.startAfter(MongoResumeTokenPosition.resumeTokenOf(resumePosition));
        }
        // Opening the cursor runs the aggregation, so an unreachable server or a stale resume token fails here
        MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor = changeStream.cursor();
        log.debug("Opened change stream on {} at {}", collection.getNamespace(), resumePosition);
        return new MongoChangeStreamFeedHandle(cursor, cursorExecutor);
    }

    @PreDestroy
    public void shutdown() {
        if (!ownsCursorExecutor || cursorExecutor.isShutdown()) {
            return;
        }
        cursorExecutor.shutdown();
        try {
            if (!cursorExecutor.awaitTermination(maxAwaitTime.toMillis() * 2 + 1000, TimeUnit.MILLISECONDS)) {
                cursorExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cursorExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
