/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.trapfeed.feed.checkpoint;

import dev.mars.trapfeed.api.event.CheckpointSnapshot;
import dev.mars.trapfeed.api.store.EventStore;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * High-water mark of the change feed: the highest event id already emitted and the
 * latest change time seen.
 *
 * <p>The mark lives in memory only. On restart it is re-derived from the store, so rows
 * that existed before the restart are not emitted again as new. Both values only ever
 * move forward; concurrent readers always see a consistent maximum.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class CheckpointTracker {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointTracker.class);

    private final EventStore eventStore;
    private final AtomicLong highWaterMark = new AtomicLong(0L);
    private final AtomicReference<LocalDateTime> lastChangeTime = new AtomicReference<>();

    public CheckpointTracker(EventStore eventStore) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    }

    /**
     * Seeds the mark from the store's current maximum.
     *
     * <p>The returned future always succeeds. When the store cannot be read the mark stays
     * at zero and the failure is logged, so an unavailable or empty store never prevents
     * startup.</p>
     *
     * @return the checkpoint after initialization
     */
    public Future<CheckpointSnapshot> initialize() {
        Future<CheckpointSnapshot> fetched;
        try {
            fetched = eventStore.fetchCheckpoint();
        } catch (RuntimeException e) {
            fetched = Future.failedFuture(e);
        }
        return fetched
            .map(snapshot -> {
                advance(snapshot.maxId(), snapshot.maxUpdateTime());
                logger.info("Checkpoint initialized: highWaterMark={}, lastChangeTime={}",
                    highWaterMark.get(), lastChangeTime.get());
                return snapshot();
            })
            .recover(error -> {
                logger.error("Failed to read initial checkpoint, starting from {}", highWaterMark.get(), error);
                return Future.succeededFuture(snapshot());
            });
    }

    /**
     * Moves the mark forward. Candidates below the current values are ignored, and a null
     * change time leaves the last change time untouched.
     *
     * @return the high-water mark after the call
     */
    public long advance(long candidateMax, LocalDateTime candidateChangeTime) {
        long mark = highWaterMark.accumulateAndGet(candidateMax, Math::max);
        if (candidateChangeTime != null) {
            lastChangeTime.accumulateAndGet(candidateChangeTime, CheckpointTracker::later);
        }
        return mark;
    }

    public long highWaterMark() {
        return highWaterMark.get();
    }

    public LocalDateTime lastChangeTime() {
        return lastChangeTime.get();
    }

    public CheckpointSnapshot snapshot() {
        return new CheckpointSnapshot(highWaterMark.get(), lastChangeTime.get());
    }

    private static LocalDateTime later(LocalDateTime current, LocalDateTime candidate) {
        if (current == null) {
            return candidate;
        }
        return candidate.isAfter(current) ? candidate : current;
    }
}
