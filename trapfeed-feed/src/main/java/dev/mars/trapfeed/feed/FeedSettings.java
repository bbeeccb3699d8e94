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

package dev.mars.trapfeed.feed;

import dev.mars.trapfeed.feed.broadcast.FanOutBroadcaster;
import dev.mars.trapfeed.feed.page.PageQueryService;
import dev.mars.trapfeed.feed.poller.ChangePoller;

/**
 * Tuning of the feed engine.
 *
 * @param pollIntervalMs  pause between the end of one poll cycle and the start of the next
 * @param pollBatchLimit  cap on new rows and on updated rows read per cycle
 * @param chunkSize       rows per broadcast message
 * @param pageSize        page size used when a request gives none
 * @param maxPageRows     hard ceiling on rows per page
 */
public record FeedSettings(long pollIntervalMs, int pollBatchLimit, int chunkSize, int pageSize, int maxPageRows) {

    public FeedSettings {
        requirePositive("pollIntervalMs", pollIntervalMs);
        requirePositive("pollBatchLimit", pollBatchLimit);
        requirePositive("chunkSize", chunkSize);
        requirePositive("pageSize", pageSize);
        requirePositive("maxPageRows", maxPageRows);
    }

    public static FeedSettings defaults() {
        return new FeedSettings(
            ChangePoller.DEFAULT_INTERVAL_MS,
            ChangePoller.DEFAULT_BATCH_LIMIT,
            FanOutBroadcaster.DEFAULT_CHUNK_SIZE,
            PageQueryService.DEFAULT_PAGE_SIZE,
            PageQueryService.DEFAULT_MAX_PAGE_ROWS);
    }

    public FeedSettings withPollIntervalMs(long intervalMs) {
        return new FeedSettings(intervalMs, pollBatchLimit, chunkSize, pageSize, maxPageRows);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
