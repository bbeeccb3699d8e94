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

package dev.mars.trapfeed.feed.poller;

import dev.mars.trapfeed.feed.broadcast.BroadcastReport;

import java.util.List;

/**
 * What one poll cycle found and emitted.
 *
 * @param newRows        rows above the checkpoint returned by the store
 * @param updatedRows    rows flagged updated returned by the store
 * @param emittedIds     ids of the merged rows in emission order; their updated flag was cleared
 * @param broadcast      fan-out outcome
 * @param highWaterMark  checkpoint after the cycle
 */
public record PollCycleResult(
        int newRows,
        int updatedRows,
        List<Long> emittedIds,
        BroadcastReport broadcast,
        long highWaterMark) {

    public PollCycleResult {
        emittedIds = List.copyOf(emittedIds);
    }

    static PollCycleResult idle(long highWaterMark) {
        return new PollCycleResult(0, 0, List.of(), BroadcastReport.EMPTY, highWaterMark);
    }

    public boolean isIdle() {
        return emittedIds.isEmpty();
    }
}
