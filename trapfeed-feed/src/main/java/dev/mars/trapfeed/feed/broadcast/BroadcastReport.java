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

package dev.mars.trapfeed.feed.broadcast;

/**
 * Outcome of one broadcast.
 *
 * @param chunks              number of chunks the rows were split into
 * @param messagesSent        messages handed to subscriber connections
 * @param rowsSent            rows summed over every message sent
 * @param subscribersReached  distinct subscribers that received at least one message
 * @param sendFailures        sends that threw and were skipped
 */
public record BroadcastReport(int chunks, int messagesSent, int rowsSent, int subscribersReached, int sendFailures) {

    public static final BroadcastReport EMPTY = new BroadcastReport(0, 0, 0, 0, 0);
}
