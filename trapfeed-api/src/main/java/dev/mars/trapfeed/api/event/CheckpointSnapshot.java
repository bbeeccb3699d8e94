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

package dev.mars.trapfeed.api.event;

import java.time.LocalDateTime;

/**
 * High-water marks read from the event store: the largest identifier and the
 * latest update time currently present. Both are absent on an empty table.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public record CheckpointSnapshot(long maxId, LocalDateTime maxUpdateTime) {

    public static final CheckpointSnapshot EMPTY = new CheckpointSnapshot(0L, null);
}
