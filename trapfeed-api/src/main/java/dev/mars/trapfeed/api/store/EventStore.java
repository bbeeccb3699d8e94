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

package dev.mars.trapfeed.api.store;

import dev.mars.trapfeed.api.event.CheckpointSnapshot;
import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.api.event.PageFilter;
import io.vertx.core.Future;

import java.util.Collection;
import java.util.List;

/**
 * Query and mutation port onto the primary event store ({@code rcv_log}).
 *
 * <p>Implementations are pure I/O: every method maps to one parameterized statement.
 * Failures are reported through the returned {@link Future}, never thrown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public interface EventStore {

    /**
     * Reads the current maximum identifier and update time.
     * Completes with {@link CheckpointSnapshot#EMPTY} values on an empty table.
     */
    Future<CheckpointSnapshot> fetchCheckpoint();

    /**
     * Rows whose identifier is greater than {@code afterId}, ascending by identifier.
     */
    Future<List<EventRecord>> fetchNewRows(long afterId, int limit);

    /**
     * Rows currently flagged as updated, ascending by identifier, regardless of the checkpoint.
     */
    Future<List<EventRecord>> fetchUpdatedRows(int limit);

    /**
     * Clears the updated flag on the given rows in a single statement.
     *
     * @return the number of rows touched
     */
    Future<Integer> clearUpdatedFlags(Collection<Long> ids);

    /**
     * One page of rows ordered by identifier descending.
     */
    Future<List<EventRecord>> fetchPage(PageFilter filter, int offset, int limit);

    /**
     * Marks the given rows resolved ({@code active = false}) and flags them updated so the
     * change is picked up by the next poll cycle.
     *
     * @return the number of rows touched
     */
    Future<Integer> resolveRows(Collection<Long> ids);
}
