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

package dev.mars.trapfeed.api.acknowledge;

import java.util.List;

/**
 * Outcome of an acknowledge request.
 *
 * <p>The identifier lists are always the ones that were targeted. The two flags tell
 * whether each store mutation succeeded; the stores are not updated atomically, so
 * {@code rowsResolved && !inventoryCleared} is a legitimate, logged outcome.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public record AcknowledgeResult(
        List<Long> rowIds,
        List<Long> nodeIds,
        boolean rowsResolved,
        boolean inventoryCleared) {

    public AcknowledgeResult {
        rowIds = List.copyOf(rowIds);
        nodeIds = List.copyOf(nodeIds);
    }

    public boolean isPartial() {
        return rowsResolved && !inventoryCleared;
    }
}
