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
 * A subscriber's request to resolve event rows and clear the derived state of
 * the related inventory entries.
 *
 * @param rowIds     event identifiers to mark resolved
 * @param nodeIds    inventory entry identifiers whose node state is cleared
 * @param eventNames event names of the acknowledged rows, carried for logging only
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public record AcknowledgeRequest(List<Long> rowIds, List<Long> nodeIds, List<String> eventNames) {

    public AcknowledgeRequest {
        rowIds = rowIds == null ? List.of() : List.copyOf(rowIds);
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
        eventNames = eventNames == null ? List.of() : List.copyOf(eventNames);
    }
}
