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

import io.vertx.core.Future;

import java.util.Collection;

/**
 * Mutation port onto the external device inventory ({@code dcim_device}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public interface InventoryStore {

    /**
     * Sets {@code node_state} to 0 inside each entry's custom field document, keeping
     * every other key of that document.
     *
     * @return the number of entries touched
     */
    Future<Integer> clearNodeState(Collection<Long> nodeIds);
}
