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

package dev.mars.trapfeed.feed.acknowledge;

import dev.mars.trapfeed.api.acknowledge.AcknowledgeRequest;
import dev.mars.trapfeed.api.acknowledge.AcknowledgeResult;
import dev.mars.trapfeed.api.store.EventStore;
import dev.mars.trapfeed.api.store.InventoryStore;
import dev.mars.trapfeed.feed.metrics.FeedMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves events in the event log and resets the derived node state in the inventory.
 *
 * <p>The two stores are updated one after the other without a shared transaction. A failure
 * of the event-log update fails the whole acknowledge. A failure of the inventory update
 * after the rows were resolved is logged and reported through
 * {@link AcknowledgeResult#inventoryCleared()}; the acknowledge itself still succeeds.</p>
 *
 * <p>Resolved rows are flagged updated by the store, so the next poll cycle broadcasts
 * them with {@code active = false}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class AcknowledgeHandler {

    private static final Logger logger = LoggerFactory.getLogger(AcknowledgeHandler.class);

    private final EventStore eventStore;
    private final InventoryStore inventoryStore;
    private final FeedMetrics metrics;

    public AcknowledgeHandler(EventStore eventStore, InventoryStore inventoryStore, FeedMetrics metrics) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.inventoryStore = Objects.requireNonNull(inventoryStore, "inventoryStore");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public Future<AcknowledgeResult> acknowledge(AcknowledgeRequest request) {
        logger.info("Acknowledge: rowIds={}, nodeIds={}, eventNames={}",
            request.rowIds(), request.nodeIds(), request.eventNames());

        return resolveRows(request)
            .compose(rowsResolved -> clearInventory(request, rowsResolved)
                .map(inventoryCleared -> new AcknowledgeResult(
                    request.rowIds(), request.nodeIds(), rowsResolved, inventoryCleared)));
    }

    private Future<Boolean> resolveRows(AcknowledgeRequest request) {
        if (request.rowIds().isEmpty()) {
            return Future.succeededFuture(false);
        }
        return eventStore.resolveRows(request.rowIds())
            .map(count -> {
                logger.debug("Resolved {} of {} rows", count, request.rowIds().size());
                return true;
            });
    }

    private Future<Boolean> clearInventory(AcknowledgeRequest request, boolean rowsResolved) {
        if (request.nodeIds().isEmpty()) {
            return Future.succeededFuture(true);
        }
        Future<Integer> cleared;
        try {
            cleared = inventoryStore.clearNodeState(request.nodeIds());
        } catch (RuntimeException e) {
            cleared = Future.failedFuture(e);
        }
        return cleared
            .map(count -> {
                logger.debug("Cleared node state on {} of {} devices", count, request.nodeIds().size());
                return true;
            })
            .recover(error -> {
                if (rowsResolved) {
                    metrics.partialAcknowledge();
                    logger.warn("Rows {} resolved but node state of {} was not cleared: {}",
                        request.rowIds(), request.nodeIds(), error.getMessage(), error);
                } else {
                    logger.warn("Node state of {} was not cleared: {}", request.nodeIds(), error.getMessage(), error);
                }
                return Future.succeededFuture(false);
            });
    }
}
