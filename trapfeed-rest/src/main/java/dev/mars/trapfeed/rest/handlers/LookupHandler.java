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

package dev.mars.trapfeed.rest.handlers;

import dev.mars.trapfeed.api.store.LookupStore;
import dev.mars.trapfeed.rest.error.ErrorResponse;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Read-only reference data routes used by the dashboard.
 */
public class LookupHandler {

    private static final Logger logger = LoggerFactory.getLogger(LookupHandler.class);

    static final String LOOKUP_FAILED = "failed to load reference data";

    private final LookupStore lookupStore;

    public LookupHandler(LookupStore lookupStore) {
        this.lookupStore = lookupStore;
    }

    /** {@code GET /api/mibsobj}: every MIB object row. */
    public void listMibObjects(RoutingContext ctx) {
        respond(ctx, "mib objects", lookupStore::listMibObjects);
    }

    /** {@code GET /api/nodes}: polled nodes without their ids. */
    public void listNodes(RoutingContext ctx) {
        respond(ctx, "nodes", lookupStore::listNodes);
    }

    private void respond(RoutingContext ctx, String what, Supplier<Future<JsonArray>> query) {
        query.get()
            .onSuccess(rows -> ctx.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "application/json")
                .end(rows.encode()))
            .onFailure(error -> {
                logger.error("Failed to load {}: {}", what, error.getMessage(), error);
                ErrorResponse.internalError(ctx, LOOKUP_FAILED);
            });
    }
}
