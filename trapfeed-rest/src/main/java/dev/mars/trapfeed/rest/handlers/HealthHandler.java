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

import dev.mars.trapfeed.feed.FeedEngine;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@code GET /health}: store reachability plus the feed's own state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public class HealthHandler {

    private final FeedEngine engine;
    private final Map<String, Supplier<Future<Boolean>>> storeChecks;

    public HealthHandler(FeedEngine engine, Map<String, Supplier<Future<Boolean>>> storeChecks) {
        this.engine = engine;
        this.storeChecks = new LinkedHashMap<>(storeChecks);
    }

    public void handle(RoutingContext ctx) {
        List<String> names = new ArrayList<>(storeChecks.keySet());
        List<Future<Boolean>> checks = new ArrayList<>();
        for (String name : names) {
            checks.add(storeChecks.get(name).get().recover(error -> Future.succeededFuture(false)));
        }

        Future.join(checks).onComplete(ar -> {
            JsonObject stores = new JsonObject();
            boolean allUp = true;
            for (int i = 0; i < names.size(); i++) {
                boolean up = Boolean.TRUE.equals(checks.get(i).result());
                stores.put(names.get(i), up ? "UP" : "DOWN");
                allUp &= up;
            }

            JsonObject body = new JsonObject()
                .put("status", allUp ? "UP" : "DOWN")
                .put("stores", stores)
                .put("subscribers", engine.subscribers().size())
                .put("checkpoint", engine.checkpoint().highWaterMark())
                .put("polling", engine.poller().isRunning());

            ctx.response()
                .setStatusCode(allUp ? 200 : 503)
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
        });
    }
}
