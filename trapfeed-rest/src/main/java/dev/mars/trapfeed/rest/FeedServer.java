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

package dev.mars.trapfeed.rest;

import dev.mars.trapfeed.db.connection.PgConnectionManager;
import dev.mars.trapfeed.feed.FeedEngine;
import dev.mars.trapfeed.rest.config.FeedServerConfig;
import dev.mars.trapfeed.rest.handlers.FeedWebSocketHandler;
import dev.mars.trapfeed.rest.handlers.HealthHandler;
import dev.mars.trapfeed.rest.handlers.LookupHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Vert.x verticle serving the change feed.
 *
 * <p>Owns the feed engine, the WebSocket endpoint on {@code wsPath}, the lookup routes and
 * {@code /health}. Started with only a configuration it opens its own PostgreSQL pools;
 * started with {@link FeedStores} it runs against those.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public class FeedServer extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(FeedServer.class);

    private final FeedServerConfig config;
    private final MeterRegistry meterRegistry;
    private FeedStores stores;

    private PgConnectionManager connectionManager;
    private FeedEngine engine;
    private HttpServer server;

    public FeedServer(FeedServerConfig config) {
        this(config, null, new SimpleMeterRegistry());
    }

    public FeedServer(FeedServerConfig config, FeedStores stores, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.stores = stores;
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Future.succeededFuture()
            .compose(v -> {
                if (stores == null) {
                    connectionManager = new PgConnectionManager(vertx, meterRegistry);
                    stores = FeedStores.postgres(connectionManager, config);
                    logger.info("Event store {}, inventory store {}", config.eventStore(), config.inventoryStore());
                }
                engine = new FeedEngine(vertx, stores.events(), stores.inventory(), config.feed(), meterRegistry);
                return engine.start();
            })
            .compose(checkpoint -> {
                Router router = createRouter();
                FeedWebSocketHandler webSocketHandler = new FeedWebSocketHandler(engine);
                return vertx.createHttpServer()
                    .requestHandler(router)
                    .webSocketHandler(webSocket -> {
                        if (config.wsPath().equals(webSocket.path())) {
                            webSocketHandler.handle(webSocket);
                        } else {
                            logger.debug("Rejecting WebSocket on unknown path {}", webSocket.path());
                            webSocket.close();
                        }
                    })
                    .listen(config.port());
            })
            .onSuccess(httpServer -> {
                server = httpServer;
                logger.info("Feed server listening on port {} (WebSocket {})", config.port(), config.wsPath());
                startPromise.complete();
            })
            .onFailure(cause -> {
                logger.error("Failed to start feed server", cause);
                shutdownEngine().onComplete(ar -> startPromise.fail(cause));
            });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping feed server");
        Future<Void> serverClosed = server != null ? server.close() : Future.succeededFuture();
        serverClosed
            .recover(error -> {
                logger.warn("Error closing HTTP server: {}", error.getMessage());
                return Future.succeededFuture();
            })
            .compose(v -> shutdownEngine())
            .onComplete(ar -> {
                logger.info("Feed server stopped");
                stopPromise.complete();
            });
    }

    public FeedEngine engine() {
        return engine;
    }

    private Router createRouter() {
        Router router = Router.router(vertx);
        router.route().handler(LoggerHandler.create());

        LookupHandler lookupHandler = new LookupHandler(stores.lookups());
        HealthHandler healthHandler = new HealthHandler(engine, stores.healthChecks());

        router.get("/api/mibsobj").handler(lookupHandler::listMibObjects);
        router.get("/api/nodes").handler(lookupHandler::listNodes);
        router.get("/health").handler(healthHandler::handle);
        return router;
    }

    private Future<Void> shutdownEngine() {
        if (engine != null) {
            engine.stop();
        }
        if (connectionManager != null) {
            return connectionManager.closeAsync()
                .recover(error -> {
                    logger.warn("Error closing store pools: {}", error.getMessage());
                    return Future.succeededFuture();
                });
        }
        return Future.succeededFuture();
    }
}
