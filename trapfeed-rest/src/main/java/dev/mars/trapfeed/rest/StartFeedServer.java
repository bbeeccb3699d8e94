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

import dev.mars.trapfeed.rest.config.FeedServerConfig;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the feed server with configuration loaded through {@link ConfigRetriever}.
 *
 * Configuration precedence (highest to lowest):
 * 1. System properties (-Dport=9090 -DpollIntervalMs=1000)
 * 2. Environment variables (PORT, POLL_INTERVAL_MS, DB_*, PG_*)
 * 3. Config file (conf/feed-server.json)
 * 4. Defaults (in FeedServerConfig)
 *
 * Usage:
 * <pre>
 * mvn exec:java -pl trapfeed-rest
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @see FeedServer
 * @see FeedServerConfig
 */
public final class StartFeedServer {

    private static final Logger logger = LoggerFactory.getLogger(StartFeedServer.class);

    private StartFeedServer() {
        // Utility class - not instantiable
    }

    public static void main(String[] args) {
        Vertx vertx = Vertx.vertx();

        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setOptional(true)
            .setConfig(new JsonObject().put("path", "conf/feed-server.json"));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("raw-data", true));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
            .setType("sys")
            .setConfig(new JsonObject().put("cache", false));

        ConfigRetrieverOptions retrieverOptions = new ConfigRetrieverOptions()
            .addStore(fileStore)
            .addStore(envStore)
            .addStore(sysPropsStore);

        ConfigRetriever retriever = ConfigRetriever.create(vertx, retrieverOptions);

        retriever.getConfig()
            .compose(json -> {
                FeedServerConfig config = FeedServerConfig.from(json);
                logger.info("Configuration loaded: port={}, wsPath={}, feed={}",
                    config.port(), config.wsPath(), config.feed());
                return vertx.deployVerticle(new FeedServer(config));
            })
            .onSuccess(id -> logger.info("Feed server deployed ({})", id))
            .onFailure(cause -> {
                logger.error("Failed to start feed server: {}", cause.getMessage(), cause);
                vertx.close().onComplete(ar -> System.exit(1));
            });
    }
}
