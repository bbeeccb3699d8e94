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

package dev.mars.trapfeed.rest.config;

import dev.mars.trapfeed.db.config.PgConnectionConfig;
import dev.mars.trapfeed.db.config.PgPoolConfig;
import dev.mars.trapfeed.feed.FeedSettings;
import dev.mars.trapfeed.feed.broadcast.FanOutBroadcaster;
import dev.mars.trapfeed.feed.page.PageQueryService;
import dev.mars.trapfeed.feed.poller.ChangePoller;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable, validated configuration of the feed server.
 * Parsed once at bootstrap from the merged {@code ConfigRetriever} JSON and injected into
 * the verticle.
 *
 * <p>Besides the structured keys, the flat environment names used by existing deployments
 * are honoured and win over the structured values: {@code PORT}, {@code POLL_INTERVAL_MS},
 * {@code DB_HOST}, {@code DB_PORT}, {@code DB_USER}, {@code DB_PASSWORD}, {@code DB_DATABASE}
 * for the event store and {@code PG_HOST}, {@code PG_PORT}, {@code PG_USER},
 * {@code PG_PASSWORD}, {@code PG_DATABASE} for the inventory store.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public record FeedServerConfig(
        int port,
        String wsPath,
        FeedSettings feed,
        StoreConfig eventStore,
        StoreConfig inventoryStore) {

    public static final int DEFAULT_PORT = 3000;
    public static final String DEFAULT_WS_PATH = "/ws";

    /**
     * Connection settings of one PostgreSQL store.
     */
    public record StoreConfig(
            String host,
            int port,
            String database,
            String username,
            String password,
            String schema,
            boolean ssl,
            int maxPoolSize) {

        public StoreConfig {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must be provided");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be 1-65535");
            }
            if (database == null || database.isBlank()) {
                throw new IllegalArgumentException("database must be provided");
            }
            if (username == null || username.isBlank()) {
                throw new IllegalArgumentException("username must be provided");
            }
            if (maxPoolSize <= 0) {
                throw new IllegalArgumentException("maxPoolSize must be positive");
            }
        }

        static StoreConfig from(JsonObject json, JsonObject root, String envPrefix) {
            return new StoreConfig(
                text(root, envPrefix + "_HOST", json.getString("host", "localhost")),
                integer(root, envPrefix + "_PORT", integer(json, "port", 5432)),
                text(root, envPrefix + "_DATABASE", json.getString("database", "trapfeed")),
                text(root, envPrefix + "_USER", json.getString("username", "trapfeed")),
                text(root, envPrefix + "_PASSWORD", json.getString("password")),
                json.getString("schema"),
                json.getBoolean("ssl", false),
                integer(json, "maxPoolSize", PgPoolConfig.defaults().maxSize()));
        }

        public PgConnectionConfig toConnectionConfig() {
            return PgConnectionConfig.builder()
                .host(host)
                .port(port)
                .database(database)
                .username(username)
                .password(password)
                .schema(schema)
                .sslEnabled(ssl)
                .pool(PgPoolConfig.defaults().withMaxSize(maxPoolSize))
                .build();
        }

        @Override
        public String toString() {
            return "StoreConfig{" + host + ":" + port + "/" + database + ", user=" + username
                + ", schema=" + schema + ", ssl=" + ssl + ", maxPoolSize=" + maxPoolSize + '}';
        }
    }

    public FeedServerConfig {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (wsPath == null || !wsPath.startsWith("/")) {
            throw new IllegalArgumentException("wsPath must start with '/'");
        }
        Objects.requireNonNull(feed, "feed settings must not be null");
        Objects.requireNonNull(eventStore, "eventStore config must not be null");
        Objects.requireNonNull(inventoryStore, "inventoryStore config must not be null");
    }

    /**
     * Parse and validate configuration from the merged configuration JSON.
     *
     * @throws IllegalArgumentException if a value is missing, malformed or out of range
     */
    public static FeedServerConfig from(JsonObject json) {
        int port = integer(json, "PORT", integer(json, "port", DEFAULT_PORT));
        String wsPath = json.getString("wsPath", DEFAULT_WS_PATH);

        FeedSettings feed = new FeedSettings(
            longValue(json, "POLL_INTERVAL_MS", longValue(json, "pollIntervalMs", ChangePoller.DEFAULT_INTERVAL_MS)),
            integer(json, "pollBatchLimit", ChangePoller.DEFAULT_BATCH_LIMIT),
            integer(json, "chunkSize", FanOutBroadcaster.DEFAULT_CHUNK_SIZE),
            integer(json, "pageSize", PageQueryService.DEFAULT_PAGE_SIZE),
            integer(json, "maxPageRows", PageQueryService.DEFAULT_MAX_PAGE_ROWS));

        StoreConfig eventStore = StoreConfig.from(json.getJsonObject("eventStore", new JsonObject()), json, "DB");
        StoreConfig inventoryStore = StoreConfig.from(json.getJsonObject("inventoryStore", new JsonObject()), json, "PG");

        return new FeedServerConfig(port, wsPath, feed, eventStore, inventoryStore);
    }

    // Environment and system property values arrive as strings.
    private static int integer(JsonObject json, String key, int fallback) {
        long value = longValue(json, key, fallback);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range: " + value);
        }
        return (int) value;
    }

    private static long longValue(JsonObject json, String key, long fallback) {
        Object value = json.getValue(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new IllegalArgumentException(key + " must be a whole number, got " + number, e);
            }
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + text + "'", e);
        }
    }

    private static String text(JsonObject json, String key, String fallback) {
        Object value = json.getValue(key);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        return value.toString();
    }
}
