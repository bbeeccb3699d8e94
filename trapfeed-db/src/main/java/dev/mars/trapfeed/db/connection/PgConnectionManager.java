package dev.mars.trapfeed.db.connection;

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

import dev.mars.trapfeed.db.config.PgConnectionConfig;
import dev.mars.trapfeed.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns one Vert.x reactive pool per backing store.
 *
 * <p>TrapFeed talks to two independent PostgreSQL databases: the event store holding
 * {@code rcv_log} and the device inventory. Each gets its own pool, registered under a
 * store identifier (see {@link dev.mars.trapfeed.db.TrapFeedDefaults}). Operations borrow
 * a connection through {@link #withConnection(String, Function)}; when the pool is exhausted
 * the returned future simply completes later, so a busy store never blocks the event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final Vertx vertx;
    private final MeterRegistry meter;
    private final Map<String, Pool> pools = new ConcurrentHashMap<>();
    private final Map<String, String> searchPaths = new ConcurrentHashMap<>();

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
    }

    /**
     * Creates the pool for a store, or returns the existing one.
     *
     * @param storeId          store identifier
     * @param connectionConfig connection and pool settings of that store
     * @return the reactive pool
     */
    public Pool getOrCreatePool(String storeId, PgConnectionConfig connectionConfig) {
        Objects.requireNonNull(storeId, "storeId");
        Objects.requireNonNull(connectionConfig, "connectionConfig");

        return pools.computeIfAbsent(storeId, id -> {
            String schema = connectionConfig.getSchema();
            if (schema != null && !schema.isBlank()) {
                searchPaths.put(id, normalizeSearchPath(schema));
            }
            Pool pool = createPool(connectionConfig);
            logger.info("Created reactive pool '{}' for {} (maxSize={})",
                id, connectionConfig.describe(), connectionConfig.getPool().maxSize());
            if (meter != null) {
                Counter.builder("trapfeed.db.pool.created")
                    .tag("store", id)
                    .register(meter)
                    .increment();
            }
            return pool;
        });
    }

    /**
     * Runs an operation on a pooled connection of the given store, applying the configured
     * search_path first. The connection is returned to the pool when the operation completes.
     */
    public <T> Future<T> withConnection(String storeId, Function<SqlConnection, Future<T>> operation) {
        Pool pool = pools.get(storeId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No pool registered for store: " + storeId));
        }
        String searchPath = searchPaths.get(storeId);
        if (searchPath == null) {
            return pool.withConnection(operation);
        }
        return pool.withConnection(conn ->
            conn.query("SET search_path TO " + searchPath)
                .execute()
                .compose(rs -> operation.apply(conn)));
    }

    /**
     * Probes a store with {@code SELECT 1}.
     *
     * @return future completing with false instead of failing when the store is unreachable
     */
    public Future<Boolean> checkHealth(String storeId) {
        return withConnection(storeId, conn -> conn.query("SELECT 1").execute().map(rs -> true))
            .recover(err -> {
                logger.warn("Health check failed for store {}: {}", storeId, err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    public boolean hasPool(String storeId) {
        return pools.containsKey(storeId);
    }

    private Pool createPool(PgConnectionConfig config) {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword())
            .setSslMode(config.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);

        PgPoolConfig poolConfig = config.getPool();
        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(poolConfig.maxSize())
            .setMaxWaitQueueSize(poolConfig.maxWaitQueueSize())
            .setConnectionTimeout((int) poolConfig.connectionTimeout().toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) poolConfig.idleTimeout().toMillis())
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS);

        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    /**
     * Accepts comma separated identifiers only; anything else is rejected before it reaches SQL.
     */
    static String normalizeSearchPath(String schemaConfig) {
        String s = schemaConfig.trim();
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema config (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        List<String> parts = new ArrayList<>();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                parts.add(p);
            }
        }
        return String.join(", ", parts);
    }

    /**
     * Closes every pool. Close failures are logged and do not fail the returned future.
     */
    public Future<Void> closeAsync() {
        List<Future<Void>> closing = new ArrayList<>();
        for (Map.Entry<String, Pool> entry : pools.entrySet()) {
            String storeId = entry.getKey();
            closing.add(entry.getValue().close()
                .onSuccess(v -> logger.debug("Closed reactive pool '{}'", storeId))
                .onFailure(err -> logger.warn("Failed to close reactive pool '{}'", storeId, err)));
        }
        pools.clear();
        searchPaths.clear();
        return Future.join(closing)
            .<Void>mapEmpty()
            .recover(err -> Future.succeededFuture());
    }

    /**
     * Blocking close for {@link AutoCloseable} callers such as tests and shutdown hooks.
     * Must not be called on an event loop thread; use {@link #closeAsync()} there.
     *
     * @throws IllegalStateException when called on an event loop thread
     */
    @Override
    public void close() {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("close() blocks and cannot run on an event loop thread, use closeAsync()");
        }
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing pools", e);
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }
}
