package dev.mars.trapfeed.db.config;

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

import java.time.Duration;
import java.util.Objects;

/**
 * Reactive pool sizing for one backing store.
 *
 * <p>The pool is the only throttle on store access: callers that find it exhausted
 * wait in the pool's queue until a connection frees up or {@link #connectionTimeout()}
 * expires, in which case the operation fails rather than the process.</p>
 *
 * @param maxSize           maximum number of connections
 * @param maxWaitQueueSize  maximum number of waiting requests, -1 for unbounded
 * @param connectionTimeout how long a request may wait for a connection
 * @param idleTimeout       how long an idle connection is kept
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public record PgPoolConfig(int maxSize, int maxWaitQueueSize, Duration connectionTimeout, Duration idleTimeout) {

    public PgPoolConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (maxWaitQueueSize < -1) {
            throw new IllegalArgumentException("maxWaitQueueSize must be -1 (unbounded) or >= 0");
        }
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
    }

    /**
     * Ten connections, unbounded wait queue, 2 second acquisition timeout, 30 second idle timeout.
     */
    public static PgPoolConfig defaults() {
        return new PgPoolConfig(10, -1, Duration.ofSeconds(2), Duration.ofSeconds(30));
    }

    public PgPoolConfig withMaxSize(int newMaxSize) {
        return new PgPoolConfig(newMaxSize, maxWaitQueueSize, connectionTimeout, idleTimeout);
    }
}
