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

import dev.mars.trapfeed.feed.subscriber.FeedConnection;
import io.vertx.core.http.ServerWebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FeedConnection} over a Vert.x server WebSocket.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public class WebSocketFeedConnection implements FeedConnection {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketFeedConnection.class);

    private final String connectionId;
    private final ServerWebSocket webSocket;
    private final long createdAt;

    private volatile boolean active = true;
    private volatile long messagesSent = 0;

    public WebSocketFeedConnection(String connectionId, ServerWebSocket webSocket) {
        this.connectionId = connectionId;
        this.webSocket = webSocket;
        this.createdAt = System.currentTimeMillis();
        logger.debug("Created feed connection {} from {}", connectionId, webSocket.remoteAddress());
    }

    @Override
    public String id() {
        return connectionId;
    }

    @Override
    public boolean isOpen() {
        if (!active) {
            return false;
        }
        if (webSocket.isClosed()) {
            active = false;
            return false;
        }
        return true;
    }

    @Override
    public void send(String text) {
        if (!isOpen()) {
            logger.debug("Dropping message for closed connection {}", connectionId);
            return;
        }
        webSocket.writeTextMessage(text)
            .onFailure(error -> {
                logger.warn("Write to connection {} failed: {}", connectionId, error.getMessage());
                active = false;
            });
        messagesSent++;
    }

    @Override
    public void close() {
        if (!active) {
            return;
        }
        active = false;
        if (!webSocket.isClosed()) {
            webSocket.close()
                .onFailure(error -> logger.debug("Error closing connection {}: {}", connectionId, error.getMessage()));
        }
        logger.debug("Closed connection {} after {} ms and {} messages",
            connectionId, System.currentTimeMillis() - createdAt, messagesSent);
    }

    /** Marks the connection closed once the peer has gone. */
    void markClosed() {
        active = false;
    }

    public long getMessagesSent() {
        return messagesSent;
    }
}
