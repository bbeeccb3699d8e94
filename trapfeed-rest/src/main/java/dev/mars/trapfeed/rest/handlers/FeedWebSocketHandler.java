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

import dev.mars.trapfeed.api.acknowledge.AcknowledgeRequest;
import dev.mars.trapfeed.feed.FeedEngine;
import dev.mars.trapfeed.feed.protocol.FeedMessages;
import dev.mars.trapfeed.feed.protocol.MessageType;
import dev.mars.trapfeed.feed.subscriber.Subscriber;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket endpoint of the feed.
 *
 * <p>On connect the client is registered as a subscriber without a filter and receives the
 * first page as {@code init}. Afterwards it receives every {@code update} broadcast and may
 * send {@code getPage} and {@code acknowledge} requests. Malformed requests are answered with
 * {@code error} and the connection stays open.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public class FeedWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(FeedWebSocketHandler.class);

    static final String INITIAL_LOAD_FAILED = "initial load failed";
    static final String UNSUPPORTED_TYPE = "unsupported message type";
    static final String INVALID_FORMAT = "invalid message format";
    static final String BINARY_NOT_SUPPORTED = "binary messages are not supported";
    static final String REQUEST_FAILED = "request failed";

    private final FeedEngine engine;
    private final FeedMessages messages;
    private final AtomicLong connectionIdCounter = new AtomicLong(0);

    public FeedWebSocketHandler(FeedEngine engine) {
        this.engine = engine;
        this.messages = engine.messages();
    }

    public void handle(ServerWebSocket webSocket) {
        String connectionId = "ws-" + connectionIdCounter.incrementAndGet();
        WebSocketFeedConnection connection = new WebSocketFeedConnection(connectionId, webSocket);
        Subscriber subscriber = engine.subscribers().register(connection);
        logger.info("Feed client connected: {} from {}", connectionId, webSocket.remoteAddress());

        webSocket.textMessageHandler(text -> handleTextMessage(subscriber, text));
        webSocket.binaryMessageHandler(buffer -> handleBinaryMessage(subscriber, buffer));
        webSocket.exceptionHandler(error -> handleError(subscriber, error));
        webSocket.closeHandler(v -> handleClose(connection));

        sendInitialPage(subscriber);
    }

    private void sendInitialPage(Subscriber subscriber) {
        engine.pages().firstPage()
            .onSuccess(page -> subscriber.send(messages.init(page.rows())))
            .onFailure(error -> {
                logger.error("Initial page for {} failed: {}", subscriber.id(), error.getMessage(), error);
                subscriber.send(messages.error(INITIAL_LOAD_FAILED));
            });
    }

    void handleTextMessage(Subscriber subscriber, String text) {
        JsonObject message;
        try {
            message = new JsonObject(text);
        } catch (DecodeException | ClassCastException e) {
            logger.warn("Invalid message from {}: {}", subscriber.id(), e.getMessage());
            subscriber.send(messages.error(INVALID_FORMAT));
            return;
        }

        Object typeValue = message.getValue("type");
        Optional<MessageType> type = typeValue instanceof String name
            ? MessageType.fromWireName(name)
            : Optional.empty();
        if (type.isEmpty()) {
            logger.debug("Unsupported message type from {}: {}", subscriber.id(), typeValue);
            subscriber.send(messages.error(UNSUPPORTED_TYPE));
            return;
        }

        switch (type.get()) {
            case GET_PAGE -> handleGetPage(subscriber, message);
            case ACKNOWLEDGE -> handleAcknowledge(subscriber, message);
            default -> subscriber.send(messages.error(UNSUPPORTED_TYPE));
        }
    }

    private void handleGetPage(Subscriber subscriber, JsonObject message) {
        GetPageRequest request = FeedRequestParser.parseGetPage(message);
        request.severityChange().applyTo(subscriber);

        engine.pages().getPage(request.offset(), request.pageSize(), request.toFilter(subscriber.severityFilter()))
            .onSuccess(page -> {
                subscriber.send(messages.page(page.offset(), page.rows()));
                logger.debug("Page for {}: offset={}, severityFilter={}, rows={}",
                    subscriber.id(), page.offset(), subscriber.severityFilter(), page.rows().size());
            })
            .onFailure(error -> {
                logger.error("Page request from {} failed: {}", subscriber.id(), error.getMessage(), error);
                subscriber.send(messages.error(REQUEST_FAILED));
            });
    }

    private void handleAcknowledge(Subscriber subscriber, JsonObject message) {
        AcknowledgeRequest request = FeedRequestParser.parseAcknowledge(message);

        engine.acknowledgements().acknowledge(request)
            .onSuccess(result -> subscriber.send(messages.acknowledgeDone(result.rowIds(), result.nodeIds())))
            .onFailure(error -> {
                logger.error("Acknowledge from {} failed: {}", subscriber.id(), error.getMessage(), error);
                subscriber.send(messages.error(REQUEST_FAILED));
            });
    }

    private void handleBinaryMessage(Subscriber subscriber, Buffer buffer) {
        logger.debug("Binary message from {}: {} bytes", subscriber.id(), buffer.length());
        subscriber.send(messages.error(BINARY_NOT_SUPPORTED));
    }

    private void handleError(Subscriber subscriber, Throwable error) {
        logger.error("WebSocket error on {}: {}", subscriber.id(), error.getMessage(), error);
        engine.subscribers().unregister(subscriber.id());
    }

    private void handleClose(WebSocketFeedConnection connection) {
        connection.markClosed();
        engine.subscribers().unregister(connection.id());
        logger.info("Feed client disconnected: {}", connection.id());
    }
}
