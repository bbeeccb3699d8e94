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

package dev.mars.trapfeed.feed.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.trapfeed.api.event.EventRecord;

import java.util.List;

/**
 * Encodes outbound feed messages, one JSON object per text frame.
 *
 * <p>Rows are written with their column names and {@code yyyy-MM-dd HH:mm:ss} timestamps.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class FeedMessages {

    private final ObjectMapper objectMapper;

    public FeedMessages() {
        this(createObjectMapper());
    }

    public FeedMessages(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * {@code {type, rows}} for the row-carrying push messages ({@code init} and {@code update}).
     */
    public String rows(MessageType type, List<EventRecord> rows) {
        ObjectNode message = envelope(type);
        message.set("rows", objectMapper.valueToTree(rows));
        return write(message);
    }

    public String init(List<EventRecord> rows) {
        return rows(MessageType.INIT, rows);
    }

    public String update(List<EventRecord> rows) {
        return rows(MessageType.UPDATE, rows);
    }

    public String page(int offset, List<EventRecord> rows) {
        ObjectNode message = envelope(MessageType.PAGE);
        message.put("offset", offset);
        message.set("rows", objectMapper.valueToTree(rows));
        return write(message);
    }

    public String acknowledgeDone(List<Long> rowIds, List<Long> nodeIds) {
        ObjectNode message = envelope(MessageType.ACKNOWLEDGE_DONE);
        message.set("rowIds", objectMapper.valueToTree(rowIds));
        message.set("nodeIds", objectMapper.valueToTree(nodeIds));
        return write(message);
    }

    public String error(String errorMessage) {
        ObjectNode message = envelope(MessageType.ERROR);
        message.put("message", errorMessage);
        return write(message);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private ObjectNode envelope(MessageType type) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", type.wireName());
        return message;
    }

    private String write(ObjectNode message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.path("type").asText() + " message", e);
        }
    }
}
