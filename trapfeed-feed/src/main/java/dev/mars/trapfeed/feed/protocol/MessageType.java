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

import java.util.Optional;

/**
 * Values of the {@code type} field of feed messages.
 */
public enum MessageType {

    // server to client
    INIT("init"),
    UPDATE("update"),
    PAGE("page"),
    ACKNOWLEDGE_DONE("acknowledge_done"),
    ERROR("error"),

    // client to server
    GET_PAGE("getPage"),
    ACKNOWLEDGE("acknowledge");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
