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

package dev.mars.trapfeed.feed.subscriber;

/**
 * Outbound side of one subscriber's transport.
 *
 * <p>Implementations must make {@link #send(String)} a silent no-op once the underlying
 * connection has closed.</p>
 */
public interface FeedConnection {

    /** Stable identifier of the connection, unique among open connections. */
    String id();

    boolean isOpen();

    /** Sends one text message. */
    void send(String text);

    void close();
}
