package dev.mars.trapfeed.db;

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

/**
 * Default constants for TrapFeed store access.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public final class TrapFeedDefaults {

    /** Pool identifier of the primary event store holding {@code rcv_log}. */
    public static final String EVENT_STORE_POOL_ID = "trapfeed-events";

    /** Pool identifier of the device inventory holding {@code dcim_device}. */
    public static final String INVENTORY_POOL_ID = "trapfeed-inventory";

    private TrapFeedDefaults() {
        // Prevent instantiation
    }
}
