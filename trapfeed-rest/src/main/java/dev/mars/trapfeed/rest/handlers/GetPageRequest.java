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

import dev.mars.trapfeed.api.event.PageFilter;
import dev.mars.trapfeed.feed.subscriber.Subscriber;

import java.time.LocalDateTime;

/**
 * A parsed {@code getPage} message.
 *
 * <p>The severity is not part of the page filter here: it updates the subscriber's own
 * filter, which then applies to this page and to every later broadcast.</p>
 *
 * @param offset         requested offset, null when missing or not a number
 * @param pageSize       requested size, null when missing or not a number
 * @param severityChange what to do with the subscriber's severity filter
 * @param activeOnly     only rows still active
 * @param hostname       case-insensitive hostname substring
 * @param agentIp        exact agent address
 * @param timeFrom       inclusive lower bound on the trap time
 * @param timeTo         inclusive upper bound on the trap time
 */
public record GetPageRequest(
        Integer offset,
        Integer pageSize,
        SeverityChange severityChange,
        boolean activeOnly,
        String hostname,
        String agentIp,
        LocalDateTime timeFrom,
        LocalDateTime timeTo) {

    /**
     * Update of a subscriber's severity filter carried by a page request.
     *
     * @param present  whether the message carried a {@code severity} key at all
     * @param severity the new filter, null to clear it
     */
    public record SeverityChange(boolean present, Integer severity) {

        public static final SeverityChange KEEP = new SeverityChange(false, null);

        public static SeverityChange set(Integer severity) {
            return new SeverityChange(true, severity);
        }

        public void applyTo(Subscriber subscriber) {
            if (present) {
                subscriber.setSeverityFilter(severity);
            }
        }
    }

    /**
     * Page filter for this request once the subscriber's severity filter is known.
     */
    public PageFilter toFilter(Integer severity) {
        return PageFilter.builder()
            .severity(severity)
            .activeOnly(activeOnly)
            .hostname(hostname)
            .agentIp(agentIp)
            .timeFrom(timeFrom)
            .timeTo(timeTo)
            .build();
    }
}
