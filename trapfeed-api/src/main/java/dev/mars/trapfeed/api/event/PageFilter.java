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

package dev.mars.trapfeed.api.event;

import java.time.LocalDateTime;

/**
 * Optional restrictions applied to an on-demand page query.
 *
 * <p>Every field is optional; a null (or blank) value means the restriction is not applied.
 * The time bounds are inclusive and apply to the event's receive time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public record PageFilter(
        Integer severity,
        boolean activeOnly,
        String hostname,
        String agentIp,
        LocalDateTime timeFrom,
        LocalDateTime timeTo) {

    /** Filter that matches every row. */
    public static final PageFilter NONE = new PageFilter(null, false, null, null, null, null);

    public PageFilter {
        hostname = blankToNull(hostname);
        agentIp = blankToNull(agentIp);
    }

    public boolean hasSeverity() {
        return severity != null;
    }

    public boolean hasHostname() {
        return hostname != null;
    }

    public boolean hasAgentIp() {
        return agentIp != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Builder for PageFilter.
     */
    public static final class Builder {
        private Integer severity;
        private boolean activeOnly;
        private String hostname;
        private String agentIp;
        private LocalDateTime timeFrom;
        private LocalDateTime timeTo;

        public Builder severity(Integer severity) {
            this.severity = severity;
            return this;
        }

        public Builder activeOnly(boolean activeOnly) {
            this.activeOnly = activeOnly;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder agentIp(String agentIp) {
            this.agentIp = agentIp;
            return this;
        }

        public Builder timeFrom(LocalDateTime timeFrom) {
            this.timeFrom = timeFrom;
            return this;
        }

        public Builder timeTo(LocalDateTime timeTo) {
            this.timeTo = timeTo;
            return this;
        }

        public PageFilter build() {
            return new PageFilter(severity, activeOnly, hostname, agentIp, timeFrom, timeTo);
        }
    }
}
