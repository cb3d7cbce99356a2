package me.golemcore.chatreport.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Response latency buckets used in the report breakdown.
 */
public enum ResponseTimeBucket {
    FAST("⚡", "Fast (<1h)"), MEDIUM("🕐", "Medium (1-4h)"), SLOW("🐌", "Slow (4-24h)"), VERY_SLOW("🦥",
            "Very Slow (>24h)"), UNANSWERED("❌", "Unanswered");

    private final String icon;
    private final String label;

    ResponseTimeBucket(String icon, String label) {
        this.icon = icon;
        this.label = label;
    }

    public String getIcon() {
        return icon;
    }

    public String getLabel() {
        return label;
    }
}
