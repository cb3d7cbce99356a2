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

import java.util.Locale;
import java.util.Optional;

/**
 * Category assigned to a detected question.
 */
public enum QuestionCategory {
    TECHNICAL("technical", "🔧 Technical"), BUSINESS("business", "💼 Business"), OTHER("other", "❓ Other");

    private final String wireName;
    private final String badge;

    QuestionCategory(String wireName, String badge) {
        this.wireName = wireName;
        this.badge = badge;
    }

    public String getWireName() {
        return wireName;
    }

    public String getBadge() {
        return badge;
    }

    /**
     * Resolve the category from its wire name; unknown values are not mapped.
     */
    public static Optional<QuestionCategory> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QuestionCategory category : values()) {
            if (category.wireName.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
