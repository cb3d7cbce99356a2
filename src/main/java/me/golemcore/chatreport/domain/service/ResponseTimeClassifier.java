package me.golemcore.chatreport.domain.service;

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

import me.golemcore.chatreport.domain.model.ResponseTimeBucket;
import org.springframework.stereotype.Component;

/**
 * Maps a response time in minutes to a {@link ResponseTimeBucket}.
 *
 * <p>
 * Bounds: below 60 is fast, up to and including 240 is medium, up to and
 * including 1440 is slow, anything longer is very slow. Missing or NaN input
 * is unanswered; negative input counts as fast.
 */
@Component
public class ResponseTimeClassifier {

    static final double FAST_BELOW = 60.0;
    static final double MEDIUM_UP_TO = 240.0;
    static final double SLOW_UP_TO = 1440.0;

    public ResponseTimeBucket classify(Double minutes) {
        if (minutes == null || minutes.isNaN()) {
            return ResponseTimeBucket.UNANSWERED;
        }
        if (minutes < FAST_BELOW) {
            return ResponseTimeBucket.FAST;
        }
        if (minutes <= MEDIUM_UP_TO) {
            return ResponseTimeBucket.MEDIUM;
        }
        if (minutes <= SLOW_UP_TO) {
            return ResponseTimeBucket.SLOW;
        }
        return ResponseTimeBucket.VERY_SLOW;
    }
}
