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

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * <p>
 * Attempt numbers start at 1. The delay after attempt {@code n} is
 * {@code initialDelay * multiplier^(n-1)} capped at {@code maxDelay}; a server
 * hint replaces the computed delay when it is longer, and is also capped.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, 2.0, maxDelay);
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    public Duration delayForAttempt(int attempt, Duration hint) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        Duration computed = Duration.ofMillis(millis);
        if (hint != null && hint.compareTo(computed) > 0) {
            return hint.compareTo(maxDelay) > 0 ? maxDelay : hint;
        }
        return computed;
    }
}
