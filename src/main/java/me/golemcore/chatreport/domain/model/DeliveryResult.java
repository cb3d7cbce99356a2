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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one delivery batch.
 *
 * <p>
 * {@code total} counts every report handed to the dispatcher, including the
 * skipped zero-question ones; the escalation ratio is {@code failed / total}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryResult {

    private int total;
    private int sent;
    private int skipped;
    private int failed;

    @Builder.Default
    private List<Long> failedChatIds = new ArrayList<>();

    private boolean escalated;

    public double failureRate() {
        if (total == 0) {
            return 0.0;
        }
        return (double) failed / total;
    }

    public static DeliveryResult empty() {
        return DeliveryResult.builder().build();
    }
}
