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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.Report;
import me.golemcore.chatreport.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Persisted reports, one file per chat and date in
 * {@code reports/<chatId>/<yyyy-MM-dd>.json}. Saving the same chat and date
 * again replaces the earlier report.
 */
@Service
@Slf4j
public class ReportStore {

    private static final String REPORTS_DIR = "reports";
    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public ReportStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    public void save(Report report) {
        if (report.getReportDate() == null) {
            throw new IllegalArgumentException("Report date is required");
        }
        if (report.getId() == null) {
            report.setId(report.getChatId() + ":" + report.getReportDate());
        }
        try {
            String json = objectMapper.writeValueAsString(report);
            StorageFutures.join(storagePort.putTextAtomic(REPORTS_DIR, path(report.getChatId(), report.getReportDate()),
                    json, false));
            log.debug("[Reports] Saved report {}", report.getId());
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize report " + report.getId(), e);
        }
    }

    public Optional<Report> findByChatAndDate(long chatId, LocalDate date) {
        return read(path(chatId, date));
    }

    /**
     * Most recent reports of a chat, newest first.
     */
    public List<Report> findRecent(long chatId, int limit) {
        List<String> files = StorageFutures.join(storagePort.listObjects(REPORTS_DIR, String.valueOf(chatId)));
        List<Report> reports = new ArrayList<>();
        files.stream()
                .filter(f -> f.endsWith(FILE_SUFFIX))
                .sorted(Comparator.reverseOrder())
                .limit(Math.max(limit, 0))
                .forEach(f -> read(f).ifPresent(reports::add));
        return reports;
    }

    public Report markSent(Report report, Instant sentAt) {
        report.setSentAt(sentAt);
        save(report);
        return report;
    }

    private Optional<Report> read(String path) {
        String json = StorageFutures.join(storagePort.getText(REPORTS_DIR, path));
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Report.class));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to parse report " + path, e);
        }
    }

    private static String path(long chatId, LocalDate date) {
        return chatId + "/" + date + FILE_SUFFIX;
    }
}
