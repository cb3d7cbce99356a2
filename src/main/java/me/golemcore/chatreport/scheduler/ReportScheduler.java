package me.golemcore.chatreport.scheduler;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.model.PipelineRunSummary;
import me.golemcore.chatreport.domain.pipeline.ReportPipeline;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Triggers the daily report run and the retention sweep.
 *
 * <p>
 * A single daemon thread ticks every {@code bot.schedule.tick-interval}. Each
 * job has a daily cron trigger in {@code bot.report.zone}; a job fires on the
 * first tick at or after its due time. If that tick comes later than the due
 * time plus {@code bot.schedule.jitter-tolerance} (host suspended, clock
 * jump, long previous job), the occurrence is logged as missed and skipped.
 */
@Component
@Slf4j
public class ReportScheduler {

    static final String REPORT_JOB = "daily-report";
    static final String CLEANUP_JOB = "retention-cleanup";

    private final ReportPipeline reportPipeline;
    private final BotProperties properties;
    private final Clock clock;

    private final List<ScheduledJob> jobs;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private volatile boolean running;

    public ReportScheduler(ReportPipeline reportPipeline, BotProperties properties, Clock clock) {
        this.reportPipeline = reportPipeline;
        this.properties = properties;
        this.clock = clock;
        this.jobs = List.of(
                new ScheduledJob(REPORT_JOB,
                        dailyCron(properties.getReport().getHour(), properties.getReport().getMinute()),
                        this::runReport),
                new ScheduledJob(CLEANUP_JOB,
                        dailyCron(properties.getRetention().getHour(), properties.getRetention().getMinute()),
                        this::runCleanup));
    }

    @PostConstruct
    public void init() {
        if (!properties.getSchedule().isEnabled()) {
            log.info("[Scheduler] Scheduling disabled");
            return;
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        computeNextRuns();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "report-scheduler");
            t.setDaemon(true);
            return t;
        });

        long tickMillis = properties.getSchedule().getTickInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        running = true;

        log.info("[Scheduler] Started with tick interval {}ms, next report at {}, next cleanup at {}",
                tickMillis, nextRun(REPORT_JOB).orElse(null), nextRun(CLEANUP_JOB).orElse(null));
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        reportPipeline.cancel();
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] Shut down");
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<Instant> getNextReportRun() {
        return nextRun(REPORT_JOB);
    }

    public Optional<Instant> getNextCleanupRun() {
        return nextRun(CLEANUP_JOB);
    }

    void tick() {
        try {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone()));
            Duration tolerance = properties.getSchedule().getJitterTolerance();
            for (ScheduledJob job : jobs) {
                ZonedDateTime due = job.nextRun;
                if (due == null) {
                    job.nextRun = job.cron.next(now);
                    continue;
                }
                if (now.isBefore(due)) {
                    continue;
                }
                job.nextRun = job.cron.next(now);
                if (now.isAfter(due.plus(tolerance))) {
                    log.warn("[Scheduler] Missed {} due at {} (now {}), skipping until {}",
                            job.name, due, now, job.nextRun);
                    continue;
                }
                log.info("[Scheduler] Running {} (due at {})", job.name, due);
                job.action.run();
            }
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed: {}", e.getMessage(), e);
        }
    }

    void computeNextRuns() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone()));
        for (ScheduledJob job : jobs) {
            job.nextRun = job.cron.next(now);
        }
    }

    private void runReport() {
        PipelineRunSummary summary = reportPipeline.run();
        log.info("[Scheduler] Report run finished with state {}", summary.getState());
    }

    private void runCleanup() {
        int deleted = reportPipeline.runCleanup();
        log.info("[Scheduler] Cleanup finished, deleted {}", deleted);
    }

    private Optional<Instant> nextRun(String name) {
        return jobs.stream()
                .filter(job -> job.name.equals(name))
                .map(job -> job.nextRun)
                .filter(next -> next != null)
                .map(ZonedDateTime::toInstant)
                .findFirst();
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getReport().getZone());
    }

    private static CronExpression dailyCron(int hour, int minute) {
        return CronExpression.parse("0 " + minute + " " + hour + " * * *");
    }

    private static final class ScheduledJob {
        private final String name;
        private final CronExpression cron;
        private final Runnable action;
        private volatile ZonedDateTime nextRun;

        private ScheduledJob(String name, CronExpression cron, Runnable action) {
            this.name = name;
            this.cron = cron;
            this.action = action;
        }
    }
}
