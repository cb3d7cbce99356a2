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

import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.AnalysisSummary;
import me.golemcore.chatreport.domain.model.Chat;
import me.golemcore.chatreport.domain.model.QuestionAnalysis;
import me.golemcore.chatreport.domain.model.ReportTotals;
import me.golemcore.chatreport.domain.model.ResponseTimeBucket;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders an {@link AnalysisResult} as a Telegram HTML document.
 *
 * <p>
 * Sections, in order: header, summary, response time breakdown, all
 * questions, unanswered questions, reactions. Sections are separated by a
 * blank line and never contain one, so {@link #split(String, int)} can cut
 * between them. Question text is cut to {@value #MAX_QUESTION_TEXT}
 * characters so a single line stays well below a Telegram message.
 */
@Component
public class ReportFormatter {

    static final String SECTION_SEPARATOR = "\n\n";
    static final int MAX_QUESTION_TEXT = 500;

    private static final String TOTAL_LABEL = "📊 Total Questions: ";
    private static final String ANSWERED_LABEL = "✅ Answered: ";
    private static final String UNANSWERED_LABEL = "❌ Unanswered: ";

    private static final List<String> INLINE_TAGS = List.of("b", "i", "code");

    private static final Pattern TOTAL_PATTERN = Pattern.compile("^" + Pattern.quote(TOTAL_LABEL) + "(\\d+)",
            Pattern.MULTILINE);
    private static final Pattern ANSWERED_PATTERN = Pattern.compile("^" + Pattern.quote(ANSWERED_LABEL) + "(\\d+)",
            Pattern.MULTILINE);
    private static final Pattern UNANSWERED_PATTERN = Pattern.compile(
            "^" + Pattern.quote(UNANSWERED_LABEL) + "(\\d+)", Pattern.MULTILINE);

    private final ResponseTimeClassifier classifier;
    private final BotProperties properties;

    public ReportFormatter(ResponseTimeClassifier classifier, BotProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
    }

    public String format(Chat chat, LocalDate reportDate, AnalysisResult result) {
        List<String> sections = List.of(
                formatHeader(chat, reportDate),
                formatSummary(result.getSummary()),
                formatBreakdown(result),
                formatQuestions(result),
                formatUnanswered(result),
                formatReactions());
        return String.join(SECTION_SEPARATOR, sections);
    }

    /**
     * Split a document into chunks of at most {@code maxLength} characters,
     * preferring section boundaries, then line boundaries.
     */
    public List<String> split(String document, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        if (document.length() <= maxLength) {
            return List.of(document);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < document.length()) {
            if (start + maxLength >= document.length()) {
                chunks.add(document.substring(start));
                break;
            }

            String segment = document.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf(SECTION_SEPARATOR);
            if (splitAt > 0) {
                chunks.add(document.substring(start, start + splitAt));
                start += splitAt + SECTION_SEPARATOR.length();
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > 0) {
                chunks.add(document.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            splitAt = segment.lastIndexOf(' ');
            if (splitAt > 0) {
                splitAt = safeCut(segment, splitAt);
                String chunk = document.substring(start, start + splitAt).stripTrailing();
                if (!chunk.isEmpty()) {
                    chunks.add(chunk);
                }
                start += splitAt;
                while (start < document.length() && document.charAt(start) == ' ') {
                    start++;
                }
                continue;
            }

            splitAt = safeCut(segment, maxLength);
            chunks.add(document.substring(start, start + splitAt));
            start += splitAt;
        }
        return chunks;
    }

    /**
     * Move a cut point left so it does not fall inside an entity, a tag, an
     * open inline element or a surrogate pair. Returns {@code cut} unchanged
     * when no earlier safe point exists.
     */
    static int safeCut(String segment, int cut) {
        int safe = cut;
        boolean moved = true;
        while (moved && safe > 0) {
            moved = false;
            String head = segment.substring(0, safe);
            int candidate = safe;
            int amp = head.lastIndexOf('&');
            if (amp >= 0 && head.indexOf(';', amp) < 0) {
                candidate = Math.min(candidate, amp);
            }
            int lt = head.lastIndexOf('<');
            if (lt >= 0 && head.indexOf('>', lt) < 0) {
                candidate = Math.min(candidate, lt);
            }
            for (String tag : INLINE_TAGS) {
                int open = head.lastIndexOf("<" + tag + ">");
                if (open >= 0 && open > head.lastIndexOf("</" + tag + ">")) {
                    candidate = Math.min(candidate, open);
                }
            }
            if (candidate > 0 && Character.isHighSurrogate(segment.charAt(candidate - 1))) {
                candidate--;
            }
            if (candidate < safe) {
                safe = candidate;
                moved = true;
            }
        }
        return safe > 0 ? safe : cut;
    }

    /**
     * Read the totals back from a document produced by {@link #format}.
     *
     * @throws IllegalArgumentException
     *             if the summary section is missing
     */
    public ReportTotals parseSummary(String document) {
        return new ReportTotals(
                readCount(TOTAL_PATTERN, document, "total"),
                readCount(ANSWERED_PATTERN, document, "answered"),
                readCount(UNANSWERED_PATTERN, document, "unanswered"));
    }

    private String formatHeader(Chat chat, LocalDate reportDate) {
        return "<b>📋 Daily Communication Report</b> " + escape(properties.getReport().getTag()) + "\n"
                + "<b>Chat:</b> " + escape(singleLine(chat.getName())) + "\n"
                + "<b>Date:</b> " + reportDate;
    }

    private String formatSummary(AnalysisSummary summary) {
        String answerRate = summary.getTotalQuestions() > 0
                ? String.format(Locale.ROOT, "%.1f%%", summary.getAnswered() * 100.0 / summary.getTotalQuestions())
                : "N/A";
        String avgTime = summary.getAvgResponseTimeMinutes() != null
                ? formatDuration(summary.getAvgResponseTimeMinutes())
                : "N/A";
        return "<b>Summary</b>\n"
                + TOTAL_LABEL + summary.getTotalQuestions() + "\n"
                + ANSWERED_LABEL + summary.getAnswered() + " (" + answerRate + ")\n"
                + UNANSWERED_LABEL + summary.getUnanswered() + "\n"
                + "⏱️ Avg Response Time: " + avgTime;
    }

    private String formatBreakdown(AnalysisResult result) {
        Map<ResponseTimeBucket, Integer> counts = new EnumMap<>(ResponseTimeBucket.class);
        for (ResponseTimeBucket bucket : ResponseTimeBucket.values()) {
            counts.put(bucket, 0);
        }
        for (QuestionAnalysis question : result.getQuestions()) {
            ResponseTimeBucket bucket = question.isAnswered()
                    ? classifier.classify(question.getResponseTimeMinutes())
                    : ResponseTimeBucket.UNANSWERED;
            counts.merge(bucket, 1, Integer::sum);
        }

        StringBuilder sb = new StringBuilder("<b>Response Time Breakdown</b>");
        for (ResponseTimeBucket bucket : ResponseTimeBucket.values()) {
            sb.append('\n').append(bucket.getIcon()).append(' ').append(escape(bucket.getLabel()))
                    .append(": ").append(counts.get(bucket));
        }
        return sb.toString();
    }

    private String formatQuestions(AnalysisResult result) {
        if (result.getQuestions().isEmpty()) {
            return "<b>Questions</b>\nNo questions identified.";
        }
        StringBuilder sb = new StringBuilder("<b>Questions</b>");
        int index = 1;
        for (QuestionAnalysis question : result.getQuestions()) {
            sb.append('\n').append(index++).append(". ")
                    .append(question.isAnswered() ? "✅" : "⏳")
                    .append(" [").append(question.getCategory().getBadge()).append("] ")
                    .append(escape(truncate(singleLine(question.getText()))));
            if (question.isAnswered() && question.getResponseTimeMinutes() != null) {
                sb.append(" <i>(").append(formatDuration(question.getResponseTimeMinutes())).append(")</i>");
            }
        }
        return sb.toString();
    }

    private String formatUnanswered(AnalysisResult result) {
        List<QuestionAnalysis> unanswered = result.getUnansweredQuestions();
        if (unanswered.isEmpty()) {
            return "<b>Unanswered Questions</b>\n✨ All questions have been answered!";
        }

        DateTimeFormatter timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ROOT)
                .withZone(ZoneId.of(properties.getReport().getZone()));
        StringBuilder sb = new StringBuilder("<b>Unanswered Questions</b>");
        int index = 1;
        for (QuestionAnalysis question : unanswered) {
            sb.append('\n').append(index++).append(". [").append(question.getCategory().getBadge()).append("] ");
            if (question.getAskedAt() != null) {
                sb.append("<i>").append(timestampFormat.format(question.getAskedAt())).append("</i> ");
            }
            sb.append(escape(truncate(singleLine(question.getText()))));
        }
        return sb.toString();
    }

    private String formatReactions() {
        return "<b>Top Reactions</b>\n<i>Reaction tracking coming soon</i>";
    }

    /**
     * Minutes as {@code 45m}, {@code 2h} or {@code 2h 30m}.
     */
    static String formatDuration(double minutes) {
        if (minutes < 60) {
            return (int) minutes + "m";
        }
        int hours = (int) (minutes / 60);
        int mins = (int) (minutes % 60);
        if (mins == 0) {
            return hours + "h";
        }
        return hours + "h " + mins + "m";
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private static String singleLine(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s*\\R\\s*", " ").trim();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_QUESTION_TEXT) {
            return text;
        }
        int end = MAX_QUESTION_TEXT;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end).stripTrailing() + "…";
    }

    private static int readCount(Pattern pattern, String document, String field) {
        Matcher matcher = pattern.matcher(document);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Report has no '" + field + "' line");
        }
        return Integer.parseInt(matcher.group(1));
    }
}
