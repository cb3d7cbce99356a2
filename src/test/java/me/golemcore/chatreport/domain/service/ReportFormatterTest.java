package me.golemcore.chatreport.domain.service;

import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.AnalysisSummary;
import me.golemcore.chatreport.domain.model.Chat;
import me.golemcore.chatreport.domain.model.QuestionAnalysis;
import me.golemcore.chatreport.domain.model.QuestionCategory;
import me.golemcore.chatreport.domain.model.ReportTotals;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class ReportFormatterTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);
    private static final Instant ASKED = Instant.parse("2025-01-14T16:30:00Z");

    private ReportFormatter formatter;
    private Chat chat;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        formatter = new ReportFormatter(new ResponseTimeClassifier(), properties);
        chat = Chat.builder().chatId(-100L).name("Partner A").enabled(true).build();
    }

    // ===== Format =====

    @Test
    void formatsAllSections() {
        String document = formatter.format(chat, DATE, sampleResult());

        assertTrue(document.startsWith("<b>📋 Daily Communication Report</b> #IMFReport"));
        assertTrue(document.contains("<b>Chat:</b> Partner A"));
        assertTrue(document.contains("<b>Date:</b> 2025-01-15"));
        assertTrue(document.contains("📊 Total Questions: 3"));
        assertTrue(document.contains("✅ Answered: 2 (66.7%)"));
        assertTrue(document.contains("❌ Unanswered: 1"));
        assertTrue(document.contains("⏱️ Avg Response Time: 2h 30m"));
        assertTrue(document.contains("⚡ Fast (&lt;1h): 1"));
        assertTrue(document.contains("🐌 Slow (4-24h): 1"));
        assertTrue(document.contains("❌ Unanswered: 1\n⏱️"));
        assertTrue(document.contains("1. [💼 Business] <i>2025-01-14 16:30 UTC</i> When is the invoice due?"));
        assertTrue(document.contains("<b>Top Reactions</b>"));
    }

    @Test
    void listsEveryQuestionWithStatus() {
        String document = formatter.format(chat, DATE, sampleResult());

        assertTrue(document.contains("1. ✅ [🔧 Technical] Question 1 <i>(30m)</i>"));
        assertTrue(document.contains("2. ✅ [🔧 Technical] Question 2 <i>(4h 30m)</i>"));
        assertTrue(document.contains("3. ⏳ [💼 Business] When is the invoice due?"));
    }

    @Test
    void sectionsAreSeparatedByBlankLines() {
        String document = formatter.format(chat, DATE, sampleResult());

        assertEquals(6, document.split(ReportFormatter.SECTION_SEPARATOR).length);
    }

    @Test
    void allAnsweredShowsCelebration() {
        AnalysisResult result = AnalysisResult.builder()
                .questions(List.of(answered(1, 10.0)))
                .summary(new AnalysisSummary(1, 1, 0, 10.0))
                .build();

        String document = formatter.format(chat, DATE, result);

        assertTrue(document.contains("✨ All questions have been answered!"));
        assertTrue(document.contains("⏱️ Avg Response Time: 10m"));
    }

    @Test
    void noQuestionsShowsNotApplicable() {
        String document = formatter.format(chat, DATE, AnalysisResult.builder().build());

        assertTrue(document.contains("✅ Answered: 0 (N/A)"));
        assertTrue(document.contains("⏱️ Avg Response Time: N/A"));
        assertTrue(document.contains("No questions identified."));
    }

    @Test
    void escapesUserText() {
        Chat hostile = Chat.builder().chatId(-1L).name("<b>Evil</b> & Co").build();
        AnalysisResult result = AnalysisResult.builder()
                .questions(List.of(QuestionAnalysis.builder()
                        .messageId(1).text("Is <script> allowed?\nsecond line")
                        .category(QuestionCategory.TECHNICAL).answered(false).askedAt(ASKED).build()))
                .summary(new AnalysisSummary(1, 0, 1, null))
                .build();

        String document = formatter.format(hostile, DATE, result);

        assertTrue(document.contains("&lt;b&gt;Evil&lt;/b&gt; &amp; Co"));
        assertTrue(document.contains("Is &lt;script&gt; allowed? second line"));
        assertFalse(document.contains("<script>"));
    }

    @Test
    void usesConfiguredZoneForQuestionTimestamps() {
        BotProperties properties = new BotProperties();
        properties.getReport().setZone("Europe/Berlin");
        ReportFormatter berlin = new ReportFormatter(new ResponseTimeClassifier(), properties);

        String document = berlin.format(chat, DATE, sampleResult());

        assertTrue(document.contains("<i>2025-01-14 17:30 CET</i>"));
    }

    // ===== Split =====

    @Test
    void shortDocumentIsOneChunk() {
        assertEquals(List.of("hello"), formatter.split("hello", 4096));
    }

    @Test
    void splitPrefersSectionBoundaries() {
        String document = "aaaa\nbbbb\n\ncccc";

        List<String> chunks = formatter.split(document, 12);

        assertEquals(List.of("aaaa\nbbbb", "cccc"), chunks);
    }

    @Test
    void splitFallsBackToLineBoundaries() {
        List<String> chunks = formatter.split("aaaa\nbbbb\ncccc", 10);

        assertEquals(List.of("aaaa\nbbbb", "cccc"), chunks);
    }

    @Test
    void splitCutsHardWhenNoBoundary() {
        List<String> chunks = formatter.split("abcdefghij", 4);

        assertEquals(List.of("abcd", "efgh", "ij"), chunks);
    }

    @Test
    void hardCutNeverSplitsAnEntity() {
        assertEquals(List.of("a", "&amp;", "b&lt;", "c"), formatter.split("a&amp;b&lt;c", 5));
    }

    @Test
    void wordCutKeepsInlineTagsTogether() {
        List<String> chunks = formatter.split("word <i>(2h 30m)</i> end", 16);

        assertEquals(List.of("word", "<i>(2h 30m)</i>", "end"), chunks);
    }

    @Test
    void hardCutDoesNotSplitSurrogatePair() {
        List<String> chunks = formatter.split("abc😀def", 4);

        assertEquals("abc", chunks.get(0));
        assertEquals("abc😀def", String.join("", chunks));
    }

    @Test
    void overlongQuestionIsTruncated() {
        QuestionAnalysis question = QuestionAnalysis.builder().messageId(1).text("Q & A ".repeat(1200))
                .category(QuestionCategory.OTHER).answered(false).askedAt(ASKED).build();
        AnalysisResult result = AnalysisResult.builder()
                .questions(List.of(question))
                .summary(new AnalysisSummary(1, 0, 1, null))
                .build();

        String document = formatter.format(chat, DATE, result);

        document.lines()
                .filter(line -> line.contains("Q &amp; A"))
                .forEach(line -> {
                    assertTrue(line.endsWith("…"));
                    assertTrue(line.length() < 4096);
                });
        formatter.split(document, 4096).forEach(ReportFormatterTest::assertWellFormed);
    }

    @Test
    void chunksOfEscapedLinesStayWellFormed() {
        List<QuestionAnalysis> questions = LongStream.rangeClosed(1, 6)
                .mapToObj(id -> QuestionAnalysis.builder().messageId(id).text("Q & A <x> ".repeat(60))
                        .category(QuestionCategory.TECHNICAL).answered(true).responseTimeMinutes(150.0)
                        .askedAt(ASKED).build())
                .toList();
        AnalysisResult result = AnalysisResult.builder()
                .questions(questions)
                .summary(new AnalysisSummary(6, 6, 0, 150.0))
                .build();

        List<String> chunks = formatter.split(formatter.format(chat, DATE, result), 97);

        assertTrue(chunks.size() > 10);
        chunks.forEach(chunk -> {
            assertTrue(chunk.length() <= 97);
            assertWellFormed(chunk);
        });
    }

    @Test
    void everyChunkRespectsLimitForLongReport() {
        AnalysisResult result = AnalysisResult.builder()
                .questions(LongStream.rangeClosed(1, 200)
                        .mapToObj(id -> QuestionAnalysis.builder().messageId(id)
                                .text("Question number " + id + " about the deployment pipeline?")
                                .category(QuestionCategory.TECHNICAL).answered(false).askedAt(ASKED).build())
                        .toList())
                .summary(new AnalysisSummary(200, 0, 200, null))
                .build();
        String document = formatter.format(chat, DATE, result);

        List<String> chunks = formatter.split(document, 4096);

        assertTrue(chunks.size() > 1);
        chunks.forEach(chunk -> assertTrue(chunk.length() <= 4096));
        assertTrue(chunks.get(0).startsWith("<b>📋 Daily Communication Report</b>"));
    }

    @Test
    void splitRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> formatter.split("x", 0));
    }

    // ===== Summary =====

    @Test
    void parseSummaryReadsBackFormattedCounts() {
        String document = formatter.format(chat, DATE, sampleResult());

        assertEquals(new ReportTotals(3, 2, 1), formatter.parseSummary(document));
    }

    @Test
    void parseSummaryRejectsForeignText() {
        assertThrows(IllegalArgumentException.class, () -> formatter.parseSummary("hello"));
    }

    @Test
    void formatDurationVariants() {
        assertEquals("45m", ReportFormatter.formatDuration(45.7));
        assertEquals("2h", ReportFormatter.formatDuration(120));
        assertEquals("2h 30m", ReportFormatter.formatDuration(150));
    }

    private static void assertWellFormed(String chunk) {
        assertFalse(Pattern.compile("&(?!(amp|lt|gt);)").matcher(chunk).find(), chunk);
        assertFalse(Pattern.compile("<[^>]*$").matcher(chunk).find(), chunk);
        for (String tag : List.of("b", "i")) {
            assertEquals(chunk.split("<" + tag + ">", -1).length, chunk.split("</" + tag + ">", -1).length, chunk);
        }
        assertFalse(Character.isHighSurrogate(chunk.charAt(chunk.length() - 1)), chunk);
    }

    private static AnalysisResult sampleResult() {
        QuestionAnalysis unanswered = QuestionAnalysis.builder()
                .messageId(3).text("When is the invoice due?").category(QuestionCategory.BUSINESS)
                .answered(false).askedAt(ASKED).build();
        return AnalysisResult.builder()
                .questions(List.of(answered(1, 30.0), answered(2, 270.0), unanswered))
                .summary(new AnalysisSummary(3, 2, 1, 150.0))
                .build();
    }

    private static QuestionAnalysis answered(long id, double minutes) {
        return QuestionAnalysis.builder()
                .messageId(id).text("Question " + id).category(QuestionCategory.TECHNICAL)
                .answered(true).answerMessageId(id + 100).responseTimeMinutes(minutes).askedAt(ASKED)
                .build();
    }
}
