package me.golemcore.chatreport.domain.service;

import me.golemcore.chatreport.domain.model.LlmRequest;
import me.golemcore.chatreport.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisPromptBuilderTest {

    private final AnalysisPromptBuilder builder = new AnalysisPromptBuilder();

    @Test
    void formatsOneLinePerMessageInUtc() {
        List<Message> messages = List.of(
                Message.builder().messageId(10).senderId(1).senderName("Alice")
                        .text("Any update?").sentAt(Instant.parse("2025-01-15T08:05:09Z")).build(),
                Message.builder().messageId(11).senderId(42)
                        .text("Working on it").sentAt(Instant.parse("2025-01-15T08:06:00Z")).build());

        String formatted = builder.formatMessages(messages);

        assertEquals("[2025-01-15 08:05:09] Alice (ID: 10): Any update?\n"
                + "[2025-01-15 08:06:00] User 42 (ID: 11): Working on it", formatted);
    }

    @Test
    void buildEmbedsMessagesAndSettings() {
        List<Message> messages = List.of(Message.builder().messageId(10).senderId(1).senderName("Alice")
                .text("100% done?").sentAt(Instant.parse("2025-01-15T08:05:09Z")).build());

        LlmRequest request = builder.build(messages, 2048, 0.0);

        assertTrue(request.getUserPrompt().contains("Alice (ID: 10): 100% done?"));
        assertTrue(request.getUserPrompt().contains("\"answers_to_message_id\""));
        assertNotNull(request.getSystemPrompt());
        assertEquals(Integer.valueOf(2048), request.getMaxTokens());
        assertEquals(Double.valueOf(0.0), request.getTemperature());
    }
}
