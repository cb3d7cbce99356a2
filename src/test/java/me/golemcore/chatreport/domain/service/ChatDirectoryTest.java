package me.golemcore.chatreport.domain.service;

import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.Chat;
import me.golemcore.chatreport.infrastructure.config.AutoConfiguration;
import me.golemcore.chatreport.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatDirectoryTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private InMemoryStoragePort storagePort;
    private ChatDirectory directory;

    @BeforeEach
    void setUp() {
        storagePort = new InMemoryStoragePort();
        directory = newDirectory();
    }

    @Test
    void addChatEnablesAndPersists() {
        Chat chat = directory.addOrUpdateChat(-100L, "Partner A");

        assertTrue(chat.isEnabled());
        assertEquals("Partner A", chat.getName());
        assertEquals(NOW, chat.getCreatedAt());
        assertTrue(directory.isEnabled(-100L));
        assertTrue(newDirectory().isEnabled(-100L));
    }

    @Test
    void addChatWithoutNameUsesDefault() {
        assertEquals("Chat -100", directory.addOrUpdateChat(-100L, null).getName());
    }

    @Test
    void disableThenReAddKeepsNameWhenBlank() {
        directory.addOrUpdateChat(-100L, "Partner A");

        assertTrue(directory.disableChat(-100L));
        assertFalse(directory.isEnabled(-100L));
        assertTrue(directory.getEnabledChats().isEmpty());
        assertEquals(1, directory.listChats().size());

        Chat readded = directory.addOrUpdateChat(-100L, " ");
        assertTrue(readded.isEnabled());
        assertEquals("Partner A", readded.getName());
        assertEquals(1, directory.listChats().size());
    }

    @Test
    void disableUnknownChatReturnsFalse() {
        assertFalse(directory.disableChat(-999L));
    }

    @Test
    void enabledChatsKeepInsertionOrder() {
        directory.addOrUpdateChat(-3L, "C");
        directory.addOrUpdateChat(-1L, "A");
        directory.addOrUpdateChat(-2L, "B");
        directory.disableChat(-1L);

        List<Long> ids = directory.getEnabledChats().stream().map(Chat::getChatId).toList();

        assertEquals(List.of(-3L, -2L), ids);
    }

    @Test
    void markReportSentUpdatesChat() {
        directory.addOrUpdateChat(-100L, "Partner A");
        Instant sentAt = NOW.plusSeconds(60);

        directory.markReportSent(-100L, sentAt);

        assertEquals(sentAt, directory.findChat(-100L).orElseThrow().getLastReportSentAt());
    }

    @Test
    void returnedChatsAreCopies() {
        directory.addOrUpdateChat(-100L, "Partner A");

        directory.findChat(-100L).orElseThrow().setEnabled(false);

        assertTrue(directory.isEnabled(-100L));
    }

    @Test
    void unknownChatIsNotEnabled() {
        assertFalse(directory.isEnabled(-100L));
        assertTrue(directory.findChat(-100L).isEmpty());
    }

    @Test
    void corruptFileRaisesStorageException() {
        storagePort.write("chats", "chats.json", "{not json");

        assertThrows(StorageException.class, () -> newDirectory().getEnabledChats());
    }

    private ChatDirectory newDirectory() {
        return new ChatDirectory(storagePort, AutoConfiguration.objectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
