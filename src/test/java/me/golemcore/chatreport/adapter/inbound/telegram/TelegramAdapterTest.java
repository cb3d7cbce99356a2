package me.golemcore.chatreport.adapter.inbound.telegram;

import me.golemcore.chatreport.domain.exception.DeliveryException;
import me.golemcore.chatreport.domain.exception.DuplicateMessageException;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.service.ChatDirectory;
import me.golemcore.chatreport.domain.service.MessageStore;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.ResponseParameters;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TelegramAdapterTest {

    private static final long CHAT_ID = -1001234L;
    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private MessageStore messageStore;
    private ChatDirectory chatDirectory;
    private CommandPort commandPort;
    private TelegramClient telegramClient;
    private TelegramAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getTelegram().setToken("test-token");
        messageStore = mock(MessageStore.class);
        chatDirectory = mock(ChatDirectory.class);
        commandPort = mock(CommandPort.class);
        ObjectProvider<CommandPort> commandProvider = mock(ObjectProvider.class);
        when(commandProvider.getIfAvailable()).thenReturn(commandPort);
        telegramClient = mock(TelegramClient.class);

        adapter = new TelegramAdapter(properties, mock(TelegramBotsLongPollingApplication.class),
                messageStore, chatDirectory, commandProvider, Clock.fixed(NOW, ZoneOffset.UTC));
        adapter.setTelegramClient(telegramClient);
    }

    private Update textUpdate(long chatId, int messageId, String text) {
        Update update = mock(Update.class);
        org.telegram.telegrambots.meta.api.objects.message.Message message = mock(
                org.telegram.telegrambots.meta.api.objects.message.Message.class);
        User user = mock(User.class);
        Chat chat = mock(Chat.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getMessageId()).thenReturn(messageId);
        when(message.getDate()).thenReturn((int) Instant.parse("2025-03-10T09:30:00Z").getEpochSecond());
        when(message.getFrom()).thenReturn(user);
        when(message.getChat()).thenReturn(chat);
        when(user.getId()).thenReturn(42L);
        when(user.getUserName()).thenReturn("alice");
        when(chat.getTitle()).thenReturn("Partner A");
        return update;
    }

    private TelegramApiRequestException requestException(Integer code, ResponseParameters parameters) {
        TelegramApiRequestException ex = mock(TelegramApiRequestException.class);
        when(ex.getErrorCode()).thenReturn(code);
        when(ex.getParameters()).thenReturn(parameters);
        when(ex.getApiResponse()).thenReturn("error");
        return ex;
    }

    // ===== Ingestion =====

    @Test
    void storesTextMessageFromEnabledChat() {
        when(chatDirectory.isEnabled(CHAT_ID)).thenReturn(true);

        adapter.consume(textUpdate(CHAT_ID, 501, "How do I reset my password?"));

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(messageStore).append(captor.capture());
        Message stored = captor.getValue();
        assertEquals(CHAT_ID, stored.getChatId());
        assertEquals(501L, stored.getMessageId());
        assertEquals(42L, stored.getSenderId());
        assertEquals("alice", stored.getSenderName());
        assertEquals("How do I reset my password?", stored.getText());
        assertEquals(Instant.parse("2025-03-10T09:30:00Z"), stored.getSentAt());
        assertEquals(NOW, stored.getCreatedAt());
    }

    @Test
    void ignoresMessageFromUnmonitoredChat() {
        when(chatDirectory.isEnabled(CHAT_ID)).thenReturn(false);

        adapter.consume(textUpdate(CHAT_ID, 501, "hello"));

        verify(messageStore, never()).append(any());
    }

    @Test
    void duplicateMessageIsIgnored() {
        when(chatDirectory.isEnabled(CHAT_ID)).thenReturn(true);
        doThrow(new DuplicateMessageException(CHAT_ID, 501L)).when(messageStore).append(any());

        assertDoesNotThrow(() -> adapter.consume(textUpdate(CHAT_ID, 501, "hello")));
    }

    @Test
    void ignoresUpdatesWithoutText() {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(false);

        adapter.consume(update);

        verifyNoInteractions(messageStore, chatDirectory);
    }

    // ===== Commands =====

    @Test
    void routesCommandAndRepliesInSameChat() throws Exception {
        when(commandPort.hasCommand("add_chat")).thenReturn(true);
        when(commandPort.execute(eq("add_chat"), anyList(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(CommandPort.CommandResult.success("added")));

        adapter.consume(textUpdate(CHAT_ID, 600, "/add_chat@report_bot -100555 Partner B"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> ctxCaptor = ArgumentCaptor.forClass(Map.class);
        verify(commandPort).execute(eq("add_chat"), eq(List.of("-100555", "Partner", "B")), ctxCaptor.capture());
        assertEquals(String.valueOf(CHAT_ID), ctxCaptor.getValue().get("chatId"));
        assertEquals("42", ctxCaptor.getValue().get("senderId"));
        assertEquals("Partner A", ctxCaptor.getValue().get("chatTitle"));

        ArgumentCaptor<SendMessage> sendCaptor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, timeout(2000)).execute(sendCaptor.capture());
        assertEquals(String.valueOf(CHAT_ID), sendCaptor.getValue().getChatId());
        assertEquals("added", sendCaptor.getValue().getText());
        verify(messageStore, never()).append(any());
    }

    @Test
    void unknownCommandIsNotStoredOrAnswered() throws Exception {
        when(commandPort.hasCommand(anyString())).thenReturn(false);

        adapter.consume(textUpdate(CHAT_ID, 601, "/start"));

        verify(commandPort, never()).execute(anyString(), anyList(), anyMap());
        verify(messageStore, never()).append(any());
        verify(telegramClient, after(200).never()).execute(any(SendMessage.class));
    }

    // ===== Sending =====

    @Test
    void sendsHtmlMessage() throws Exception {
        adapter.sendMessage("-100", "<b>Report</b>").join();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("-100", captor.getValue().getChatId());
        assertEquals("HTML", captor.getValue().getParseMode());
        assertEquals("<b>Report</b>", captor.getValue().getText());
    }

    @Test
    void sendFailsPermanentlyWithoutClient() {
        adapter.setTelegramClient(null);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.sendMessage("-100", "text").join());

        DeliveryException cause = assertInstanceOf(DeliveryException.class, ex.getCause());
        assertFalse(cause.isRetryable());
    }

    @Test
    void networkFailureIsRetryable() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("timeout"));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.sendMessage("-100", "text").join());

        DeliveryException cause = assertInstanceOf(DeliveryException.class, ex.getCause());
        assertTrue(cause.isRetryable());
    }

    @Test
    void requestFailureIsMappedThroughErrorCode() throws Exception {
        TelegramApiRequestException forbidden = requestException(403, null);
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(forbidden);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.sendMessage("-100", "text").join());

        DeliveryException cause = assertInstanceOf(DeliveryException.class, ex.getCause());
        assertFalse(cause.isRetryable());
        assertSame(forbidden, cause.getCause());
    }

    // ===== Error mapping =====

    @Test
    void tooManyRequestsCarriesRetryAfter() {
        DeliveryException ex = adapter.toDeliveryException("-100",
                requestException(429, new ResponseParameters(null, 9)));

        assertTrue(ex.isRetryable());
        assertEquals(Duration.ofSeconds(9), ex.getRetryAfter().orElseThrow());
    }

    @Test
    void tooManyRequestsWithoutParametersHasNoHint() {
        DeliveryException ex = adapter.toDeliveryException("-100", requestException(429, null));

        assertTrue(ex.isRetryable());
        assertTrue(ex.getRetryAfter().isEmpty());
    }

    @Test
    void serverErrorIsRetryable() {
        DeliveryException ex = adapter.toDeliveryException("-100", requestException(502, null));

        assertTrue(ex.isRetryable());
    }

    @Test
    void missingErrorCodeIsRetryable() {
        DeliveryException ex = adapter.toDeliveryException("-100", requestException(null, null));

        assertTrue(ex.isRetryable());
    }

    @Test
    void chatNotFoundIsPermanent() {
        DeliveryException ex = adapter.toDeliveryException("-100", requestException(400, null));

        assertFalse(ex.isRetryable());
        assertTrue(ex.getMessage().contains("-100"));
    }

    @Test
    void reportsTelegramChannelType() {
        assertEquals("telegram", adapter.getChannelType());
        assertFalse(adapter.isRunning());
    }
}
