package me.golemcore.chatreport.adapter.inbound.command;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.Chat;
import me.golemcore.chatreport.domain.service.ChatDirectory;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes admin slash commands that manage the chat whitelist.
 *
 * <ul>
 * <li>/add_chat &lt;chat_id&gt; [name] - enable monitoring of a chat
 * <li>/remove_chat &lt;chat_id&gt; - disable monitoring, data is kept
 * <li>/list_chats - list monitored chats
 * <li>/get_chat_id - show the id of the current chat (open to everyone)
 * <li>/admin - command help
 * </ul>
 *
 * <p>
 * All commands except /get_chat_id require the sender to be listed in
 * {@code bot.telegram.admin-user-ids}. Outputs are Telegram HTML.
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_ADD_CHAT = "add_chat";
    private static final String CMD_REMOVE_CHAT = "remove_chat";
    private static final String CMD_LIST_CHATS = "list_chats";
    private static final String CMD_GET_CHAT_ID = "get_chat_id";
    private static final String CMD_ADMIN = "admin";
    private static final DateTimeFormatter CREATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_ADD_CHAT, "Add a chat to the whitelist", "/add_chat <chat_id> [name]", true),
            new CommandDefinition(CMD_REMOVE_CHAT, "Disable a whitelisted chat", "/remove_chat <chat_id>", true),
            new CommandDefinition(CMD_LIST_CHATS, "List whitelisted chats", "/list_chats", true),
            new CommandDefinition(CMD_GET_CHAT_ID, "Show the current chat ID", "/get_chat_id", false),
            new CommandDefinition(CMD_ADMIN, "Show admin commands", "/admin", true));

    private final ChatDirectory chatDirectory;
    private final BotProperties properties;

    public CommandRouter(ChatDirectory chatDirectory, BotProperties properties) {
        this.chatDirectory = chatDirectory;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            String senderId = contextString(context, "senderId");
            if (!hasCommand(command)) {
                return CommandResult.failure("Unknown command: /" + command);
            }
            if (isAdminOnly(command) && !isAdmin(senderId)) {
                log.warn("[Commands] Unauthorized /{} from user {}", command, senderId);
                return CommandResult.failure("⛔ This command is available to administrators only.");
            }

            log.debug("[Commands] Executing /{} for user {}", command, senderId);
            try {
                return switch (command) {
                case CMD_ADD_CHAT -> handleAddChat(args, context);
                case CMD_REMOVE_CHAT -> handleRemoveChat(args);
                case CMD_LIST_CHATS -> handleListChats();
                case CMD_GET_CHAT_ID -> handleGetChatId(context);
                case CMD_ADMIN -> handleHelp();
                default -> CommandResult.failure("Unknown command: /" + command);
                };
            } catch (StorageException e) {
                log.error("[Commands] /{} failed", command, e);
                return CommandResult.failure("❌ Storage error: " + escape(e.getMessage()));
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return COMMANDS.stream().anyMatch(def -> def.name().equals(command));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    boolean isAdmin(String senderId) {
        return senderId != null && !senderId.isBlank()
                && properties.getTelegram().getAdminUserIds().contains(senderId);
    }

    private boolean isAdminOnly(String command) {
        return COMMANDS.stream()
                .filter(def -> def.name().equals(command))
                .findFirst()
                .map(CommandDefinition::adminOnly)
                .orElse(true);
    }

    private CommandResult handleAddChat(List<String> args, Map<String, Object> context) {
        if (args.isEmpty()) {
            return CommandResult.failure("❌ Usage: /add_chat &lt;chat_id&gt; [name]\n\n"
                    + "Use /get_chat_id in the target chat to find its ID.");
        }
        Long chatId = parseChatId(args.get(0));
        if (chatId == null) {
            return invalidChatId(args.get(0));
        }

        String name = args.size() > 1 ? String.join(" ", args.subList(1, args.size())) : null;
        if (name == null && args.get(0).equals(contextString(context, "chatId"))) {
            name = contextString(context, "chatTitle");
        }
        if (name != null) {
            name = stripQuotes(name);
        }

        boolean existed = chatDirectory.findChat(chatId).isPresent();
        Chat chat = chatDirectory.addOrUpdateChat(chatId, name);
        log.info("[Commands] Chat {} {} by admin", chatId, existed ? "updated" : "added");

        StringBuilder sb = new StringBuilder(existed ? "✅ Chat updated in whitelist:" : "✅ Chat added to whitelist:")
                .append("\n\n")
                .append("Chat ID: <code>").append(chat.getChatId()).append("</code>\n")
                .append("Name: ").append(escape(chat.getName())).append('\n')
                .append("Status: Enabled");
        if (chatId > 0) {
            sb.append("\n\n⚠️ Group and channel IDs are usually negative. Verify with /get_chat_id.");
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleRemoveChat(List<String> args) {
        if (args.size() != 1) {
            return CommandResult.failure("❌ Usage: /remove_chat &lt;chat_id&gt;\n\n"
                    + "Use /list_chats to see chat IDs.");
        }
        Long chatId = parseChatId(args.get(0));
        if (chatId == null) {
            return invalidChatId(args.get(0));
        }
        if (!chatDirectory.disableChat(chatId)) {
            return CommandResult.failure("❌ Chat not found: <code>" + chatId + "</code>");
        }
        String name = chatDirectory.findChat(chatId).map(Chat::getName).orElse("");
        log.info("[Commands] Chat {} disabled by admin", chatId);
        return CommandResult.success("✅ Chat removed from whitelist:\n\n"
                + "Chat ID: <code>" + chatId + "</code>\n"
                + "Name: " + escape(name) + "\n"
                + "Status: Disabled");
    }

    private CommandResult handleListChats() {
        List<Chat> chats = chatDirectory.getEnabledChats();
        if (chats.isEmpty()) {
            return CommandResult.success("📭 No whitelisted chats.\n\nUse /add_chat to add one.");
        }
        StringBuilder sb = new StringBuilder("📋 <b>Whitelisted Chats</b>\n");
        for (Chat chat : chats) {
            sb.append("\n• <b>").append(escape(chat.getName())).append("</b>\n")
                    .append("  ID: <code>").append(chat.getChatId()).append("</code>\n");
            if (chat.getCreatedAt() != null) {
                sb.append("  Added: ").append(CREATED_FORMAT.format(chat.getCreatedAt())).append('\n');
            }
            if (chat.getLastReportSentAt() != null) {
                sb.append("  Last report: ").append(CREATED_FORMAT.format(chat.getLastReportSentAt())).append('\n');
            }
        }
        return CommandResult.success(sb.toString().stripTrailing());
    }

    private CommandResult handleGetChatId(Map<String, Object> context) {
        String chatId = contextString(context, "chatId");
        String title = contextString(context, "chatTitle");
        String displayTitle = title != null ? title : "Unknown";
        return CommandResult.success("🆔 <b>Chat Information</b>\n\n"
                + "Chat ID: <code>" + escape(chatId) + "</code>\n"
                + "Chat Name: " + escape(displayTitle) + "\n\n"
                + "📝 Admin command:\n"
                + "<code>/add_chat " + escape(chatId) + " " + escape(displayTitle) + "</code>");
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("🛠 <b>Admin Commands</b>\n");
        for (CommandDefinition def : COMMANDS) {
            sb.append('\n').append(escape(def.usage())).append(" - ").append(def.description());
        }
        return CommandResult.success(sb.toString());
    }

    private static CommandResult invalidChatId(String raw) {
        return CommandResult.failure("❌ Invalid chat_id: '" + escape(raw) + "'\n\n"
                + "Chat ID must be a number (usually negative for groups).");
    }

    private static Long parseChatId(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String stripQuotes(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String contextString(Map<String, Object> context, String key) {
        Object value = context.get(key);
        if (value instanceof String str && !str.isBlank()) {
            return str;
        }
        return null;
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
