package com.feedrelay.service.conversation;

import com.feedrelay.service.monitor.ActiveSubscription;
import com.feedrelay.service.monitor.MonitorService;
import com.feedrelay.service.monitor.StartResult;
import com.feedrelay.service.monitor.StopResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-chat dialogue that collects a start request (identity, then keywords) or a stop request
 * and hands the completed request to {@link MonitorService}.
 */
public final class ConversationManager {
    static final String WELCOME = "Welcome! Please send me the Twitter user ID you want to monitor.";
    static final String ASK_KEYWORDS =
            "Optional: Enter filter keywords separated by commas, or type 'none' to monitor all tweets.";
    static final String STARTED =
            "Configuration received. Starting tweet monitor. You will receive notifications here.";
    static final String ASK_STOP_TARGET =
            "Enter the Twitter user ID to stop monitoring, or type 'all' to stop all monitors for this chat.";
    static final String CANCELLED = "Operation cancelled.";
    static final String USAGE = "Send /start to monitor a Twitter user, /stop to end monitoring or /list to see active monitors.";

    private final MonitorService monitorService;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public ConversationManager(MonitorService monitorService) {
        this.monitorService = Objects.requireNonNull(monitorService, "monitorService is required");
    }

    /**
     * Handles one inbound message and returns the replies to send back to the chat, in order.
     */
    public List<String> handle(String chatId, String rawText) {
        String text = rawText == null ? "" : rawText.trim();
        if (text.startsWith("/")) {
            return List.of(onCommand(chatId, commandName(text)));
        }
        Pending current = pending.get(chatId);
        if (current == null) {
            return List.of(USAGE);
        }
        switch (current.stage()) {
            case AWAITING_IDENTITY:
                return List.of(onIdentity(chatId, text));
            case AWAITING_KEYWORDS:
                pending.remove(chatId);
                return List.of(onKeywords(chatId, current.sourceIdentity(), text));
            case AWAITING_STOP_TARGET:
                pending.remove(chatId);
                return List.of(onStopTarget(chatId, text));
            default:
                throw new IllegalStateException("Unhandled stage " + current.stage());
        }
    }

    Stage stageOf(String chatId) {
        Pending current = pending.get(chatId);
        return current == null ? null : current.stage();
    }

    private String onCommand(String chatId, String command) {
        switch (command) {
            case "start":
                pending.put(chatId, new Pending(Stage.AWAITING_IDENTITY, null));
                return WELCOME;
            case "stop":
                pending.put(chatId, new Pending(Stage.AWAITING_STOP_TARGET, null));
                return ASK_STOP_TARGET;
            case "cancel":
                pending.remove(chatId);
                return CANCELLED;
            case "list":
                return describeActive(chatId);
            default:
                return "Unknown command /" + command + ". " + USAGE;
        }
    }

    private String onIdentity(String chatId, String identity) {
        if (identity.isEmpty()) {
            return WELCOME;
        }
        pending.put(chatId, new Pending(Stage.AWAITING_KEYWORDS, identity));
        return ASK_KEYWORDS;
    }

    private String onKeywords(String chatId, String identity, String text) {
        StartResult result = monitorService.startMonitoring(chatId, identity, parseKeywords(text));
        if (result == StartResult.CONFLICT) {
            return "Already monitoring " + identity + " in this chat. Use /stop first to change its keywords.";
        }
        return STARTED;
    }

    private String onStopTarget(String chatId, String target) {
        StopResult result = monitorService.stopMonitoring(chatId, target);
        if (MonitorService.STOP_ALL.equalsIgnoreCase(target)) {
            return "Stopped " + result.stoppedCount() + " monitors in this chat.";
        }
        if (result.found()) {
            return "Stopped monitoring Twitter user " + target + ".";
        }
        return "No active monitor found for Twitter user " + target + ".";
    }

    private String describeActive(String chatId) {
        List<ActiveSubscription> active = monitorService.activeSubscriptions(chatId);
        if (active.isEmpty()) {
            return "No active monitors in this chat.";
        }
        StringBuilder reply = new StringBuilder("Active monitors:");
        for (ActiveSubscription subscription : active) {
            reply.append("\n- ").append(subscription.sourceIdentity());
        }
        return reply.toString();
    }

    static List<String> parseKeywords(String text) {
        if (text == null || text.isBlank() || "none".equalsIgnoreCase(text.trim())) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        for (String part : text.split(",")) {
            String keyword = part.trim();
            if (!keyword.isEmpty()) {
                keywords.add(keyword);
            }
        }
        return keywords;
    }

    // "/start@SomeBot args" -> "start"
    private static String commandName(String text) {
        String command = text.substring(1).split("\\s+", 2)[0];
        int mention = command.indexOf('@');
        if (mention >= 0) {
            command = command.substring(0, mention);
        }
        return command.toLowerCase(Locale.ROOT);
    }

    enum Stage {
        AWAITING_IDENTITY,
        AWAITING_KEYWORDS,
        AWAITING_STOP_TARGET
    }

    private record Pending(Stage stage, String sourceIdentity) {
    }
}
