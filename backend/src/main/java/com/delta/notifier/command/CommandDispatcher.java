package com.delta.notifier.command;

import com.delta.notifier.config.NotifierProperties;
import com.delta.notifier.delivery.DeliveryEngine;
import com.delta.notifier.delivery.MessageSender;
import com.delta.notifier.delivery.SendException;
import com.delta.notifier.model.OnDemandResult;
import com.delta.notifier.model.OutboundMessageKind;
import com.delta.notifier.model.Subscriber;
import com.delta.notifier.service.InvalidInputException;
import com.delta.notifier.service.SubscriberNotFoundException;
import com.delta.notifier.service.SubscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Transport-agnostic chat command handling. A transport hands over the subscriber id and
 * the raw message text; the returned replies are also written through the
 * {@link MessageSender} so the outbox holds the whole conversation. Replies reach the
 * sender in the order they are returned, and ahead of any listing batches a command triggers.
 *
 * <p>{@code /settime} and {@code /setfrequency} without an argument open a prompt. While a
 * prompt is open, plain text is read as the answer; an invalid answer keeps the prompt open
 * and any command closes it.
 */
@Service
public class CommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    static final String WELCOME = """
        Welcome to the listing notifier! You have been subscribed to updates.
        Use /settime to set your preferred update time.
        Use /setfrequency to set how often you want to receive updates.
        Use /updates [number] to get the latest listings immediately.""";
    static final String HELP = """
        /start - Subscribe to updates
        /stop - Unsubscribe from updates
        /settime - Set your preferred update time
        /setfrequency - Set how often you want to receive updates
        /updates [number] - Get the latest listings immediately (optional number of listings)
        /help - Show this help message""";
    static final String UNSUBSCRIBED = "You have been unsubscribed from updates.";
    static final String TIME_PROMPT = "Please enter the time you want to receive updates each day (in HH:MM format, UTC):";
    static final String FREQUENCY_PROMPT = "Please enter how often you want to receive updates (in hours, e.g., 8, 12, 24):";
    static final String INVALID_TIME = "Invalid time format. Please enter in HH:MM format (e.g., 21:00).";
    static final String INVALID_FREQUENCY = "Invalid input. Please enter a positive integer (e.g., 8, 12, 24).";
    static final String INVALID_COUNT = "Please enter a positive number of listings.";
    static final String NO_LISTINGS = "No listings found.";
    static final String NOT_SUBSCRIBED = "You are not subscribed yet. Use /start to subscribe first.";
    static final String UNKNOWN = "Unknown command. Use /help to see the available commands.";

    private final SubscriptionService subscriptionService;
    private final DeliveryEngine deliveryEngine;
    private final ConversationSessions sessions;
    private final MessageSender sender;
    private final NotifierProperties properties;

    public CommandDispatcher(
        SubscriptionService subscriptionService,
        DeliveryEngine deliveryEngine,
        ConversationSessions sessions,
        MessageSender sender,
        NotifierProperties properties
    ) {
        this.subscriptionService = subscriptionService;
        this.deliveryEngine = deliveryEngine;
        this.sessions = sessions;
        this.sender = sender;
        this.properties = properties;
    }

    public List<String> handle(String subscriberId, String text) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_VALUE, "subscriber id is required");
        }
        String id = subscriberId.trim();
        String message = text == null ? "" : text.trim();
        List<String> replies = new ArrayList<>();
        List<String> remaining = message.startsWith("/")
            ? handleCommand(id, message, replies)
            : handleAnswer(id, message);
        for (String pending : remaining) {
            reply(id, pending, replies);
        }
        return replies;
    }

    private void reply(String subscriberId, String text, List<String> replies) {
        replies.add(text);
        try {
            sender.send(subscriberId, OutboundMessageKind.REPLY, text);
        } catch (SendException | RuntimeException e) {
            log.error("Failed to send reply to subscriber {}", subscriberId, e);
        }
    }

    // Replies already sent go into sent; the returned ones are sent by the caller.
    private List<String> handleCommand(String subscriberId, String message, List<String> sent) {
        sessions.clear(subscriberId);
        String[] parts = message.split("\\s+", 2);
        String command = stripBotSuffix(parts[0].toLowerCase(Locale.ROOT));
        String argument = parts.length > 1 ? parts[1].trim() : "";

        switch (command) {
            case "/start":
                subscriptionService.subscribe(subscriberId);
                return List.of(WELCOME);
            case "/stop":
                subscriptionService.unsubscribe(subscriberId);
                return List.of(UNSUBSCRIBED);
            case "/help":
                return List.of(HELP);
            case "/settime":
                if (argument.isEmpty()) {
                    return openPrompt(subscriberId, ConversationState.AWAITING_TIME, TIME_PROMPT);
                }
                return applyTime(subscriberId, argument);
            case "/setfrequency":
                if (argument.isEmpty()) {
                    return openPrompt(subscriberId, ConversationState.AWAITING_FREQUENCY, FREQUENCY_PROMPT);
                }
                return applyFrequency(subscriberId, argument);
            case "/updates":
                return onDemand(subscriberId, argument, sent);
            default:
                return List.of(UNKNOWN);
        }
    }

    private List<String> handleAnswer(String subscriberId, String message) {
        Optional<ConversationState> state = sessions.current(subscriberId);
        if (state.isEmpty()) {
            return List.of(UNKNOWN);
        }
        if (state.get() == ConversationState.AWAITING_TIME) {
            return applyTime(subscriberId, message);
        }
        return applyFrequency(subscriberId, message);
    }

    private List<String> openPrompt(String subscriberId, ConversationState state, String prompt) {
        if (!subscriptionService.isSubscribed(subscriberId)) {
            return List.of(NOT_SUBSCRIBED);
        }
        sessions.await(subscriberId, state);
        return List.of(prompt);
    }

    private List<String> applyTime(String subscriberId, String value) {
        try {
            Subscriber updated = subscriptionService.setTime(subscriberId, value);
            sessions.clear(subscriberId);
            return List.of("Your update time has been set to " + HH_MM.format(updated.notifyTime()) + " UTC.");
        } catch (InvalidInputException e) {
            sessions.await(subscriberId, ConversationState.AWAITING_TIME);
            return List.of(INVALID_TIME);
        } catch (SubscriberNotFoundException e) {
            sessions.clear(subscriberId);
            return List.of(NOT_SUBSCRIBED);
        }
    }

    private List<String> applyFrequency(String subscriberId, String value) {
        try {
            Subscriber updated = subscriptionService.setFrequency(subscriberId, value);
            sessions.clear(subscriberId);
            return List.of("Your update frequency has been set to every " + updated.repeatIntervalHours() + " hours.");
        } catch (InvalidInputException e) {
            sessions.await(subscriberId, ConversationState.AWAITING_FREQUENCY);
            return List.of(INVALID_FREQUENCY);
        } catch (SubscriberNotFoundException e) {
            sessions.clear(subscriberId);
            return List.of(NOT_SUBSCRIBED);
        }
    }

    private List<String> onDemand(String subscriberId, String argument, List<String> sent) {
        Integer count = null;
        if (!argument.isEmpty()) {
            try {
                count = Integer.parseInt(argument.split("\\s+")[0]);
            } catch (NumberFormatException e) {
                return List.of("Please provide a valid number of listings.");
            }
        }
        if (count != null && count <= 0) {
            return List.of(INVALID_COUNT);
        }
        int maxCount = properties.getOnDemand().getMaxCount();
        if (count != null && count > maxCount) {
            reply(subscriberId, "Limiting to the first " + maxCount + " listings.", sent);
        }
        OnDemandResult result;
        try {
            result = deliveryEngine.deliverOnDemand(subscriberId, count);
        } catch (InvalidInputException e) {
            return List.of(INVALID_COUNT);
        }
        return result.isEmpty() ? List.of(NO_LISTINGS) : List.of();
    }

    // Group chats address commands as /command@botname.
    private String stripBotSuffix(String command) {
        int at = command.indexOf('@');
        return at < 0 ? command : command.substring(0, at);
    }
}
