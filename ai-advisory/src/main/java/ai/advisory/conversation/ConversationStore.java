package ai.advisory.conversation;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session holder of one {@link ConversationHistory} per advisor. Histories never share
 * storage, so appends for one advisor cannot disturb another.
 */
public class ConversationStore {
    private final Map<String, ConversationHistory> histories = new ConcurrentHashMap<>();

    public ConversationHistory get(String advisorName) {
        Objects.requireNonNull(advisorName, "advisorName");
        return histories.computeIfAbsent(advisorName, ConversationHistory::new);
    }

    public void append(String advisorName, Message message) {
        Objects.requireNonNull(message, "message");
        get(advisorName).append(message);
    }

    public void reset(String advisorName) {
        ConversationHistory history = histories.get(advisorName);
        if (history != null) {
            history.clear();
        }
    }

    public void resetAll() {
        histories.values().forEach(ConversationHistory::clear);
    }

    /** Ends the session: every history is destroyed. */
    public void close() {
        resetAll();
        histories.clear();
    }
}
