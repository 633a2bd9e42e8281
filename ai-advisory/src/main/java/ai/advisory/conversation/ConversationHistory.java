package ai.advisory.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered message log of a single advisor. Only {@link ConversationStore} mutates the
 * stored instance; {@link #extendedWith(Message)} produces detached copies for dispatch.
 */
public final class ConversationHistory {
    private final String advisorName;
    private final List<Message> messages;

    ConversationHistory(String advisorName) {
        this(advisorName, new ArrayList<>());
    }

    private ConversationHistory(String advisorName, List<Message> messages) {
        this.advisorName = Objects.requireNonNull(advisorName, "advisorName");
        this.messages = messages;
    }

    public static ConversationHistory detached(String advisorName, List<Message> messages) {
        return new ConversationHistory(advisorName, new ArrayList<>(messages));
    }

    public String advisorName() {
        return advisorName;
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized boolean isEmpty() {
        return messages.isEmpty();
    }

    public synchronized ConversationHistory extendedWith(Message next) {
        List<Message> copy = new ArrayList<>(messages.size() + 1);
        copy.addAll(messages);
        copy.add(Objects.requireNonNull(next, "next"));
        return new ConversationHistory(advisorName, copy);
    }

    synchronized void append(Message message) {
        messages.add(message);
    }

    synchronized void clear() {
        messages.clear();
    }

    @Override
    public String toString() {
        return "ConversationHistory{advisor=" + advisorName + ", size=" + size() + "}";
    }
}
