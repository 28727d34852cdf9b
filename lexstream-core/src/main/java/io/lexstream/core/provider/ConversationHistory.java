package io.lexstream.core.provider;

import java.util.ArrayList;
import java.util.List;

public final class ConversationHistory {
    private final List<HistoryEntry> entries = new ArrayList<>();

    public synchronized void appendUser(String text) {
        entries.add(HistoryEntry.user(text));
    }

    public synchronized void appendModel(String text) {
        entries.add(HistoryEntry.model(text));
    }

    // Drops the trailing user turn of a failed request.
    public synchronized boolean removeLastUser() {
        if (entries.isEmpty()) {
            return false;
        }
        int last = entries.size() - 1;
        if (entries.get(last).role() != HistoryEntry.Role.USER) {
            return false;
        }
        entries.remove(last);
        return true;
    }

    public synchronized List<HistoryEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
