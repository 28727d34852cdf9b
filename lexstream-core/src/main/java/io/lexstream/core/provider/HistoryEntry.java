package io.lexstream.core.provider;

import java.util.Objects;

public record HistoryEntry(Role role, String text) {

    public HistoryEntry {
        Objects.requireNonNull(role, "role must not be null");
        text = text == null ? "" : text;
    }

    public static HistoryEntry user(String text) {
        return new HistoryEntry(Role.USER, text);
    }

    public static HistoryEntry model(String text) {
        return new HistoryEntry(Role.MODEL, text);
    }

    public enum Role {
        USER("user"),
        MODEL("model");

        private final String wireValue;

        Role(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }
}
