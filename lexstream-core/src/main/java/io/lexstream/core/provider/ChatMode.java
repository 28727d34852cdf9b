package io.lexstream.core.provider;

import io.lexstream.core.model.AssembledResponse;
import io.lexstream.core.response.ResponseSplitter;
import java.util.Locale;

public enum ChatMode {
    GENERAL("a legal research assistant. Answer precisely and in plain language."),
    CONTRACTS("a contracts specialist. Focus on clauses, obligations, risks and negotiation points."),
    CASE_LAW("a case law researcher. Identify the controlling decisions, their holdings and how courts apply them."),
    REGULATIONS("a regulatory compliance analyst. Identify the applicable statutes and regulations and what they require.");

    private final String role;

    ChatMode(String role) {
        this.role = role;
    }

    public String systemInstruction() {
        return "You are " + role + "\n"
            + "Use web search to ground every factual statement and cite sources inline as [1], [2] in the order "
            + "they are first used. Do not list the sources or their URLs at the end of the answer.\n"
            + "After the answer, write a line containing only " + ResponseSplitter.SENTINEL
            + " followed by up to " + AssembledResponse.MAX_FOLLOW_UPS + " short follow-up questions the user might ask next, one per line, "
            + "without numbering.";
    }

    public static ChatMode parse(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
